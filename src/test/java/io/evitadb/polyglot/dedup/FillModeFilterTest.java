package io.evitadb.polyglot.dedup;

import io.evitadb.polyglot.model.ExtractedSegment;
import io.evitadb.polyglot.model.OverwritePolicy;
import io.evitadb.polyglot.model.SegmentationResult;
import io.evitadb.polyglot.model.SourceRow;
import io.evitadb.polyglot.model.TargetLanguage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FillModeFilter")
class FillModeFilterTest {

	private static final List<List<String>> MATRIX = List.of(
		List.of("id", "key", "type", "en-GB", "fr-FR"),
		List.of("1", "greeting", "TEXT", "Hello", "Bonjour"),
		List.of("2", "planet", "TEXT", "World", ""),
		List.of("3", "farewell", "TEXT", "Bye", "=TRANSLATE(D4,\"en\",\"fr\")")
	);
	private static final List<SourceRow> ROWS = List.of(
		new SourceRow(1, "Hello"),
		new SourceRow(2, "World"),
		new SourceRow(3, "Bye")
	);

	@Test
	@DisplayName("skips rows already filled for every target")
	void shouldSkipFilledRows() {
		final FillModeFilter.Result result = FillModeFilter.filterRows(
			ROWS, MATRIX, List.of(TargetLanguage.existing("fr-FR", 4, OverwritePolicy.FILL_EMPTY))
		);

		assertEquals(List.of(ROWS.get(1), ROWS.get(2)), result.rowsToTranslate());
		assertEquals(1, result.skippedCount());
	}

	@Test
	@DisplayName("keeps every row when a target still needs its column")
	void shouldKeepRowsForNewColumn() {
		final FillModeFilter.Result result = FillModeFilter.filterRows(ROWS, MATRIX, List.of(
			TargetLanguage.existing("fr-FR", 4, OverwritePolicy.FILL_EMPTY),
			TargetLanguage.newColumn("de-DE", OverwritePolicy.FILL_EMPTY)
		));

		assertEquals(3, result.rowsToTranslate().size());
		assertEquals(0, result.skippedCount());
	}

	@Test
	@DisplayName("keeps every row for overwrite-all and skips filled rows for keep")
	void shouldFollowPolicy() {
		assertTrue(FillModeFilter.needsTranslation(1, MATRIX,
			List.of(TargetLanguage.existing("fr-FR", 4, OverwritePolicy.OVERWRITE_ALL))));
		assertFalse(FillModeFilter.needsTranslation(1, MATRIX,
			List.of(TargetLanguage.existing("fr-FR", 4, OverwritePolicy.KEEP))));
		assertTrue(FillModeFilter.needsTranslation(3, MATRIX,
			List.of(TargetLanguage.existing("fr-FR", 4, OverwritePolicy.KEEP))));
	}

	@Test
	@DisplayName("drops unique strings whose every occurrence is filled")
	void shouldFilterIndex() {
		final UniqueStringIndex index = Deduplicator.index(new SegmentationResult(List.of(
			new ExtractedSegment("T1", 1, "Hello"),
			new ExtractedSegment("T2", 2, "World")
		), List.of()));

		final UniqueStringIndex filtered = FillModeFilter.filterIndex(
			index, List.of(MATRIX), List.of(TargetLanguage.existing("fr-FR", 4, OverwritePolicy.FILL_EMPTY))
		);

		assertEquals(List.of("World"), filtered.texts());
	}
}
