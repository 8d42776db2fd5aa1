package io.evitadb.polyglot.merge;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("VerbatimRows")
class VerbatimRowsTest {

	@Test
	@DisplayName("selects data rows of the given field type")
	void shouldSelectRowsByFieldType() {
		final List<List<String>> matrix = List.of(
			List.of("id", "key", "URL"),
			List.of("1", "home", "url"),
			List.of("2", "docs", " URL "),
			List.of("3", "title", "TEXT"),
			List.of("4")
		);

		assertEquals(Set.of(1, 2), VerbatimRows.fromFieldType(matrix, VerbatimRows.DEFAULT_FIELD_TYPE_COLUMN, VerbatimRows.URL));
	}

	@Test
	@DisplayName("rejects a negative column")
	void shouldRejectNegativeColumn() {
		assertThrows(IllegalArgumentException.class, () -> VerbatimRows.fromFieldType(List.of(), -1, "URL"));
	}
}
