package io.evitadb.polyglot.dedup;

import io.evitadb.polyglot.merge.TranslationFormulas;
import io.evitadb.polyglot.model.OverwritePolicy;
import io.evitadb.polyglot.model.SourceRow;
import io.evitadb.polyglot.model.TargetLanguage;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Skips work whose result the merge step would throw away.
 *
 * A row needs translation unless, for every target language, the language already has a column,
 * its policy never replaces real content (`keep` or `fill-empty`) and the row's cell in that column
 * holds real content. Blank cells and unresolved translation formulas always need translation.
 */
public final class FillModeFilter {

	private FillModeFilter() {
		// utility class
	}

	/**
	 * Result of filtering rows.
	 *
	 * @param rowsToTranslate rows that still need translation, in input order
	 * @param skippedCount    number of rows skipped
	 */
	public record Result(@Nonnull List<SourceRow> rowsToTranslate, int skippedCount) {

		public Result {
			Objects.requireNonNull(rowsToTranslate, "rowsToTranslate must not be null");
			rowsToTranslate = List.copyOf(rowsToTranslate);
		}
	}

	/**
	 * Filters rows of one document.
	 *
	 * @param rows    rows to filter
	 * @param matrix  the document matrix the rows come from
	 * @param targets target languages of the merge
	 * @return rows that need translation and the number of skipped rows
	 */
	@Nonnull
	public static Result filterRows(
		@Nonnull List<SourceRow> rows,
		@Nonnull List<List<String>> matrix,
		@Nonnull List<TargetLanguage> targets
	) {
		Objects.requireNonNull(rows, "rows must not be null");
		Objects.requireNonNull(matrix, "matrix must not be null");
		Objects.requireNonNull(targets, "targets must not be null");
		final List<SourceRow> kept = new ArrayList<>(rows.size());
		int skipped = 0;
		for (final SourceRow row : rows) {
			if (needsTranslation(row.rowIndex(), matrix, targets)) {
				kept.add(row);
			} else {
				skipped++;
			}
		}
		return new Result(kept, skipped);
	}

	/**
	 * Drops distinct texts none of whose occurrences needs translation.
	 *
	 * @param index    unique string index of the batch
	 * @param matrices document matrices, indexed like the documents of the index
	 * @param targets  target languages of the merge
	 * @return filtered index
	 */
	@Nonnull
	public static UniqueStringIndex filterIndex(
		@Nonnull UniqueStringIndex index,
		@Nonnull List<List<List<String>>> matrices,
		@Nonnull List<TargetLanguage> targets
	) {
		Objects.requireNonNull(index, "index must not be null");
		Objects.requireNonNull(matrices, "matrices must not be null");
		Objects.requireNonNull(targets, "targets must not be null");
		final List<String> satisfied = new ArrayList<>();
		for (final UniqueStringRecord record : index.records()) {
			boolean needed = false;
			for (final Occurrence occurrence : record.occurrences()) {
				final List<List<String>> matrix = occurrence.documentIndex() < matrices.size()
					? matrices.get(occurrence.documentIndex())
					: List.of();
				if (needsTranslation(occurrence.rowIndex(), matrix, targets)) {
					needed = true;
					break;
				}
			}
			if (!needed) {
				satisfied.add(record.text());
			}
		}
		return index.without(satisfied);
	}

	/**
	 * Returns true if the merge step could write a translation into the row for some target.
	 *
	 * @param rowIndex row to check
	 * @param matrix   document matrix
	 * @param targets  target languages
	 * @return true when the row needs translation
	 */
	public static boolean needsTranslation(
		int rowIndex,
		@Nonnull List<List<String>> matrix,
		@Nonnull List<TargetLanguage> targets
	) {
		for (final TargetLanguage target : targets) {
			if (!target.isExisting() || target.policy() == OverwritePolicy.OVERWRITE_ALL) {
				return true;
			}
			if (TranslationFormulas.isBlankOrFormula(cell(matrix, rowIndex, target.existingColumn()))) {
				return true;
			}
		}
		return false;
	}

	@Nullable
	private static String cell(@Nonnull List<List<String>> matrix, int rowIndex, int column) {
		if (rowIndex < 0 || rowIndex >= matrix.size()) {
			return null;
		}
		final List<String> row = matrix.get(rowIndex);
		return row == null || column >= row.size() ? null : row.get(column);
	}
}
