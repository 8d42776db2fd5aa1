package io.evitadb.polyglot.merge;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;

/**
 * Output of the merge engine.
 *
 * @param matrix the merged document matrix, a copy independent of the input
 * @param audit  decisions and warnings
 */
public record MergeResult(@Nonnull List<List<String>> matrix, @Nonnull MergeAudit audit) {

	public MergeResult {
		Objects.requireNonNull(matrix, "matrix must not be null");
		Objects.requireNonNull(audit, "audit must not be null");
	}

	/**
	 * Returns the value of a merged cell.
	 *
	 * @param row    row index
	 * @param column column index
	 * @return the value, null when the row is shorter
	 */
	@Nullable
	public String cell(int row, int column) {
		final List<String> values = this.matrix.get(row);
		return column < values.size() ? values.get(column) : null;
	}
}
