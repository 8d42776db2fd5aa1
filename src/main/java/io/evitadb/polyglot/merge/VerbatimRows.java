package io.evitadb.polyglot.merge;

import javax.annotation.Nonnull;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Derives the rows whose source content is copied to every language without translation from a
 * field-type column, such as rows typed `URL`.
 */
public final class VerbatimRows {

	/**
	 * Column holding the field type in the document layout used by the import tooling.
	 */
	public static final int DEFAULT_FIELD_TYPE_COLUMN = 2;
	/**
	 * Field type of rows holding links.
	 */
	public static final String URL = "URL";

	private VerbatimRows() {
		// utility class
	}

	/**
	 * Returns the data rows whose field-type cell equals the given type, ignoring case.
	 *
	 * @param matrix    document matrix, row 0 is the header
	 * @param column    field-type column
	 * @param fieldType field type marking verbatim rows
	 * @return matrix row indexes in ascending order
	 */
	@Nonnull
	public static Set<Integer> fromFieldType(
		@Nonnull List<List<String>> matrix,
		int column,
		@Nonnull String fieldType
	) {
		Objects.requireNonNull(matrix, "matrix must not be null");
		Objects.requireNonNull(fieldType, "fieldType must not be null");
		if (column < 0) {
			throw new IllegalArgumentException("column must not be negative");
		}
		final String expected = fieldType.trim().toUpperCase(Locale.ROOT);
		final Set<Integer> rows = new LinkedHashSet<>();
		for (int row = 1; row < matrix.size(); row++) {
			final List<String> values = matrix.get(row);
			if (values == null || column >= values.size() || values.get(column) == null) {
				continue;
			}
			if (values.get(column).trim().toUpperCase(Locale.ROOT).equals(expected)) {
				rows.add(row);
			}
		}
		return rows;
	}
}
