package io.evitadb.polyglot.merge;

import io.evitadb.polyglot.model.LanguageCodes;
import io.evitadb.polyglot.model.RowTemplate;
import io.evitadb.polyglot.model.TargetLanguage;

import javax.annotation.Nonnull;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Input of the merge engine.
 *
 * Row 0 of the matrix is the header row; data rows start at index 1. Templates are keyed by the
 * matrix row they were built from; a data row without a template is treated as a row without
 * translatable segments.
 *
 * @param matrix         original document matrix, never modified
 * @param templatesByRow row templates keyed by matrix row index
 * @param translations   translation keyed by segment id, per target language code (normalized on creation)
 * @param targets        target languages with their column and overwrite policy
 * @param verbatimRows   matrix rows whose source is copied to every language unchanged
 * @param sourceColumn   column holding the source content
 */
public record MergeRequest(
	@Nonnull List<List<String>> matrix,
	@Nonnull Map<Integer, RowTemplate> templatesByRow,
	@Nonnull Map<String, Map<String, String>> translations,
	@Nonnull List<TargetLanguage> targets,
	@Nonnull Set<Integer> verbatimRows,
	int sourceColumn
) {

	/**
	 * Column holding the source content in the document layout used by the import tooling.
	 */
	public static final int DEFAULT_SOURCE_COLUMN = 3;

	public MergeRequest {
		Objects.requireNonNull(matrix, "matrix must not be null");
		Objects.requireNonNull(templatesByRow, "templatesByRow must not be null");
		Objects.requireNonNull(translations, "translations must not be null");
		Objects.requireNonNull(targets, "targets must not be null");
		Objects.requireNonNull(verbatimRows, "verbatimRows must not be null");
		if (sourceColumn < 0) {
			throw new IllegalArgumentException("sourceColumn must not be negative");
		}
		if (matrix.isEmpty()) {
			throw new IllegalArgumentException("matrix must contain at least the header row");
		}
		// matrix cells may be null, so the matrix itself is only wrapped
		matrix = Collections.unmodifiableList(matrix);
		templatesByRow = Map.copyOf(templatesByRow);
		final Map<String, Map<String, String>> byLanguage = new LinkedHashMap<>();
		for (final Map.Entry<String, Map<String, String>> entry : translations.entrySet()) {
			byLanguage.put(LanguageCodes.normalize(entry.getKey()), entry.getValue());
		}
		translations = Collections.unmodifiableMap(byLanguage);
		targets = List.copyOf(targets);
		verbatimRows = Set.copyOf(verbatimRows);
	}

	/**
	 * Creates a request using {@link #DEFAULT_SOURCE_COLUMN}.
	 *
	 * @param matrix         original document matrix
	 * @param templatesByRow row templates keyed by matrix row index
	 * @param translations   translation keyed by segment id, per target language code
	 * @param targets        target languages
	 * @param verbatimRows   matrix rows copied unchanged
	 * @return the request
	 */
	@Nonnull
	public static MergeRequest of(
		@Nonnull List<List<String>> matrix,
		@Nonnull Map<Integer, RowTemplate> templatesByRow,
		@Nonnull Map<String, Map<String, String>> translations,
		@Nonnull List<TargetLanguage> targets,
		@Nonnull Set<Integer> verbatimRows
	) {
		return new MergeRequest(matrix, templatesByRow, translations, targets, verbatimRows, DEFAULT_SOURCE_COLUMN);
	}
}
