package io.evitadb.polyglot.merge;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Problem with the translation of a single segment found while rebuilding a row.
 *
 * @param rowIndex  row of the document matrix
 * @param language  target language code
 * @param segmentId id of the affected segment
 * @param kind      what is wrong
 */
public record IntegrityWarning(
	int rowIndex,
	@Nonnull String language,
	@Nonnull String segmentId,
	@Nonnull Kind kind
) {

	/**
	 * Kind of integrity problem.
	 */
	public enum Kind {
		/**
		 * The translation table has no entry for the segment; an empty string was substituted.
		 */
		MISSING_TRANSLATION,
		/**
		 * The translation is a failure sentinel; it was written so the cell can be reviewed.
		 */
		FAILED_TRANSLATION
	}

	public IntegrityWarning {
		Objects.requireNonNull(language, "language must not be null");
		Objects.requireNonNull(segmentId, "segmentId must not be null");
		Objects.requireNonNull(kind, "kind must not be null");
	}
}
