package io.evitadb.polyglot.merge;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * One merge decision for one row and language.
 *
 * @param rowIndex       row of the document matrix
 * @param language       target language code
 * @param action         what happened with the cell
 * @param reason         why
 * @param contentPreview first characters of the written value, empty for skipped cells
 */
public record AuditEntry(
	int rowIndex,
	@Nonnull String language,
	@Nonnull MergeAction action,
	@Nonnull MergeReason reason,
	@Nonnull String contentPreview
) {

	/**
	 * Maximal length of {@link #contentPreview()}.
	 */
	public static final int PREVIEW_LENGTH = 100;

	public AuditEntry {
		Objects.requireNonNull(language, "language must not be null");
		Objects.requireNonNull(action, "action must not be null");
		Objects.requireNonNull(reason, "reason must not be null");
		Objects.requireNonNull(contentPreview, "contentPreview must not be null");
		if (contentPreview.length() > PREVIEW_LENGTH) {
			contentPreview = contentPreview.substring(0, PREVIEW_LENGTH);
		}
	}
}
