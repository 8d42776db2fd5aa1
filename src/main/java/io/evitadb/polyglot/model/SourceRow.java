package io.evitadb.polyglot.model;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Immutable input row handed to the segmenter.
 *
 * @param rowIndex index of the row in the source document matrix
 * @param content  raw cell content, plain text or markup
 */
public record SourceRow(int rowIndex, @Nonnull String content) {

	public SourceRow {
		Objects.requireNonNull(content, "content must not be null");
	}
}
