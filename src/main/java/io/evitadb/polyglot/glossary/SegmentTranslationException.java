package io.evitadb.polyglot.glossary;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

/**
 * Exception thrown by a {@link SegmentTranslator} when a text could not be translated.
 * The failure is local to the text: other texts of the batch are still translated.
 */
public final class SegmentTranslationException extends Exception {

	public SegmentTranslationException(@Nonnull String message) {
		super(message);
	}

	public SegmentTranslationException(@Nonnull String message, @Nullable Throwable cause) {
		super(message, cause);
	}
}
