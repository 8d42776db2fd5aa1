package io.evitadb.polyglot.glossary;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Translated text of one segment together with its origin.
 *
 * @param text   the translation, or the failure sentinel for {@link TranslationOrigin#FAILED}
 * @param origin where the translation came from
 */
public record SegmentTranslation(@Nonnull String text, @Nonnull TranslationOrigin origin) {

	/**
	 * Opening part of the sentinel written in place of a failed translation.
	 */
	public static final String FAILURE_PREFIX = "[Translation failed: ";
	/**
	 * Closing part of the failure sentinel.
	 */
	public static final String FAILURE_SUFFIX = "]";

	public SegmentTranslation {
		Objects.requireNonNull(text, "text must not be null");
		Objects.requireNonNull(origin, "origin must not be null");
	}

	/**
	 * Creates a failed translation carrying the visible sentinel.
	 *
	 * @param message failure description
	 * @return failed translation
	 */
	@Nonnull
	public static SegmentTranslation failed(@Nonnull String message) {
		return new SegmentTranslation(FAILURE_PREFIX + message + FAILURE_SUFFIX, TranslationOrigin.FAILED);
	}

	/**
	 * Returns true if the text is a failure sentinel.
	 *
	 * @param text text to check
	 * @return true when the text starts with {@link #FAILURE_PREFIX}
	 */
	public static boolean isFailureSentinel(@Nonnull String text) {
		return text.startsWith(FAILURE_PREFIX);
	}

	public boolean isFailed() {
		return this.origin == TranslationOrigin.FAILED;
	}
}
