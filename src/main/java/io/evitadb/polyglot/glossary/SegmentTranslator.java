package io.evitadb.polyglot.glossary;

import javax.annotation.Nonnull;

/**
 * Injectable machine translation function.
 *
 * Implementations receive text in which glossary terms are already replaced by `__GLOSS_<n>__`
 * tokens and must return those tokens unchanged.
 */
@FunctionalInterface
public interface SegmentTranslator {
	/**
	 * Translates a single text.
	 *
	 * @param text           text to translate
	 * @param sourceLanguage language of the text
	 * @param targetLanguage requested language
	 * @return translated text
	 * @throws SegmentTranslationException when the text could not be translated
	 */
	@Nonnull
	String translate(
		@Nonnull String text,
		@Nonnull String sourceLanguage,
		@Nonnull String targetLanguage
	) throws SegmentTranslationException;
}
