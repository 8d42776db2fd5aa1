package io.evitadb.polyglot.glossary;

import org.apache.maven.plugin.logging.Log;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Translates segment texts with glossary assistance.
 *
 * A full glossary match is returned without calling the {@link SegmentTranslator}. Otherwise the
 * text with embedded glossary tokens is translated and the tokens are restored afterwards. A failed
 * translation yields the visible sentinel `[Translation failed: <message>]` instead of an exception,
 * so one failed text never stops a batch.
 */
public final class GlossaryTranslator {

	@Nonnull
	private final GlossarySubstitutor substitutor;
	@Nonnull
	private final SegmentTranslator translator;
	@Nonnull
	private final Log log;

	/**
	 * Creates a glossary-assisted translator.
	 *
	 * @param substitutor glossary substitutor
	 * @param translator  machine translation function
	 * @param log         Maven log for failed translations
	 */
	public GlossaryTranslator(
		@Nonnull GlossarySubstitutor substitutor,
		@Nonnull SegmentTranslator translator,
		@Nonnull Log log
	) {
		this.substitutor = Objects.requireNonNull(substitutor, "substitutor must not be null");
		this.translator = Objects.requireNonNull(translator, "translator must not be null");
		this.log = Objects.requireNonNull(log, "log must not be null");
	}

	/**
	 * Returns the glossary value if the whole text matches a glossary entry.
	 *
	 * @param text           segment text
	 * @param sourceLanguage language of the text
	 * @param targetLanguage requested language
	 * @return glossary translation, or null when there is no full match
	 */
	@Nullable
	public SegmentTranslation fromGlossary(
		@Nonnull String text,
		@Nonnull String sourceLanguage,
		@Nonnull String targetLanguage
	) {
		return this.substitutor.findFullMatch(text, sourceLanguage, targetLanguage)
			.map(value -> new SegmentTranslation(value, TranslationOrigin.GLOSSARY))
			.orElse(null);
	}

	/**
	 * Translates the text.
	 *
	 * @param text           segment text
	 * @param sourceLanguage language of the text
	 * @param targetLanguage requested language
	 * @return translation with its origin, never null
	 */
	@Nonnull
	public SegmentTranslation translate(
		@Nonnull String text,
		@Nonnull String sourceLanguage,
		@Nonnull String targetLanguage
	) {
		final GlossarySubstitution substitution = this.substitutor.substitute(text, sourceLanguage, targetLanguage);
		if (substitution.isFullMatch()) {
			return new SegmentTranslation(substitution.fullMatchTranslation(), TranslationOrigin.GLOSSARY);
		}
		try {
			final String translated = this.translator.translate(
				substitution.processedText(), sourceLanguage, targetLanguage
			);
			return new SegmentTranslation(substitution.restore(translated), TranslationOrigin.MACHINE);
		} catch (SegmentTranslationException e) {
			this.log.error("Translation to " + targetLanguage + " failed for \"" + text + "\": " + e.getMessage());
			return SegmentTranslation.failed(e.getMessage());
		}
	}
}
