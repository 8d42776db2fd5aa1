package io.evitadb.polyglot.glossary;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Result of applying a glossary to one segment.
 *
 * Either the whole segment matched a glossary entry, in which case {@link #fullMatchTranslation()}
 * holds the target value and nothing has to be translated, or {@link #processedText()} is the text
 * to send for translation with embedded glossary terms replaced by `__GLOSS_<n>__` tokens.
 *
 * @param processedText        text to translate, embedded terms replaced by placeholders
 * @param substitutions        glossary target value keyed by placeholder, in placeholder order
 * @param fullMatchTranslation target value when the whole segment is a glossary term, otherwise null
 */
public record GlossarySubstitution(
	@Nonnull String processedText,
	@Nonnull Map<String, String> substitutions,
	@Nullable String fullMatchTranslation
) {

	public GlossarySubstitution {
		Objects.requireNonNull(processedText, "processedText must not be null");
		Objects.requireNonNull(substitutions, "substitutions must not be null");
		substitutions = Collections.unmodifiableMap(new LinkedHashMap<>(substitutions));
	}

	/**
	 * Creates a result for a segment matching a glossary entry as a whole.
	 *
	 * @param text        the segment text
	 * @param translation the glossary target value
	 * @return full-match result
	 */
	@Nonnull
	public static GlossarySubstitution fullMatch(@Nonnull String text, @Nonnull String translation) {
		return new GlossarySubstitution(text, Map.of(), Objects.requireNonNull(translation, "translation must not be null"));
	}

	/**
	 * Creates a result for a segment without any glossary term.
	 *
	 * @param text the segment text
	 * @return result without substitutions
	 */
	@Nonnull
	public static GlossarySubstitution none(@Nonnull String text) {
		return new GlossarySubstitution(text, Map.of(), null);
	}

	public boolean isFullMatch() {
		return this.fullMatchTranslation != null;
	}

	public boolean hasSubstitutions() {
		return !this.substitutions.isEmpty();
	}

	/**
	 * Replaces the placeholders in the translated text with their glossary target values.
	 *
	 * @param translatedText text returned by the translation provider
	 * @return text with glossary values restored
	 */
	@Nonnull
	public String restore(@Nonnull String translatedText) {
		return GlossarySubstitutor.restore(translatedText, this.substitutions);
	}
}
