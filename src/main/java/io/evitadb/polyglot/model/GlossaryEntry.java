package io.evitadb.polyglot.model;

import javax.annotation.Nonnull;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One glossary concept: the same term expressed in several languages. All languages are equal,
 * any of them can act as the source side of a lookup.
 *
 * @param translations literal term keyed by normalized language code
 */
public record GlossaryEntry(@Nonnull Map<String, String> translations) {

	public GlossaryEntry {
		Objects.requireNonNull(translations, "translations must not be null");
		final Map<String, String> normalized = new LinkedHashMap<>();
		for (final Map.Entry<String, String> entry : translations.entrySet()) {
			final String language = LanguageCodes.normalize(entry.getKey());
			if (!language.isEmpty() && entry.getValue() != null && !entry.getValue().isBlank()) {
				normalized.putIfAbsent(language, entry.getValue());
			}
		}
		translations = Map.copyOf(normalized);
	}

	/**
	 * Convenience factory for a two-language entry.
	 *
	 * @param firstLanguage  first language code
	 * @param firstTerm      term in the first language
	 * @param secondLanguage second language code
	 * @param secondTerm     term in the second language
	 * @return the glossary entry
	 */
	@Nonnull
	public static GlossaryEntry of(
		@Nonnull String firstLanguage,
		@Nonnull String firstTerm,
		@Nonnull String secondLanguage,
		@Nonnull String secondTerm
	) {
		final Map<String, String> translations = new LinkedHashMap<>();
		translations.put(firstLanguage, firstTerm);
		translations.put(secondLanguage, secondTerm);
		return new GlossaryEntry(translations);
	}

	/**
	 * Returns the term for the language.
	 *
	 * @param language language code, normalized before lookup
	 * @return the term, empty when the entry has no value for the language
	 */
	@Nonnull
	public Optional<String> term(@Nonnull String language) {
		return Optional.ofNullable(this.translations.get(LanguageCodes.normalize(language)));
	}
}
