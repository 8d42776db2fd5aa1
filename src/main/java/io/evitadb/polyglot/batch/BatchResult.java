package io.evitadb.polyglot.batch;

import io.evitadb.polyglot.dedup.UniqueStringIndex;
import io.evitadb.polyglot.glossary.SegmentTranslation;

import javax.annotation.Nonnull;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Translations of the unique strings of a batch.
 *
 * @param translations translation keyed by unique text, per target language code
 * @param stats        statistics per target language code
 */
public record BatchResult(
	@Nonnull Map<String, Map<String, SegmentTranslation>> translations,
	@Nonnull Map<String, LanguageStats> stats
) {

	public BatchResult {
		Objects.requireNonNull(translations, "translations must not be null");
		Objects.requireNonNull(stats, "stats must not be null");
		final Map<String, Map<String, SegmentTranslation>> copy = new LinkedHashMap<>();
		for (final Map.Entry<String, Map<String, SegmentTranslation>> entry : translations.entrySet()) {
			copy.put(entry.getKey(), Collections.unmodifiableMap(new LinkedHashMap<>(entry.getValue())));
		}
		translations = Collections.unmodifiableMap(copy);
		stats = Collections.unmodifiableMap(new LinkedHashMap<>(stats));
	}

	/**
	 * Returns the translated text of every unique string for one language.
	 *
	 * @param language target language code
	 * @return translated text keyed by unique text, empty for an unknown language
	 */
	@Nonnull
	public Map<String, String> textsFor(@Nonnull String language) {
		final Map<String, String> texts = new LinkedHashMap<>();
		final Map<String, SegmentTranslation> byText = this.translations.getOrDefault(language, Map.of());
		for (final Map.Entry<String, SegmentTranslation> entry : byText.entrySet()) {
			texts.put(entry.getKey(), entry.getValue().text());
		}
		return texts;
	}

	/**
	 * Hands the translations back to every occurrence of every unique string.
	 *
	 * @param index the index the batch was translated from
	 * @return per document index, per language code, translation keyed by segment id
	 */
	@Nonnull
	public Map<Integer, Map<String, Map<String, String>>> distribute(@Nonnull UniqueStringIndex index) {
		Objects.requireNonNull(index, "index must not be null");
		final Map<Integer, Map<String, Map<String, String>>> result = new TreeMap<>();
		for (final String language : this.translations.keySet()) {
			final Map<Integer, Map<String, String>> byDocument = index.distribute(textsFor(language));
			for (final Map.Entry<Integer, Map<String, String>> entry : byDocument.entrySet()) {
				result.computeIfAbsent(entry.getKey(), k -> new LinkedHashMap<>())
					.put(language, entry.getValue());
			}
		}
		return result;
	}

	/**
	 * Returns true if any string failed in any language.
	 *
	 * @return true when at least one language reports a failure
	 */
	public boolean hasFailures() {
		return this.stats.values().stream().anyMatch(LanguageStats::hasFailures);
	}
}
