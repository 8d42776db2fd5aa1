package io.evitadb.polyglot.batch;

import io.evitadb.polyglot.dedup.UniqueStringIndex;
import io.evitadb.polyglot.glossary.GlossaryTranslator;
import io.evitadb.polyglot.glossary.SegmentTranslation;
import io.evitadb.polyglot.glossary.TranslationOrigin;
import io.evitadb.polyglot.memory.FuzzyMatcher;
import io.evitadb.polyglot.memory.MemoryMatch;
import io.evitadb.polyglot.model.LanguageCodes;
import org.apache.maven.plugin.logging.Log;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Translates every unique string of a batch once per target language.
 *
 * For each string the sources are tried in order: a glossary entry matching the whole string, a
 * translation memory match reaching the auto-apply threshold, and finally glossary-assisted machine
 * translation. A failed machine translation leaves the visible failure sentinel in place of the
 * string and the batch continues; a permanent failure of the provider (authentication, quota)
 * propagates and stops the batch.
 */
public final class BatchTranslator {

	@Nonnull
	private final GlossaryTranslator glossaryTranslator;
	@Nullable
	private final FuzzyMatcher memory;
	private final int autoApplyThreshold;
	@Nonnull
	private final Log log;

	/**
	 * Creates a batch translator without translation memory.
	 *
	 * @param glossaryTranslator glossary-assisted translator
	 * @param log                Maven log for progress
	 */
	public BatchTranslator(@Nonnull GlossaryTranslator glossaryTranslator, @Nonnull Log log) {
		this(glossaryTranslator, null, FuzzyMatcher.DEFAULT_AUTO_APPLY_THRESHOLD, log);
	}

	/**
	 * Creates a batch translator.
	 *
	 * @param glossaryTranslator glossary-assisted translator
	 * @param memory             translation memory matcher, null when no memory is available
	 * @param autoApplyThreshold minimal score of a memory match applied without review, 0..100
	 * @param log                Maven log for progress
	 */
	public BatchTranslator(
		@Nonnull GlossaryTranslator glossaryTranslator,
		@Nullable FuzzyMatcher memory,
		int autoApplyThreshold,
		@Nonnull Log log
	) {
		FuzzyMatcher.checkThreshold(autoApplyThreshold, "autoApplyThreshold");
		this.glossaryTranslator = Objects.requireNonNull(glossaryTranslator, "glossaryTranslator must not be null");
		this.memory = memory;
		this.autoApplyThreshold = autoApplyThreshold;
		this.log = Objects.requireNonNull(log, "log must not be null");
	}

	/**
	 * Translates the unique strings of the index.
	 *
	 * @param index           unique strings of the batch
	 * @param sourceLanguage  language of the strings
	 * @param targetLanguages requested languages
	 * @return translations and per-language statistics
	 */
	@Nonnull
	public BatchResult translate(
		@Nonnull UniqueStringIndex index,
		@Nonnull String sourceLanguage,
		@Nonnull List<String> targetLanguages
	) {
		Objects.requireNonNull(index, "index must not be null");
		Objects.requireNonNull(sourceLanguage, "sourceLanguage must not be null");
		Objects.requireNonNull(targetLanguages, "targetLanguages must not be null");

		final List<String> texts = index.texts();
		final Map<String, Map<String, SegmentTranslation>> translations = new LinkedHashMap<>();
		final Map<String, LanguageStats> stats = new LinkedHashMap<>();
		for (final String targetLanguage : targetLanguages) {
			final String language = LanguageCodes.normalize(targetLanguage);
			final Map<String, SegmentTranslation> byText = new LinkedHashMap<>();
			LanguageStats languageStats = LanguageStats.empty(language);
			for (final String text : texts) {
				final SegmentTranslation translation = translateOne(text, sourceLanguage, language);
				byText.put(text, translation);
				languageStats = count(languageStats, translation.origin());
			}
			translations.put(language, byText);
			stats.put(language, languageStats);
			this.log.info(
				"Translated " + texts.size() + " unique strings to " + language + ": " +
					languageStats.glossaryMatches() + " from glossary, " +
					languageStats.memoryMatches() + " from memory, " +
					languageStats.machineTranslations() + " machine translated, " +
					languageStats.failures() + " failed (" + languageStats.successRate() + "% success)."
			);
		}
		return new BatchResult(translations, stats);
	}

	@Nonnull
	private SegmentTranslation translateOne(
		@Nonnull String text,
		@Nonnull String sourceLanguage,
		@Nonnull String targetLanguage
	) {
		final SegmentTranslation glossary = this.glossaryTranslator.fromGlossary(text, sourceLanguage, targetLanguage);
		if (glossary != null) {
			return glossary;
		}
		if (this.memory != null) {
			final Optional<MemoryMatch> best = this.memory.findBest(text, targetLanguage);
			if (best.isPresent() && best.get().reaches(this.autoApplyThreshold)) {
				return new SegmentTranslation(best.get().targetText(), TranslationOrigin.MEMORY);
			}
		}
		return this.glossaryTranslator.translate(text, sourceLanguage, targetLanguage);
	}

	@Nonnull
	private static LanguageStats count(@Nonnull LanguageStats stats, @Nonnull TranslationOrigin origin) {
		return switch (origin) {
			case GLOSSARY -> stats.withGlossaryMatch();
			case MEMORY -> stats.withMemoryMatch();
			case MACHINE -> stats.withMachineTranslation();
			case FAILED -> stats.withFailure();
		};
	}
}
