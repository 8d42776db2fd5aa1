package io.evitadb.polyglot.batch;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Outcome of translating the unique strings of a batch into one language.
 *
 * @param language            target language code
 * @param glossaryMatches     strings taken from the glossary as a whole
 * @param memoryMatches       strings taken from the translation memory
 * @param machineTranslations strings translated by the machine translation function
 * @param failures            strings whose translation failed
 */
public record LanguageStats(
	@Nonnull String language,
	int glossaryMatches,
	int memoryMatches,
	int machineTranslations,
	int failures
) {

	public LanguageStats {
		Objects.requireNonNull(language, "language must not be null");
	}

	/**
	 * Creates stats with all counts at zero.
	 *
	 * @param language target language code
	 * @return empty stats
	 */
	@Nonnull
	public static LanguageStats empty(@Nonnull String language) {
		return new LanguageStats(language, 0, 0, 0, 0);
	}

	@Nonnull
	public LanguageStats withGlossaryMatch() {
		return new LanguageStats(this.language, this.glossaryMatches + 1, this.memoryMatches, this.machineTranslations, this.failures);
	}

	@Nonnull
	public LanguageStats withMemoryMatch() {
		return new LanguageStats(this.language, this.glossaryMatches, this.memoryMatches + 1, this.machineTranslations, this.failures);
	}

	@Nonnull
	public LanguageStats withMachineTranslation() {
		return new LanguageStats(this.language, this.glossaryMatches, this.memoryMatches, this.machineTranslations + 1, this.failures);
	}

	@Nonnull
	public LanguageStats withFailure() {
		return new LanguageStats(this.language, this.glossaryMatches, this.memoryMatches, this.machineTranslations, this.failures + 1);
	}

	/**
	 * Returns the number of strings translated successfully by any means.
	 *
	 * @return success count
	 */
	public int successes() {
		return this.glossaryMatches + this.memoryMatches + this.machineTranslations;
	}

	/**
	 * Returns the share of successful strings, rounded to whole percent.
	 *
	 * @return success rate 0..100, 100 when nothing had to be translated
	 */
	public int successRate() {
		final int total = successes() + this.failures;
		return total == 0 ? 100 : (int) Math.round(successes() * 100.0 / total);
	}

	public boolean hasFailures() {
		return this.failures > 0;
	}
}
