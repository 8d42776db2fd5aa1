package io.evitadb.polyglot.memory;

import io.evitadb.polyglot.model.LanguageCodes;
import io.evitadb.polyglot.model.TranslationMemoryUnit;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Scores translation memory units against a query text.
 *
 * Both sides are normalized with {@link TextNormalizer}. Only units whose target language equals
 * the requested language or shares its base language are considered. Identical normalized texts
 * score 100, other pairs `round(100 * (longer - editDistance) / longer)`. Matches below the fuzzy
 * threshold are dropped and the rest is sorted by score, highest first.
 *
 * Pairs whose length ratio alone rules out reaching the threshold are skipped before the edit
 * distance is computed: the distance is at least the length difference, so the score can never
 * exceed `round(100 * shorter / longer)`.
 */
public final class FuzzyMatcher {

	/**
	 * Default minimal score of a reported match.
	 */
	public static final int DEFAULT_FUZZY_THRESHOLD = 70;
	/**
	 * Default score from which a match is applied without review.
	 */
	public static final int DEFAULT_AUTO_APPLY_THRESHOLD = 95;

	@Nonnull
	private final List<IndexedUnit> units;
	private final int fuzzyThreshold;

	/**
	 * Creates a matcher with {@link #DEFAULT_FUZZY_THRESHOLD}.
	 *
	 * @param units translation memory store
	 */
	public FuzzyMatcher(@Nonnull List<TranslationMemoryUnit> units) {
		this(units, DEFAULT_FUZZY_THRESHOLD);
	}

	/**
	 * Creates a matcher.
	 *
	 * @param units          translation memory store
	 * @param fuzzyThreshold minimal score of a reported match, 0..100
	 */
	public FuzzyMatcher(@Nonnull List<TranslationMemoryUnit> units, int fuzzyThreshold) {
		Objects.requireNonNull(units, "units must not be null");
		checkThreshold(fuzzyThreshold, "fuzzyThreshold");
		final List<IndexedUnit> indexed = new ArrayList<>(units.size());
		for (final TranslationMemoryUnit unit : units) {
			indexed.add(new IndexedUnit(unit, TextNormalizer.normalize(unit.sourceText())));
		}
		this.units = List.copyOf(indexed);
		this.fuzzyThreshold = fuzzyThreshold;
	}

	/**
	 * Validates a threshold.
	 *
	 * @param threshold value to check
	 * @param name      parameter name for the error message
	 * @throws IllegalArgumentException if the value is outside 0..100
	 */
	public static void checkThreshold(int threshold, @Nonnull String name) {
		if (threshold < 0 || threshold > 100) {
			throw new IllegalArgumentException(name + " must be between 0 and 100, got " + threshold);
		}
	}

	public int getFuzzyThreshold() {
		return this.fuzzyThreshold;
	}

	public int size() {
		return this.units.size();
	}

	/**
	 * Finds all matches of the text for the target language.
	 *
	 * @param sourceText     query text
	 * @param targetLanguage requested language
	 * @return matches at or above the fuzzy threshold, best first; empty when nothing qualifies
	 */
	@Nonnull
	public List<MemoryMatch> findMatches(@Nonnull String sourceText, @Nonnull String targetLanguage) {
		Objects.requireNonNull(sourceText, "sourceText must not be null");
		Objects.requireNonNull(targetLanguage, "targetLanguage must not be null");

		final String query = TextNormalizer.normalize(sourceText);
		final String language = LanguageCodes.normalize(targetLanguage);
		final List<MemoryMatch> matches = new ArrayList<>();
		for (final IndexedUnit indexed : this.units) {
			final String unitLanguage = LanguageCodes.normalize(indexed.unit().targetLang());
			if (!unitLanguage.equals(language) && !LanguageCodes.sameBaseLanguage(unitLanguage, language)) {
				continue;
			}
			final int score = score(query, indexed.normalizedSource());
			if (score >= this.fuzzyThreshold) {
				matches.add(new MemoryMatch(indexed.unit(), score, MatchType.forScore(score)));
			}
		}
		matches.sort(Comparator.comparingInt(MemoryMatch::score).reversed());
		return matches;
	}

	/**
	 * Returns the best match of the text for the target language.
	 *
	 * @param sourceText     query text
	 * @param targetLanguage requested language
	 * @return the highest scoring match, empty when nothing qualifies
	 */
	@Nonnull
	public Optional<MemoryMatch> findBest(@Nonnull String sourceText, @Nonnull String targetLanguage) {
		final List<MemoryMatch> matches = findMatches(sourceText, targetLanguage);
		return matches.isEmpty() ? Optional.empty() : Optional.of(matches.get(0));
	}

	private int score(@Nonnull String query, @Nonnull String candidate) {
		if (query.equals(candidate)) {
			return 100;
		}
		final int longer = Math.max(query.length(), candidate.length());
		final int shorter = Math.min(query.length(), candidate.length());
		if (Math.round(100.0 * shorter / longer) < this.fuzzyThreshold) {
			return 0;
		}
		return EditDistance.similarity(query, candidate);
	}

	private record IndexedUnit(@Nonnull TranslationMemoryUnit unit, @Nonnull String normalizedSource) {
	}
}
