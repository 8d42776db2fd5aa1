package io.evitadb.polyglot.memory;

import io.evitadb.polyglot.model.TranslationMemoryUnit;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Translation memory unit scored against a query.
 *
 * @param unit      the matching unit
 * @param score     similarity 0..100
 * @param matchType quality class of the score
 */
public record MemoryMatch(
	@Nonnull TranslationMemoryUnit unit,
	int score,
	@Nonnull MatchType matchType
) {

	public MemoryMatch {
		Objects.requireNonNull(unit, "unit must not be null");
		Objects.requireNonNull(matchType, "matchType must not be null");
		if (score < 0 || score > 100) {
			throw new IllegalArgumentException("score must be between 0 and 100, got " + score);
		}
	}

	/**
	 * Returns the translation stored in the unit.
	 *
	 * @return target text
	 */
	@Nonnull
	public String targetText() {
		return this.unit.targetText();
	}

	/**
	 * Returns true if the match may be applied without review.
	 *
	 * @param autoApplyThreshold caller's auto-apply threshold 0..100
	 * @return true when the score reaches the threshold
	 */
	public boolean reaches(int autoApplyThreshold) {
		return this.score >= autoApplyThreshold;
	}
}
