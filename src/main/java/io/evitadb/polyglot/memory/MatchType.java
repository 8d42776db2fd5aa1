package io.evitadb.polyglot.memory;

/**
 * Quality class of a translation memory match.
 */
public enum MatchType {
	/**
	 * Identical after normalization, or differing only marginally (score 95 and above).
	 */
	EXACT,
	/**
	 * Similar enough to pass the fuzzy threshold.
	 */
	FUZZY;

	/**
	 * Score from which a match is classified as {@link #EXACT}.
	 */
	public static final int EXACT_SCORE = 95;

	/**
	 * Classifies a score.
	 *
	 * @param score similarity score 0..100
	 * @return match type for the score
	 */
	public static MatchType forScore(int score) {
		return score >= EXACT_SCORE ? EXACT : FUZZY;
	}
}
