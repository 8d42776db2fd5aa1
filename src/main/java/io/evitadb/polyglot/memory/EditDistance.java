package io.evitadb.polyglot.memory;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Levenshtein distance with unit costs for single-character insertion, deletion and substitution.
 */
public final class EditDistance {

	private EditDistance() {
		// utility class
	}

	/**
	 * Computes the edit distance of two strings.
	 *
	 * @param first  first string
	 * @param second second string
	 * @return minimal number of single-character edits turning one string into the other
	 */
	public static int between(@Nonnull String first, @Nonnull String second) {
		Objects.requireNonNull(first, "first must not be null");
		Objects.requireNonNull(second, "second must not be null");
		if (first.isEmpty()) {
			return second.length();
		}
		if (second.isEmpty()) {
			return first.length();
		}

		// two rows of the dynamic programming matrix are enough
		int[] previous = new int[second.length() + 1];
		int[] current = new int[second.length() + 1];
		for (int j = 0; j <= second.length(); j++) {
			previous[j] = j;
		}
		for (int i = 1; i <= first.length(); i++) {
			current[0] = i;
			final char ch = first.charAt(i - 1);
			for (int j = 1; j <= second.length(); j++) {
				if (ch == second.charAt(j - 1)) {
					current[j] = previous[j - 1];
				} else {
					current[j] = 1 + Math.min(previous[j - 1], Math.min(previous[j], current[j - 1]));
				}
			}
			final int[] swap = previous;
			previous = current;
			current = swap;
		}
		return previous[second.length()];
	}

	/**
	 * Computes the similarity score `round(100 * (longer - distance) / longer)`.
	 *
	 * @param first  first string
	 * @param second second string
	 * @return score 0..100, 100 for two empty strings
	 */
	public static int similarity(@Nonnull String first, @Nonnull String second) {
		final int longer = Math.max(first.length(), second.length());
		if (longer == 0) {
			return 100;
		}
		final int distance = between(first, second);
		return (int) Math.round(100.0 * (longer - distance) / longer);
	}
}
