package io.evitadb.polyglot.mask;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Candidate Do-Not-Translate term proposed from extracted texts.
 *
 * @param word               the word as first seen
 * @param frequency          number of occurrences across all texts (case-insensitive)
 * @param likelyProperNoun   true when at least one occurrence looked like a proper noun
 */
public record WordSuggestion(@Nonnull String word, int frequency, boolean likelyProperNoun) {

	public WordSuggestion {
		Objects.requireNonNull(word, "word must not be null");
	}
}
