package io.evitadb.polyglot.mask;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Proposes Do-Not-Translate terms from already extracted segment texts.
 *
 * No stop-word lists are involved: a word is flagged as a likely proper noun when it is capitalized
 * but not at the start of a sentence, written in mixed case (`PascalCase`, `camelCase`) or in capitals.
 */
public final class DoNotTranslateSuggester {

	/**
	 * Default minimal length of a suggested word.
	 */
	public static final int DEFAULT_MIN_LENGTH = 3;

	private static final Pattern WORD_PATTERN = Pattern.compile(
		"(?:^|[.!?]\\s+|\\s+)([a-zA-Z\\u00C0-\\u00FF][a-zA-Z\\u00C0-\\u00FF0-9'-]*)"
	);
	private static final Pattern SENTENCE_END = Pattern.compile("[.!?]\\s*$");
	private static final Pattern CAPITALIZED = Pattern.compile("^[A-Z\\u00C0-\\u00DD]");
	private static final Pattern PASCAL_CASE = Pattern.compile("^[A-Z][a-z]*[A-Z].*");
	private static final Pattern CAMEL_CASE = Pattern.compile("^[a-z]+[A-Z].*");
	private static final Pattern ALL_CAPS = Pattern.compile("^[A-Z\\u00C0-\\u00DD]{2,}$");

	private DoNotTranslateSuggester() {
		// utility class
	}

	/**
	 * Extracts word suggestions using {@link #DEFAULT_MIN_LENGTH}.
	 *
	 * @param texts         extracted segment texts
	 * @param existingTerms terms already protected, excluded case-insensitively
	 * @return suggestions, proper nouns first, then by frequency, then alphabetically
	 */
	@Nonnull
	public static List<WordSuggestion> suggest(@Nonnull List<String> texts, @Nonnull List<String> existingTerms) {
		return suggest(texts, existingTerms, DEFAULT_MIN_LENGTH);
	}

	/**
	 * Extracts word suggestions.
	 *
	 * @param texts         extracted segment texts
	 * @param existingTerms terms already protected, excluded case-insensitively
	 * @param minLength     minimal word length
	 * @return suggestions, proper nouns first, then by frequency, then alphabetically
	 */
	@Nonnull
	public static List<WordSuggestion> suggest(
		@Nonnull List<String> texts,
		@Nonnull List<String> existingTerms,
		int minLength
	) {
		Objects.requireNonNull(texts, "texts must not be null");
		Objects.requireNonNull(existingTerms, "existingTerms must not be null");

		final Set<String> existing = new HashSet<>();
		for (final String term : existingTerms) {
			if (term != null) {
				existing.add(term.toLowerCase(Locale.ROOT));
			}
		}

		final Map<String, WordSuggestion> byWord = new LinkedHashMap<>();
		for (final String text : texts) {
			if (text == null || text.isBlank()) {
				continue;
			}
			final Matcher matcher = WORD_PATTERN.matcher(text);
			while (matcher.find()) {
				final String word = matcher.group(1);
				final String lowerWord = word.toLowerCase(Locale.ROOT);
				if (word.length() < minLength || existing.contains(lowerWord)) {
					continue;
				}
				final String precedingContext = matcher.group().substring(0, matcher.group().length() - word.length());
				final boolean properNoun = isLikelyProperNoun(word, precedingContext);

				final WordSuggestion previous = byWord.get(lowerWord);
				if (previous == null) {
					byWord.put(lowerWord, new WordSuggestion(word, 1, properNoun));
				} else {
					byWord.put(lowerWord, new WordSuggestion(
						previous.word(), previous.frequency() + 1, previous.likelyProperNoun() || properNoun
					));
				}
			}
		}

		final List<WordSuggestion> suggestions = new ArrayList<>(byWord.values());
		suggestions.sort(
			Comparator.comparing((WordSuggestion s) -> !s.likelyProperNoun())
				.thenComparing(Comparator.comparingInt(WordSuggestion::frequency).reversed())
				.thenComparing(WordSuggestion::word)
		);
		return suggestions;
	}

	/**
	 * Filters suggestions by case-insensitive prefix.
	 *
	 * @param suggestions the full suggestion list
	 * @param query       prefix typed by the user
	 * @param limit       maximal number of results
	 * @return matching suggestions, empty for a blank query
	 */
	@Nonnull
	public static List<WordSuggestion> filter(
		@Nonnull List<WordSuggestion> suggestions,
		@Nonnull String query,
		int limit
	) {
		Objects.requireNonNull(suggestions, "suggestions must not be null");
		Objects.requireNonNull(query, "query must not be null");
		if (query.isBlank()) {
			return List.of();
		}
		final String lowerQuery = query.toLowerCase(Locale.ROOT);
		return suggestions.stream()
			.filter(s -> s.word().toLowerCase(Locale.ROOT).startsWith(lowerQuery))
			.limit(limit)
			.toList();
	}

	private static boolean isLikelyProperNoun(@Nonnull String word, @Nonnull String precedingContext) {
		// empty context means the word opened the text
		final boolean startOfSentence = precedingContext.isEmpty() || SENTENCE_END.matcher(precedingContext).find();
		final boolean capitalized = CAPITALIZED.matcher(word).find();
		final boolean mixedCase = PASCAL_CASE.matcher(word).matches() || CAMEL_CASE.matcher(word).matches();
		final boolean allCaps = ALL_CAPS.matcher(word).matches();
		return (capitalized && !startOfSentence) || mixedCase || allCaps;
	}
}
