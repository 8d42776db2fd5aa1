package io.evitadb.polyglot.glossary;

import io.evitadb.polyglot.model.GlossaryEntry;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Applies a glossary to segment texts before machine translation and restores it afterwards.
 *
 * - A segment whose trimmed text equals an entry's source-language value (ignoring case) is a full
 *   match: the entry's target-language value is used and the segment is never translated.
 * - Otherwise embedded terms are replaced by `__GLOSS_<n>__` tokens, longest source term first.
 *   Terms containing a space match anywhere, single words only between non-word characters.
 *   Embedded matching is case-sensitive. Every occurrence of one term shares one token.
 * - Restoration is a literal replacement of each token with the glossary target value.
 *
 * Entries are considered in glossary order; for a full match the first matching entry wins.
 */
public final class GlossarySubstitutor {

	/**
	 * Prefix of the intermediate glossary token.
	 */
	public static final String PLACEHOLDER_PREFIX = "__GLOSS_";
	/**
	 * Suffix of the intermediate glossary token.
	 */
	public static final String PLACEHOLDER_SUFFIX = "__";

	private static final String WORD_START = "(?<![\\p{L}\\p{N}_])";
	private static final String WORD_END = "(?![\\p{L}\\p{N}_])";

	@Nonnull
	private final List<GlossaryEntry> glossary;

	/**
	 * Creates a substitutor.
	 *
	 * @param glossary ordered glossary entries
	 */
	public GlossarySubstitutor(@Nonnull List<GlossaryEntry> glossary) {
		this.glossary = List.copyOf(Objects.requireNonNull(glossary, "glossary must not be null"));
	}

	/**
	 * Builds the intermediate token for the n-th substituted term.
	 *
	 * @param index zero-based term index
	 * @return token in the form `__GLOSS_<n>__`
	 */
	@Nonnull
	public static String placeholder(int index) {
		return PLACEHOLDER_PREFIX + index + PLACEHOLDER_SUFFIX;
	}

	/**
	 * Looks up a glossary entry matching the whole text.
	 *
	 * @param text           segment text
	 * @param sourceLanguage language of the text
	 * @param targetLanguage requested language
	 * @return the target value, empty when no entry matches or the entry lacks the target language
	 */
	@Nonnull
	public Optional<String> findFullMatch(
		@Nonnull String text,
		@Nonnull String sourceLanguage,
		@Nonnull String targetLanguage
	) {
		Objects.requireNonNull(text, "text must not be null");
		final String trimmed = text.trim();
		if (trimmed.isEmpty()) {
			return Optional.empty();
		}
		final String lowerText = trimmed.toLowerCase(Locale.ROOT);
		for (final GlossaryEntry entry : this.glossary) {
			final Optional<String> source = entry.term(sourceLanguage);
			if (source.isPresent() && source.get().trim().toLowerCase(Locale.ROOT).equals(lowerText)) {
				return entry.term(targetLanguage);
			}
		}
		return Optional.empty();
	}

	/**
	 * Applies the glossary to one segment.
	 *
	 * @param text           segment text
	 * @param sourceLanguage language of the text
	 * @param targetLanguage requested language
	 * @return full match, or the text with embedded terms replaced by tokens
	 */
	@Nonnull
	public GlossarySubstitution substitute(
		@Nonnull String text,
		@Nonnull String sourceLanguage,
		@Nonnull String targetLanguage
	) {
		Objects.requireNonNull(text, "text must not be null");
		Objects.requireNonNull(sourceLanguage, "sourceLanguage must not be null");
		Objects.requireNonNull(targetLanguage, "targetLanguage must not be null");

		final String trimmed = text.trim();
		if (trimmed.isEmpty() || this.glossary.isEmpty()) {
			return GlossarySubstitution.none(trimmed);
		}
		final Optional<String> fullMatch = findFullMatch(trimmed, sourceLanguage, targetLanguage);
		if (fullMatch.isPresent()) {
			return GlossarySubstitution.fullMatch(trimmed, fullMatch.get());
		}

		String processed = trimmed;
		final Map<String, String> substitutions = new LinkedHashMap<>();
		for (final Term term : termsFor(sourceLanguage, targetLanguage)) {
			final Matcher matcher = term.pattern().matcher(processed);
			if (!matcher.find()) {
				continue;
			}
			final String token = placeholder(substitutions.size());
			processed = matcher.replaceAll(Matcher.quoteReplacement(token));
			substitutions.put(token, term.target());
		}
		return new GlossarySubstitution(processed, substitutions, null);
	}

	/**
	 * Replaces every token with its glossary value using literal matching.
	 *
	 * @param translatedText text returned by the translation provider
	 * @param substitutions  glossary value keyed by token
	 * @return restored text
	 */
	@Nonnull
	public static String restore(@Nonnull String translatedText, @Nonnull Map<String, String> substitutions) {
		Objects.requireNonNull(translatedText, "translatedText must not be null");
		Objects.requireNonNull(substitutions, "substitutions must not be null");
		String result = translatedText;
		for (final Map.Entry<String, String> entry : substitutions.entrySet()) {
			result = result.replace(entry.getKey(), entry.getValue());
		}
		return result;
	}

	@Nonnull
	private List<Term> termsFor(@Nonnull String sourceLanguage, @Nonnull String targetLanguage) {
		final List<Term> terms = new ArrayList<>();
		for (final GlossaryEntry entry : this.glossary) {
			final Optional<String> source = entry.term(sourceLanguage);
			final Optional<String> target = entry.term(targetLanguage);
			if (source.isEmpty() || target.isEmpty() || source.get().isBlank()) {
				continue;
			}
			final String sourceTerm = source.get().trim();
			final String quoted = Pattern.quote(sourceTerm);
			final Pattern pattern = sourceTerm.contains(" ")
				? Pattern.compile(quoted)
				: Pattern.compile(WORD_START + quoted + WORD_END);
			terms.add(new Term(sourceTerm, target.get().trim(), pattern));
		}
		// stable sort keeps glossary order among equally long terms
		terms.sort(Comparator.comparingInt((Term t) -> t.source().length()).reversed());
		return terms;
	}

	private record Term(@Nonnull String source, @Nonnull String target, @Nonnull Pattern pattern) {
	}
}
