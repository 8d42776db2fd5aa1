package io.evitadb.polyglot.mask;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Protects Do-Not-Translate terms before segmentation.
 *
 * The effective term list is the caller's list followed by every curly-brace token found in the
 * content (`{name}`, `{00|Job Title}`), deduplicated case-insensitively with the first occurrence
 * kept. Terms match literally and case-insensitively. When two terms could match at the same
 * position the longer one wins, so overlapping terms never produce nested envelopes.
 *
 * Instances are immutable and bound to one term list; create one per row with
 * {@link #forContent(String, List)}.
 */
public final class DoNotTranslateMasker {

	/**
	 * Opening part of the internal marker envelope.
	 */
	public static final String ENVELOPE_START = "<<<__DNT__";
	/**
	 * Closing part of the internal marker envelope.
	 */
	public static final String ENVELOPE_END = "__>>>";

	static final Pattern ENVELOPE_PATTERN = Pattern.compile(
		Pattern.quote(ENVELOPE_START) + "(.*?)" + Pattern.quote(ENVELOPE_END),
		Pattern.DOTALL
	);
	private static final Pattern LENIENT_ENVELOPE_PATTERN = Pattern.compile(
		Pattern.quote(ENVELOPE_START) + "(.*?)(?:" + Pattern.quote(ENVELOPE_END) + "|$)",
		Pattern.DOTALL
	);
	private static final Pattern CURLY_TOKEN_PATTERN = Pattern.compile("\\{[^}]+}");

	@Nonnull
	private final List<String> terms;
	@Nullable
	private final Pattern termPattern;

	private DoNotTranslateMasker(@Nonnull List<String> terms) {
		this.terms = List.copyOf(terms);
		this.termPattern = compile(this.terms);
	}

	/**
	 * Creates a masker for the content: the given terms plus the curly-brace tokens detected in it.
	 *
	 * @param content the content the masker will be applied to
	 * @param terms   caller's ordered Do-Not-Translate terms
	 * @return masker bound to the effective term list
	 */
	@Nonnull
	public static DoNotTranslateMasker forContent(@Nonnull String content, @Nonnull List<String> terms) {
		Objects.requireNonNull(content, "content must not be null");
		Objects.requireNonNull(terms, "terms must not be null");
		final List<String> all = new ArrayList<>(terms);
		all.addAll(detectCurlyTokens(content));
		return new DoNotTranslateMasker(deduplicate(all));
	}

	/**
	 * Creates a masker for exactly the given terms, without curly-brace detection.
	 *
	 * @param terms ordered Do-Not-Translate terms
	 * @return masker bound to the deduplicated term list
	 */
	@Nonnull
	public static DoNotTranslateMasker forTerms(@Nonnull List<String> terms) {
		Objects.requireNonNull(terms, "terms must not be null");
		return new DoNotTranslateMasker(deduplicate(terms));
	}

	/**
	 * Finds all curly-brace tokens in the text, in order of appearance.
	 *
	 * @param text the text to scan
	 * @return detected tokens including the braces
	 */
	@Nonnull
	public static List<String> detectCurlyTokens(@Nonnull String text) {
		Objects.requireNonNull(text, "text must not be null");
		final List<String> tokens = new ArrayList<>();
		final Matcher matcher = CURLY_TOKEN_PATTERN.matcher(text);
		while (matcher.find()) {
			tokens.add(matcher.group());
		}
		return tokens;
	}

	/**
	 * Removes blank terms and case-insensitive duplicates, keeping the first occurrence.
	 *
	 * @param terms the terms to deduplicate
	 * @return deduplicated terms in original order
	 */
	@Nonnull
	public static List<String> deduplicate(@Nonnull List<String> terms) {
		Objects.requireNonNull(terms, "terms must not be null");
		final List<String> unique = new ArrayList<>(terms.size());
		final Set<String> seen = new HashSet<>();
		for (final String term : terms) {
			if (term == null || term.isEmpty()) {
				continue;
			}
			if (seen.add(term.toLowerCase(Locale.ROOT))) {
				unique.add(term);
			}
		}
		return unique;
	}

	/**
	 * Returns the effective, deduplicated term list.
	 *
	 * @return immutable term list
	 */
	@Nonnull
	public List<String> getTerms() {
		return this.terms;
	}

	/**
	 * Wraps every term occurrence in the marker envelope. The matched text keeps its original
	 * casing inside the envelope.
	 *
	 * @param text the text to mask
	 * @return masked content
	 */
	@Nonnull
	public MaskedContent mask(@Nonnull String text) {
		Objects.requireNonNull(text, "text must not be null");
		if (this.termPattern == null) {
			return new MaskedContent(text, text);
		}
		final Matcher matcher = this.termPattern.matcher(text);
		final StringBuilder masked = new StringBuilder(text.length() + 16);
		while (matcher.find()) {
			matcher.appendReplacement(
				masked,
				Matcher.quoteReplacement(ENVELOPE_START + matcher.group() + ENVELOPE_END)
			);
		}
		matcher.appendTail(masked);
		return new MaskedContent(text, masked.toString());
	}

	/**
	 * Splits the text into translatable and protected runs.
	 *
	 * @param text the text to split
	 * @return runs whose values concatenate to the text
	 */
	@Nonnull
	public List<TextRun> split(@Nonnull String text) {
		return mask(text).runs();
	}

	/**
	 * Replaces every envelope, complete or cut off at the end of the text, with the literal term.
	 *
	 * @param text text possibly containing envelopes
	 * @return text without envelopes
	 */
	@Nonnull
	public static String unmask(@Nonnull String text) {
		Objects.requireNonNull(text, "text must not be null");
		if (!text.contains(ENVELOPE_START)) {
			return text;
		}
		return LENIENT_ENVELOPE_PATTERN.matcher(text).replaceAll("$1");
	}

	@Nullable
	private static Pattern compile(@Nonnull List<String> terms) {
		if (terms.isEmpty()) {
			return null;
		}
		final List<String> byLength = new ArrayList<>(terms);
		byLength.sort(Comparator.comparingInt(String::length).reversed());
		final StringBuilder alternation = new StringBuilder();
		for (final String term : byLength) {
			if (alternation.length() > 0) {
				alternation.append('|');
			}
			alternation.append(Pattern.quote(term));
		}
		return Pattern.compile(alternation.toString(), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);
	}
}
