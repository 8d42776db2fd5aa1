package io.evitadb.polyglot.mask;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;

/**
 * Content in which every protected term occurrence is wrapped in the internal marker envelope
 * `<<<__DNT__term__>>>`.
 *
 * @param original the content before masking
 * @param masked   the content with envelopes
 */
public record MaskedContent(@Nonnull String original, @Nonnull String masked) {

	public MaskedContent {
		Objects.requireNonNull(original, "original must not be null");
		Objects.requireNonNull(masked, "masked must not be null");
	}

	/**
	 * Returns true if at least one term occurrence was masked.
	 *
	 * @return true when the masked text differs from the original
	 */
	public boolean hasProtectedTerms() {
		return !this.original.equals(this.masked);
	}

	/**
	 * Returns the text outside all envelopes, trimmed.
	 *
	 * @return translatable remainder, empty if everything was protected
	 */
	@Nonnull
	public String unprotectedRemainder() {
		return DoNotTranslateMasker.ENVELOPE_PATTERN.matcher(this.masked).replaceAll("").trim();
	}

	/**
	 * Splits the masked text back into translatable and protected runs. The run values
	 * concatenated reproduce {@link #original()}.
	 *
	 * @return runs in text order, adjacent translatable text is never split
	 */
	@Nonnull
	public List<TextRun> runs() {
		final List<TextRun> runs = new ArrayList<>();
		final Matcher matcher = DoNotTranslateMasker.ENVELOPE_PATTERN.matcher(this.masked);
		int lastEnd = 0;
		while (matcher.find()) {
			if (matcher.start() > lastEnd) {
				runs.add(TextRun.text(this.masked.substring(lastEnd, matcher.start())));
			}
			runs.add(TextRun.term(matcher.group(1)));
			lastEnd = matcher.end();
		}
		if (lastEnd < this.masked.length()) {
			runs.add(TextRun.text(this.masked.substring(lastEnd)));
		}
		return runs;
	}
}
