package io.evitadb.polyglot.memory;

import org.jsoup.Jsoup;

import javax.annotation.Nonnull;
import java.util.Locale;
import java.util.Objects;

/**
 * Normalization applied to queries and memory units before comparison: markup tags are stripped,
 * entities decoded, whitespace collapsed and trimmed, and the text lower-cased.
 */
public final class TextNormalizer {

	private TextNormalizer() {
		// utility class
	}

	/**
	 * Normalizes the text for comparison.
	 *
	 * @param text text possibly containing markup
	 * @return normalized text
	 */
	@Nonnull
	public static String normalize(@Nonnull String text) {
		Objects.requireNonNull(text, "text must not be null");
		if (text.isBlank()) {
			return "";
		}
		final String plain = text.indexOf('<') >= 0 || text.indexOf('&') >= 0
			? Jsoup.parseBodyFragment(text).body().text()
			: text.trim().replaceAll("\\s+", " ");
		return plain.toLowerCase(Locale.ROOT);
	}
}
