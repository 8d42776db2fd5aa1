package io.evitadb.polyglot.model;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Locale;

/**
 * Normalization of language codes used as keys throughout the engine.
 * Region codes such as `EN-gb` become `en-GB`, bare codes are lower-cased.
 */
public final class LanguageCodes {

	private LanguageCodes() {
		// utility class
	}

	/**
	 * Normalizes a language code to the `xx-YY` form.
	 *
	 * @param code the code to normalize, may be null
	 * @return normalized code, empty string for null or blank input
	 */
	@Nonnull
	public static String normalize(@Nullable String code) {
		if (code == null || code.isBlank()) {
			return "";
		}
		final String trimmed = code.trim().replace('_', '-');
		final String[] parts = trimmed.split("-");
		if (parts.length != 2) {
			return trimmed.toLowerCase(Locale.ROOT);
		}
		return parts[0].toLowerCase(Locale.ROOT) + "-" + parts[1].toUpperCase(Locale.ROOT);
	}

	/**
	 * Returns the base language of a code (`fr-FR` gives `fr`).
	 *
	 * @param code the language code
	 * @return lower-cased base language, empty string for null or blank input
	 */
	@Nonnull
	public static String baseLanguage(@Nullable String code) {
		final String normalized = normalize(code);
		final int dash = normalized.indexOf('-');
		return dash < 0 ? normalized : normalized.substring(0, dash);
	}

	/**
	 * Returns true if both codes share the same base language.
	 *
	 * @param first  first code
	 * @param second second code
	 * @return true when the base languages are equal and non-empty
	 */
	public static boolean sameBaseLanguage(@Nullable String first, @Nullable String second) {
		final String base = baseLanguage(first);
		return !base.isEmpty() && base.equals(baseLanguage(second));
	}
}
