package io.evitadb.polyglot.merge;

import javax.annotation.Nullable;

/**
 * Detection of unresolved translation formulas left in cells by spreadsheet tooling, such as
 * `=TRANSLATE(C3,"en","fr")` or `=COPILOT(C3, "Translate to French")`. Some readers strip the
 * leading `=`, so the bare form is recognized too.
 *
 * A formula marker is not real content: it counts as blank for every overwrite decision.
 */
public final class TranslationFormulas {

	private static final String[] PREFIXES = {"=TRANSLATE(", "=COPILOT(", "TRANSLATE(", "COPILOT("};

	private TranslationFormulas() {
		// utility class
	}

	/**
	 * Returns true if the value is an unresolved translation formula.
	 *
	 * @param value cell value, may be null
	 * @return true for formula markers
	 */
	public static boolean isFormula(@Nullable String value) {
		if (value == null) {
			return false;
		}
		final String trimmed = value.trim();
		for (final String prefix : PREFIXES) {
			if (trimmed.startsWith(prefix)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Returns true if the cell holds nothing a user would call content: null, whitespace or a
	 * formula marker.
	 *
	 * @param value cell value, may be null
	 * @return true when the cell may be filled
	 */
	public static boolean isBlankOrFormula(@Nullable String value) {
		return value == null || value.isBlank() || isFormula(value);
	}
}
