package io.evitadb.polyglot.glossary;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Maps the language of a glossary column (`fr`, `FR-fr`, `French`) to one of the selected target
 * language codes.
 *
 * Matching is tried in this order: exact code ignoring case, base language, display name.
 */
public final class GlossaryLanguageMatcher {

	private GlossaryLanguageMatcher() {
		// utility class
	}

	/**
	 * Finds the selected target matching the glossary column language.
	 *
	 * @param inputCode       language as written in the glossary
	 * @param selectedTargets selected target codes such as `fr-FR`
	 * @param languageNames   display names keyed by ISO base code (`fr` to `French`)
	 * @return the matching target code as selected, empty when nothing matches
	 */
	@Nonnull
	public static Optional<String> match(
		@Nullable String inputCode,
		@Nonnull List<String> selectedTargets,
		@Nonnull Map<String, String> languageNames
	) {
		Objects.requireNonNull(selectedTargets, "selectedTargets must not be null");
		Objects.requireNonNull(languageNames, "languageNames must not be null");
		if (inputCode == null || inputCode.isBlank() || selectedTargets.isEmpty()) {
			return Optional.empty();
		}
		final String normalized = inputCode.trim().toLowerCase(Locale.ROOT);

		for (final String target : selectedTargets) {
			if (target.toLowerCase(Locale.ROOT).equals(normalized)) {
				return Optional.of(target);
			}
		}

		final String baseCode = normalized.split("[-_]")[0];
		final Optional<String> baseMatch = findByBase(baseCode, selectedTargets);
		if (baseMatch.isPresent()) {
			return baseMatch;
		}

		for (final Map.Entry<String, String> entry : languageNames.entrySet()) {
			if (entry.getValue() != null && entry.getValue().toLowerCase(Locale.ROOT).equals(normalized)) {
				final Optional<String> nameMatch = findByBase(entry.getKey().toLowerCase(Locale.ROOT), selectedTargets);
				if (nameMatch.isPresent()) {
					return nameMatch;
				}
			}
		}
		return Optional.empty();
	}

	@Nonnull
	private static Optional<String> findByBase(@Nonnull String baseCode, @Nonnull List<String> selectedTargets) {
		final String prefix = baseCode + "-";
		for (final String target : selectedTargets) {
			final String lower = target.toLowerCase(Locale.ROOT).replace('_', '-');
			if (lower.startsWith(prefix)) {
				return Optional.of(target);
			}
		}
		return Optional.empty();
	}
}
