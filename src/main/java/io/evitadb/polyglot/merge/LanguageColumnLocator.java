package io.evitadb.polyglot.merge;

import io.evitadb.polyglot.model.LanguageCodes;
import io.evitadb.polyglot.model.LanguagePolicies;
import io.evitadb.polyglot.model.TargetLanguage;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds language columns in a header row. A header cell belongs to a language when it contains a
 * code of the form `xx-YY` (case-insensitive), for example `fr-FR` or `Target (DE-de)`.
 */
public final class LanguageColumnLocator {

	private static final Pattern LANGUAGE_CODE = Pattern.compile("\\b([a-z]{2}-[a-z]{2})\\b", Pattern.CASE_INSENSITIVE);

	private LanguageColumnLocator() {
		// utility class
	}

	/**
	 * Maps language codes found in the header to their column index. When a code appears in more
	 * than one column, the last one wins.
	 *
	 * @param header header row, cells may be null
	 * @return column index keyed by normalized language code, in column order
	 */
	@Nonnull
	public static Map<String, Integer> locate(@Nonnull List<String> header) {
		Objects.requireNonNull(header, "header must not be null");
		final Map<String, Integer> columns = new LinkedHashMap<>();
		for (int column = 0; column < header.size(); column++) {
			final String value = header.get(column);
			if (value == null) {
				continue;
			}
			final Matcher matcher = LANGUAGE_CODE.matcher(value);
			if (matcher.find()) {
				columns.put(LanguageCodes.normalize(matcher.group(1)), column);
			}
		}
		return columns;
	}

	/**
	 * Builds merge targets for the languages, locating existing columns in the header.
	 *
	 * @param header    header row of the document
	 * @param languages target language codes
	 * @param policies  resolved overwrite policies
	 * @return targets in the order of the languages
	 */
	@Nonnull
	public static List<TargetLanguage> targets(
		@Nonnull List<String> header,
		@Nonnull Collection<String> languages,
		@Nonnull LanguagePolicies policies
	) {
		Objects.requireNonNull(languages, "languages must not be null");
		Objects.requireNonNull(policies, "policies must not be null");
		final Map<String, Integer> columns = locate(header);
		final List<TargetLanguage> targets = new ArrayList<>(languages.size());
		for (final String language : languages) {
			final String code = LanguageCodes.normalize(language);
			targets.add(new TargetLanguage(code, columns.get(code), policies.policyFor(code)));
		}
		return targets;
	}
}
