package io.evitadb.polyglot.model;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Resolved overwrite policy for every target language.
 *
 * Older configurations carry a single global {@link LegacyOverwriteMode}, newer ones a policy per
 * language. Both are folded into this map once, when configuration is loaded, so the merge engine
 * never has to know which representation the user supplied.
 *
 * @param policies policy keyed by normalized language code
 * @param fallback policy used for a language that is not listed
 */
public record LanguagePolicies(
	@Nonnull Map<String, OverwritePolicy> policies,
	@Nonnull OverwritePolicy fallback
) {

	/**
	 * Policy applied when neither a per-language value nor a legacy global mode is configured.
	 */
	public static final OverwritePolicy DEFAULT_POLICY = OverwritePolicy.FILL_EMPTY;

	public LanguagePolicies {
		Objects.requireNonNull(policies, "policies must not be null");
		Objects.requireNonNull(fallback, "fallback must not be null");
		final Map<String, OverwritePolicy> normalized = new LinkedHashMap<>();
		for (final Map.Entry<String, OverwritePolicy> entry : policies.entrySet()) {
			normalized.put(
				LanguageCodes.normalize(entry.getKey()),
				Objects.requireNonNull(entry.getValue(), "policy must not be null")
			);
		}
		policies = Map.copyOf(normalized);
	}

	/**
	 * Resolves the legacy global mode and per-language values into a single policy map.
	 *
	 * An explicit per-language value wins, otherwise the legacy global mode applies, otherwise
	 * {@link #DEFAULT_POLICY}.
	 *
	 * @param legacyGlobalMode legacy mode value (`keep-all`, `overwrite-empty`, `overwrite-all`), may be null or blank
	 * @param perLanguage      per-language policy values (`keep`, `fill-empty`, `overwrite-all`) keyed by language code
	 * @param targetLanguages  languages that must be present in the result
	 * @return resolved policies
	 * @throws IllegalArgumentException if any configured value is unknown
	 */
	@Nonnull
	public static LanguagePolicies resolve(
		@Nullable String legacyGlobalMode,
		@Nonnull Map<String, String> perLanguage,
		@Nonnull Collection<String> targetLanguages
	) {
		Objects.requireNonNull(perLanguage, "perLanguage must not be null");
		Objects.requireNonNull(targetLanguages, "targetLanguages must not be null");

		final OverwritePolicy fallback = legacyGlobalMode == null || legacyGlobalMode.isBlank()
			? DEFAULT_POLICY
			: LegacyOverwriteMode.fromValue(legacyGlobalMode).toPolicy();

		final Map<String, OverwritePolicy> resolved = new LinkedHashMap<>();
		for (final Map.Entry<String, String> entry : perLanguage.entrySet()) {
			if (entry.getValue() != null && !entry.getValue().isBlank()) {
				resolved.put(LanguageCodes.normalize(entry.getKey()), OverwritePolicy.fromValue(entry.getValue()));
			}
		}
		for (final String language : targetLanguages) {
			resolved.putIfAbsent(LanguageCodes.normalize(language), fallback);
		}
		return new LanguagePolicies(resolved, fallback);
	}

	/**
	 * Creates policies that apply the same value to every language.
	 *
	 * @param policy the policy for all languages
	 * @return uniform policies
	 */
	@Nonnull
	public static LanguagePolicies uniform(@Nonnull OverwritePolicy policy) {
		return new LanguagePolicies(Map.of(), policy);
	}

	/**
	 * Returns the policy for a language.
	 *
	 * @param language language code, normalized before lookup
	 * @return the configured policy or the fallback
	 */
	@Nonnull
	public OverwritePolicy policyFor(@Nonnull String language) {
		return this.policies.getOrDefault(LanguageCodes.normalize(language), this.fallback);
	}
}
