package io.evitadb.polyglot.model;

import javax.annotation.Nonnull;
import java.util.Locale;
import java.util.Objects;

/**
 * Per-language rule deciding whether content already present in a target column may be replaced.
 */
public enum OverwritePolicy {

	/**
	 * Existing cells are never written. A brand-new column is filled once.
	 */
	KEEP("keep"),

	/**
	 * Only blank cells (or unresolved translation formulas) are written.
	 */
	FILL_EMPTY("fill-empty"),

	/**
	 * Every cell is written.
	 */
	OVERWRITE_ALL("overwrite-all");

	private final String value;

	OverwritePolicy(@Nonnull String value) {
		this.value = value;
	}

	/**
	 * Returns the configuration value of the policy.
	 *
	 * @return value such as `fill-empty`
	 */
	@Nonnull
	public String getValue() {
		return this.value;
	}

	/**
	 * Parses a configuration value.
	 *
	 * @param value one of `keep`, `fill-empty`, `overwrite-all` (case-insensitive)
	 * @return the matching policy
	 * @throws IllegalArgumentException if the value is unknown
	 */
	@Nonnull
	public static OverwritePolicy fromValue(@Nonnull String value) {
		Objects.requireNonNull(value, "value must not be null");
		final String normalized = value.trim().toLowerCase(Locale.ROOT);
		for (final OverwritePolicy policy : values()) {
			if (policy.value.equals(normalized)) {
				return policy;
			}
		}
		throw new IllegalArgumentException(
			"Unknown overwrite policy: " + value + ". Supported values: keep, fill-empty, overwrite-all"
		);
	}

	@Override
	public String toString() {
		return this.value;
	}
}
