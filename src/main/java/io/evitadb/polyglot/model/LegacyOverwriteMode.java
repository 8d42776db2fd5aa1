package io.evitadb.polyglot.model;

import javax.annotation.Nonnull;
import java.util.Locale;
import java.util.Objects;

/**
 * Global overwrite mode of older configurations. Only read while resolving configuration,
 * the merge engine works exclusively with {@link OverwritePolicy}.
 */
public enum LegacyOverwriteMode {

	KEEP_ALL("keep-all", OverwritePolicy.KEEP),
	OVERWRITE_EMPTY("overwrite-empty", OverwritePolicy.FILL_EMPTY),
	OVERWRITE_ALL("overwrite-all", OverwritePolicy.OVERWRITE_ALL);

	private final String value;
	private final OverwritePolicy policy;

	LegacyOverwriteMode(@Nonnull String value, @Nonnull OverwritePolicy policy) {
		this.value = value;
		this.policy = policy;
	}

	@Nonnull
	public String getValue() {
		return this.value;
	}

	/**
	 * Returns the per-language policy equivalent to this global mode.
	 *
	 * @return the equivalent policy
	 */
	@Nonnull
	public OverwritePolicy toPolicy() {
		return this.policy;
	}

	/**
	 * Parses a legacy configuration value.
	 *
	 * @param value one of `keep-all`, `overwrite-empty`, `overwrite-all` (case-insensitive)
	 * @return the matching mode
	 * @throws IllegalArgumentException if the value is unknown
	 */
	@Nonnull
	public static LegacyOverwriteMode fromValue(@Nonnull String value) {
		Objects.requireNonNull(value, "value must not be null");
		final String normalized = value.trim().toLowerCase(Locale.ROOT);
		for (final LegacyOverwriteMode mode : values()) {
			if (mode.value.equals(normalized)) {
				return mode;
			}
		}
		throw new IllegalArgumentException(
			"Unknown overwrite mode: " + value + ". Supported values: keep-all, overwrite-empty, overwrite-all"
		);
	}
}
