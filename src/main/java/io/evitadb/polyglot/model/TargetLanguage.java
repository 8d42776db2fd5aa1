package io.evitadb.polyglot.model;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Target language of a merge together with its place in the document and its overwrite policy.
 *
 * @param code           normalized language code (`fr-FR`)
 * @param existingColumn index of the column already holding this language, null when the column is created
 * @param policy         resolved overwrite policy
 */
public record TargetLanguage(
	@Nonnull String code,
	@Nullable Integer existingColumn,
	@Nonnull OverwritePolicy policy
) {

	public TargetLanguage {
		Objects.requireNonNull(code, "code must not be null");
		Objects.requireNonNull(policy, "policy must not be null");
		code = LanguageCodes.normalize(code);
		if (code.isEmpty()) {
			throw new IllegalArgumentException("code must not be blank");
		}
		if (existingColumn != null && existingColumn < 0) {
			throw new IllegalArgumentException("existingColumn must not be negative");
		}
	}

	/**
	 * Creates a target whose column does not exist yet.
	 *
	 * @param code   language code
	 * @param policy overwrite policy
	 * @return the target
	 */
	@Nonnull
	public static TargetLanguage newColumn(@Nonnull String code, @Nonnull OverwritePolicy policy) {
		return new TargetLanguage(code, null, policy);
	}

	/**
	 * Creates a target stored in an existing column.
	 *
	 * @param code   language code
	 * @param column index of the existing column
	 * @param policy overwrite policy
	 * @return the target
	 */
	@Nonnull
	public static TargetLanguage existing(@Nonnull String code, int column, @Nonnull OverwritePolicy policy) {
		return new TargetLanguage(code, column, policy);
	}

	public boolean isExisting() {
		return this.existingColumn != null;
	}
}
