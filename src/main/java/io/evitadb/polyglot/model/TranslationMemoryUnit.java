package io.evitadb.polyglot.model;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * One previously approved translation stored in a translation memory.
 *
 * @param sourceText the source side of the unit
 * @param targetLang language code of the target side
 * @param targetText the stored translation
 */
public record TranslationMemoryUnit(
	@Nonnull String sourceText,
	@Nonnull String targetLang,
	@Nonnull String targetText
) {

	public TranslationMemoryUnit {
		Objects.requireNonNull(sourceText, "sourceText must not be null");
		Objects.requireNonNull(targetLang, "targetLang must not be null");
		Objects.requireNonNull(targetText, "targetText must not be null");
	}
}
