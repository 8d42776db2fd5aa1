package io.evitadb.polyglot.mask;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Piece of text that is either translatable or protected by a Do-Not-Translate term.
 * Concatenating the values of all runs of a text yields the text unchanged.
 *
 * @param value     the literal text of the run
 * @param protectedTerm true when the run is an occurrence of a protected term
 */
public record TextRun(@Nonnull String value, boolean protectedTerm) {

	public TextRun {
		Objects.requireNonNull(value, "value must not be null");
	}

	@Nonnull
	static TextRun text(@Nonnull String value) {
		return new TextRun(value, false);
	}

	@Nonnull
	static TextRun term(@Nonnull String value) {
		return new TextRun(value, true);
	}
}
