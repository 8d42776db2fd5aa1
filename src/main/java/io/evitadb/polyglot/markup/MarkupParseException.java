package io.evitadb.polyglot.markup;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Exception thrown when markup cannot be turned into a tree.
 * Contains the offending input and the character offset where parsing stopped.
 */
public final class MarkupParseException extends Exception {

	@Nonnull
	private final String input;
	private final int offset;

	/**
	 * Creates a new MarkupParseException.
	 *
	 * @param message the error message describing the parsing failure
	 * @param input   the markup that failed to parse
	 * @param offset  the character offset where the error was detected (0-based)
	 */
	public MarkupParseException(@Nonnull String message, @Nonnull String input, int offset) {
		super(message + " at offset " + offset);
		this.input = Objects.requireNonNull(input, "input must not be null");
		this.offset = offset;
	}

	/**
	 * Returns the markup that failed to parse.
	 *
	 * @return the raw input
	 */
	@Nonnull
	public String getInput() {
		return this.input;
	}

	/**
	 * Returns the character offset where the error was detected.
	 *
	 * @return 0-based offset
	 */
	public int getOffset() {
		return this.offset;
	}
}
