package io.evitadb.polyglot.model;

import javax.annotation.Nonnull;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Caller-owned counter that hands out segment ids (`T1`, `T2`, ...) for one segmentation pass.
 *
 * Instances are not thread-safe and are meant to be confined to the pass that owns them. Two passes
 * running concurrently must each use their own allocator; resetting an allocator before a repeated
 * pass over the same input reproduces the same ids.
 */
public final class IdAllocator {

	/**
	 * Prefix of every segment id.
	 */
	public static final String ID_PREFIX = "T";

	private static final Pattern ID_PATTERN = Pattern.compile("T([1-9]\\d*)");

	private final int start;
	private int next;

	/**
	 * Creates an allocator whose first id is `T1`.
	 */
	public IdAllocator() {
		this(1);
	}

	private IdAllocator(int start) {
		if (start < 1) {
			throw new IllegalArgumentException("start must be at least 1");
		}
		this.start = start;
		this.next = start;
	}

	/**
	 * Creates an allocator whose first id is `T<start>`.
	 *
	 * @param start the first number to hand out
	 * @return a fresh allocator
	 */
	@Nonnull
	public static IdAllocator startingAt(int start) {
		return new IdAllocator(start);
	}

	/**
	 * Allocates the next id.
	 *
	 * @return id in the form `T<n>`
	 */
	@Nonnull
	public String next() {
		return ID_PREFIX + this.next++;
	}

	/**
	 * Returns the number the next call to {@link #next()} will use.
	 *
	 * @return the next number
	 */
	public int peek() {
		return this.next;
	}

	/**
	 * Returns how many ids were allocated since creation or the last reset.
	 *
	 * @return allocated id count
	 */
	public int allocatedCount() {
		return this.next - this.start;
	}

	/**
	 * Rewinds the allocator to its starting number.
	 */
	public void reset() {
		this.next = this.start;
	}

	/**
	 * Builds the template placeholder for the id.
	 *
	 * @param id segment id
	 * @return placeholder in the form `{T<n>}`
	 */
	@Nonnull
	public static String placeholder(@Nonnull String id) {
		Objects.requireNonNull(id, "id must not be null");
		return "{" + id + "}";
	}

	/**
	 * Parses the numeric part of a segment id.
	 *
	 * @param id segment id such as `T7`
	 * @return the number
	 * @throws IllegalArgumentException if the id is not a well-formed segment id
	 */
	public static int parse(@Nonnull String id) {
		Objects.requireNonNull(id, "id must not be null");
		final Matcher matcher = ID_PATTERN.matcher(id);
		if (!matcher.matches()) {
			throw new IllegalArgumentException("Not a segment id: " + id);
		}
		return Integer.parseInt(matcher.group(1));
	}
}
