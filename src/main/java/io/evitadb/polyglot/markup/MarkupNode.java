package io.evitadb.polyglot.markup;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Generic markup tree node: an ordered list of children and, for text leaves, the decoded text.
 *
 * Text leaves remember the span of the source they were parsed from and where each decoded
 * character boundary sits in that span, so callers can splice new text into the original string
 * without re-serializing the tree. Re-serialization would normalize attribute quoting and entity
 * encoding and break byte-exact reconstruction.
 */
public final class MarkupNode {

	/**
	 * Kind of markup node.
	 */
	public enum Kind {
		/**
		 * Root of the tree, spans the whole input.
		 */
		DOCUMENT,
		/**
		 * Element, explicit or implied by the parser.
		 */
		ELEMENT,
		/**
		 * Character data between tags.
		 */
		TEXT,
		/**
		 * Comment, declaration, CDATA section or raw data of `script` and `style`.
		 */
		OTHER
	}

	@Nonnull
	private final Kind kind;
	@Nullable
	private final String name;
	private final int start;
	private final int end;
	@Nullable
	private final String text;
	/**
	 * Source offset of each decoded character boundary relative to start, -1 inside a reference.
	 */
	@Nullable
	private final int[] sourceOffsets;
	private final boolean rawText;
	@Nonnull
	private final List<MarkupNode> children = new ArrayList<>();

	private MarkupNode(
		@Nonnull Kind kind,
		@Nullable String name,
		int start,
		int end,
		@Nullable String text,
		@Nullable int[] sourceOffsets,
		boolean rawText
	) {
		this.kind = Objects.requireNonNull(kind, "kind must not be null");
		this.name = name;
		this.start = start;
		this.end = end;
		this.text = text;
		this.sourceOffsets = sourceOffsets;
		this.rawText = rawText;
	}

	@Nonnull
	static MarkupNode document(int length) {
		return new MarkupNode(Kind.DOCUMENT, null, 0, length, null, null, false);
	}

	@Nonnull
	static MarkupNode element(@Nonnull String name, int start, int end, boolean rawText) {
		return new MarkupNode(Kind.ELEMENT, name, start, end, null, null, rawText);
	}

	/**
	 * Creates a text leaf.
	 *
	 * @param text          decoded text
	 * @param start         source offset of the leaf
	 * @param end           source offset after the leaf
	 * @param sourceOffsets source offset of every decoded boundary relative to start
	 */
	@Nonnull
	static MarkupNode text(@Nonnull String text, int start, int end, @Nonnull int[] sourceOffsets) {
		if (sourceOffsets.length != text.length() + 1) {
			throw new IllegalArgumentException("sourceOffsets must cover every boundary of the text");
		}
		return new MarkupNode(Kind.TEXT, null, start, end, text, sourceOffsets, false);
	}

	@Nonnull
	static MarkupNode other(int start, int end) {
		return new MarkupNode(Kind.OTHER, null, start, end, null, null, false);
	}

	void addChild(@Nonnull MarkupNode child) {
		this.children.add(child);
	}

	@Nonnull
	public Kind getKind() {
		return this.kind;
	}

	/**
	 * Returns the lower-cased element name.
	 *
	 * @return element name, null for non-element nodes
	 */
	@Nullable
	public String getName() {
		return this.name;
	}

	/**
	 * Returns the offset of the first source character of the node.
	 *
	 * @return start offset (inclusive), -1 for nodes the parser implied without source
	 */
	public int getStart() {
		return this.start;
	}

	/**
	 * Returns the offset after the last source character of the node.
	 *
	 * @return end offset (exclusive), -1 for elements closed implicitly
	 */
	public int getEnd() {
		return this.end;
	}

	/**
	 * Returns the text of a text leaf with character references decoded.
	 *
	 * @return text, null for non-text nodes
	 */
	@Nullable
	public String getText() {
		return this.text;
	}

	/**
	 * Maps a character boundary of the text to an absolute source offset.
	 *
	 * @param textIndex boundary in the text, 0..length
	 * @return source offset, or -1 when the boundary splits a character reference
	 */
	public int sourceOffset(int textIndex) {
		if (this.text == null || this.sourceOffsets == null) {
			throw new IllegalStateException("Only text leaves map offsets, this is " + this.kind);
		}
		if (textIndex < 0 || textIndex > this.text.length()) {
			throw new IndexOutOfBoundsException("textIndex " + textIndex + " outside 0.." + this.text.length());
		}
		final int relative = this.sourceOffsets[textIndex];
		return relative < 0 ? -1 : this.start + relative;
	}

	/**
	 * Returns true for elements whose content is not human-readable text (`script`, `style`).
	 *
	 * @return true when text children must not be extracted
	 */
	public boolean isRawText() {
		return this.rawText;
	}

	@Nonnull
	public List<MarkupNode> getChildren() {
		return Collections.unmodifiableList(this.children);
	}

	public boolean isText() {
		return this.kind == Kind.TEXT;
	}

	@Override
	public String toString() {
		return this.kind + (this.name == null ? "" : "<" + this.name + ">") + "[" + this.start + ".." + this.end + ")";
	}
}
