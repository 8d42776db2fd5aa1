package io.evitadb.polyglot.markup;

import javax.annotation.Nonnull;

/**
 * Visitor receiving the extractable text leaves of a markup tree.
 *
 * Use this interface with {@link TextNodeWalker#walk(MarkupNode, TextNodeVisitor)} to process text
 * nodes in document order without recursion.
 */
@FunctionalInterface
public interface TextNodeVisitor {
	/**
	 * Called for each text leaf outside `script`, `style`, comments and declarations.
	 *
	 * @param textNode leaf of kind {@link MarkupNode.Kind#TEXT}
	 */
	void visit(@Nonnull MarkupNode textNode);
}
