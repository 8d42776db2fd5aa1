package io.evitadb.polyglot.markup;

import javax.annotation.Nonnull;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * Walks a {@link MarkupNode} tree and notifies a visitor for each extractable text leaf.
 *
 * - Traversal uses an explicit stack, so deeply nested markup cannot overflow the call stack.
 * - Leaves are visited in document order: children are pushed in reverse.
 * - Children of raw-text elements (`script`, `style`) are skipped entirely.
 */
public final class TextNodeWalker {

	private TextNodeWalker() {
		// utility class
	}

	/**
	 * Visits every extractable text leaf of the tree in document order.
	 *
	 * @param root    root of the tree
	 * @param visitor callback receiving the leaves
	 */
	public static void walk(@Nonnull MarkupNode root, @Nonnull TextNodeVisitor visitor) {
		Objects.requireNonNull(root, "root must not be null");
		Objects.requireNonNull(visitor, "visitor must not be null");

		final Deque<MarkupNode> stack = new ArrayDeque<>();
		stack.push(root);
		while (!stack.isEmpty()) {
			final MarkupNode node = stack.pop();
			if (node.isText()) {
				visitor.visit(node);
				continue;
			}
			if (node.isRawText()) {
				continue;
			}
			final List<MarkupNode> children = node.getChildren();
			for (int i = children.size() - 1; i >= 0; i--) {
				stack.push(children.get(i));
			}
		}
	}

	/**
	 * Collects the extractable text leaves of the tree in document order.
	 *
	 * @param root root of the tree
	 * @return text leaves, never null
	 */
	@Nonnull
	public static List<MarkupNode> textLeaves(@Nonnull MarkupNode root) {
		final List<MarkupNode> leaves = new ArrayList<>();
		walk(root, leaves::add);
		return leaves;
	}
}
