package io.evitadb.polyglot.markup;

import org.jsoup.nodes.CDataNode;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.Range;
import org.jsoup.nodes.TextNode;
import org.jsoup.parser.ParseError;
import org.jsoup.parser.Parser;
import org.jsoup.select.NodeTraversor;
import org.jsoup.select.NodeVisitor;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Builds a {@link MarkupNode} tree from HTML using the jsoup HTML5 parser with source position
 * tracking.
 *
 * jsoup is lenient the way browsers are: void elements never take children, stray end tags are
 * ignored and open elements are closed implicitly. The only input refused is input whose tokens are
 * cut off by the end of the content: an unterminated tag, quoted attribute value, comment or
 * declaration.
 *
 * Text leaves carry the decoded text together with the source offset of every decoded character
 * boundary, computed by decoding the source slice one character reference at a time. A text node
 * whose slice does not decode to what jsoup produced (text moved out of a table and merged with a
 * neighbour) has no single source span to splice into and is left out of the tree. The newline
 * jsoup drops after an opening `pre`, `listing` or `textarea` tag is the one rewrite tolerated.
 *
 * A `<` that does not start a tag, comment or declaration (`a < b`, `<3`) is ordinary text.
 */
public final class MarkupParser {

	/**
	 * Pattern deciding whether content should be treated as markup at all.
	 */
	private static final Pattern MARKUP_PATTERN = Pattern.compile("</?[a-z][\\s\\S]*>", Pattern.CASE_INSENSITIVE);
	private static final Pattern CHARACTER_REFERENCE = Pattern.compile(
		"&(?:#[xX][0-9a-fA-F]+;?|#[0-9]+;?|[A-Za-z][A-Za-z0-9]*;?)"
	);
	/**
	 * Prefix of the jsoup tokenizer error raised when the input ends inside a token.
	 */
	private static final String UNTERMINATED_TOKEN_ERROR = "Unexpectedly reached end of file";
	private static final Set<String> RAW_TEXT_ELEMENTS = Set.of("script", "style");

	/**
	 * Returns true if the content contains tag-like syntax.
	 *
	 * @param content the content to inspect
	 * @return true when the content should be parsed as markup
	 */
	public static boolean looksLikeMarkup(@Nonnull String content) {
		Objects.requireNonNull(content, "content must not be null");
		return MARKUP_PATTERN.matcher(content).find();
	}

	/**
	 * Parses the markup into a tree.
	 *
	 * @param input the markup to parse
	 * @return root node spanning the whole input
	 * @throws MarkupParseException if the input ends inside a tag, comment or declaration
	 */
	@Nonnull
	public MarkupNode parse(@Nonnull String input) throws MarkupParseException {
		Objects.requireNonNull(input, "input must not be null");

		// parser instances keep per-parse state, one per call
		final Parser parser = Parser.htmlParser()
			.setTrackPosition(true)
			.setTrackErrors(Integer.MAX_VALUE);
		final Document document = parser.parseInput(input, "");
		for (final ParseError error : parser.getErrors()) {
			if (error.getErrorMessage().startsWith(UNTERMINATED_TOKEN_ERROR)) {
				throw new MarkupParseException("Unterminated markup token", input, error.getPosition());
			}
		}

		final MarkupNode root = MarkupNode.document(input.length());
		final TreeBuilder builder = new TreeBuilder(input, root);
		NodeTraversor.traverse(builder, document);
		return root;
	}

	/**
	 * Decodes the source slice reference by reference and records where each decoded boundary sits.
	 *
	 * @param source  raw source slice of a text node
	 * @param decoded the text jsoup decoded from the slice
	 * @return offsets relative to the slice, or null when the slice does not decode to the text
	 */
	@Nullable
	static int[] alignDecoded(@Nonnull String source, @Nonnull String decoded) {
		final int[] offsets = new int[decoded.length() + 1];
		final Matcher reference = CHARACTER_REFERENCE.matcher(source);
		int decodedIndex = 0;
		int i = 0;
		while (i < source.length()) {
			String unit = String.valueOf(source.charAt(i));
			String value = unit;
			if (source.charAt(i) == '&' && reference.region(i, source.length()).lookingAt()) {
				final String decodedReference = Parser.unescapeEntities(reference.group(), false);
				// an unknown name stays literal text, character by character
				if (!decodedReference.equals(reference.group())) {
					unit = reference.group();
					value = decodedReference;
				}
			}
			if (!decoded.startsWith(value, decodedIndex)) {
				return null;
			}
			offsets[decodedIndex] = i;
			for (int k = 1; k < value.length(); k++) {
				offsets[decodedIndex + k] = -1;
			}
			decodedIndex += value.length();
			i += unit.length();
		}
		if (decodedIndex != decoded.length()) {
			return null;
		}
		offsets[decodedIndex] = source.length();
		return offsets;
	}

	private static int startOf(@Nonnull Range range) {
		return range.isTracked() && !range.isImplicit() ? range.startPos() : -1;
	}

	private static int endOf(@Nonnull Range range) {
		return range.isTracked() && !range.isImplicit() ? range.endPos() : -1;
	}

	/**
	 * Mirrors the jsoup tree into {@link MarkupNode}s. The traversal is iterative, so nesting depth
	 * is bounded by the heap only.
	 */
	private static final class TreeBuilder implements NodeVisitor {
		@Nonnull
		private final String input;
		@Nonnull
		private final Deque<MarkupNode> open = new ArrayDeque<>();

		TreeBuilder(@Nonnull String input, @Nonnull MarkupNode root) {
			this.input = input;
			this.open.push(root);
		}

		@Override
		public void head(@Nonnull Node node, int depth) {
			if (node instanceof Document) {
				return;
			}
			final MarkupNode parent = this.open.peek();
			if (node instanceof Element element) {
				final String name = element.normalName();
				final MarkupNode child = MarkupNode.element(
					name,
					startOf(element.sourceRange()),
					endOf(element.endSourceRange()),
					RAW_TEXT_ELEMENTS.contains(name)
				);
				parent.addChild(child);
				this.open.push(child);
			} else if (node instanceof TextNode text && !(node instanceof CDataNode)) {
				final MarkupNode leaf = toLeaf(text);
				if (leaf != null) {
					parent.addChild(leaf);
				}
			} else {
				final Range range = node.sourceRange();
				parent.addChild(MarkupNode.other(startOf(range), endOf(range)));
			}
		}

		@Override
		public void tail(@Nonnull Node node, int depth) {
			if (node instanceof Element && !(node instanceof Document)) {
				this.open.pop();
			}
		}

		@Nullable
		private MarkupNode toLeaf(@Nonnull TextNode node) {
			final Range range = node.sourceRange();
			final int start = startOf(range);
			final int end = endOf(range);
			if (start < 0 || end < start || end > this.input.length()) {
				// synthesized by the parser, nothing in the source to splice into
				return null;
			}
			final String source = this.input.substring(start, end);
			final String decoded = node.getWholeText();
			final int[] offsets = alignDecoded(source, decoded);
			if (offsets != null) {
				return MarkupNode.text(decoded, start, end, offsets);
			}
			if (source.startsWith("\n")) {
				final int[] shifted = alignDecoded(source.substring(1), decoded);
				if (shifted != null) {
					return MarkupNode.text(decoded, start + 1, end, shifted);
				}
			}
			return null;
		}
	}
}
