package io.evitadb.polyglot.segment;

import io.evitadb.polyglot.markup.MarkupNode;
import io.evitadb.polyglot.markup.MarkupParseException;
import io.evitadb.polyglot.markup.MarkupParser;
import io.evitadb.polyglot.markup.TextNodeWalker;
import io.evitadb.polyglot.mask.DoNotTranslateMasker;
import io.evitadb.polyglot.mask.TextRun;
import io.evitadb.polyglot.model.ExtractedSegment;
import io.evitadb.polyglot.model.IdAllocator;
import io.evitadb.polyglot.model.RowTemplate;
import io.evitadb.polyglot.model.SegmentationResult;
import io.evitadb.polyglot.model.SourceRow;
import org.apache.maven.plugin.logging.Log;
import org.apache.maven.plugin.logging.SystemStreamLog;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Splits row content into translatable segments and a template that rebuilds the row.
 *
 * Content containing tag-like syntax is parsed into a markup tree and every text leaf is processed
 * separately; any other content is processed as a single text leaf. Each leaf is split into
 * translatable and protected runs by a {@link DoNotTranslateMasker} created for the row. Every
 * translatable run that holds more than whitespace becomes one segment: its trimmed text is
 * extracted and replaced by the placeholder `{T<n>}`, while its leading and trailing whitespace and
 * all protected runs stay in the template verbatim.
 *
 * Markup text leaves are masked and extracted in decoded form (`R&amp;D` is the text `R&D`), so
 * protected terms and deduplication see the same text in markup and plain cells. The template is
 * spliced from the original source slices, never re-serialized from the tree. Placeholders of
 * markup leaves escape their values and write a value equal to the extracted text back in its source
 * encoding, so substituting every placeholder with its own segment text reproduces the row exactly.
 * A leaf whose run boundary would cut a character reference in two is kept verbatim.
 *
 * Markup that cannot be parsed degrades to a template equal to the original content without any
 * segment; this is logged as a warning and never thrown.
 */
public final class MarkupSegmenter {

	private static final Pattern NBSP_ENTITY = Pattern.compile("&(?:nbsp|#160|#x0*a0);", Pattern.CASE_INSENSITIVE);

	@Nonnull
	private final MarkupParser parser;
	@Nonnull
	private final Log log;

	/**
	 * Creates a segmenter logging to standard output.
	 */
	public MarkupSegmenter() {
		this(new SystemStreamLog());
	}

	/**
	 * Creates a segmenter.
	 *
	 * @param log Maven log for fail-soft warnings
	 */
	public MarkupSegmenter(@Nonnull Log log) {
		this.parser = new MarkupParser();
		this.log = Objects.requireNonNull(log, "log must not be null");
	}

	/**
	 * Segments the rows with a fresh allocator, so ids start at `T1`.
	 *
	 * @param rows            source rows in document order
	 * @param doNotTranslate  ordered Do-Not-Translate terms
	 * @return segments and one template per row
	 */
	@Nonnull
	public SegmentationResult segment(@Nonnull List<SourceRow> rows, @Nonnull List<String> doNotTranslate) {
		return segment(rows, doNotTranslate, new IdAllocator());
	}

	/**
	 * Segments the rows, taking ids from the caller's allocator.
	 *
	 * @param rows            source rows in document order
	 * @param doNotTranslate  ordered Do-Not-Translate terms
	 * @param allocator       id allocator owned by this pass
	 * @return segments and one template per row
	 */
	@Nonnull
	public SegmentationResult segment(
		@Nonnull List<SourceRow> rows,
		@Nonnull List<String> doNotTranslate,
		@Nonnull IdAllocator allocator
	) {
		Objects.requireNonNull(rows, "rows must not be null");
		Objects.requireNonNull(doNotTranslate, "doNotTranslate must not be null");
		Objects.requireNonNull(allocator, "allocator must not be null");

		final List<ExtractedSegment> segments = new ArrayList<>();
		final List<RowTemplate> templates = new ArrayList<>(rows.size());
		for (final SourceRow row : rows) {
			templates.add(segmentRow(row, doNotTranslate, allocator, segments));
		}
		return new SegmentationResult(segments, templates);
	}

	/**
	 * Segments a single row.
	 *
	 * @param row             the row
	 * @param doNotTranslate  ordered Do-Not-Translate terms
	 * @param allocator       id allocator owned by this pass
	 * @return the segments of the row and its template
	 */
	@Nonnull
	public SegmentationResult segmentRow(
		@Nonnull SourceRow row,
		@Nonnull List<String> doNotTranslate,
		@Nonnull IdAllocator allocator
	) {
		Objects.requireNonNull(row, "row must not be null");
		final List<ExtractedSegment> segments = new ArrayList<>();
		final RowTemplate template = segmentRow(row, doNotTranslate, allocator, segments);
		return new SegmentationResult(segments, List.of(template));
	}

	@Nonnull
	private RowTemplate segmentRow(
		@Nonnull SourceRow row,
		@Nonnull List<String> doNotTranslate,
		@Nonnull IdAllocator allocator,
		@Nonnull List<ExtractedSegment> segments
	) {
		final String content = row.content();
		if (content.isEmpty()) {
			return new RowTemplate(row.rowIndex(), content, List.of());
		}
		final DoNotTranslateMasker masker = DoNotTranslateMasker.forContent(content, doNotTranslate);

		if (!MarkupParser.looksLikeMarkup(content)) {
			final TemplateBuilder builder = new TemplateBuilder(row.rowIndex(), allocator, segments);
			for (final TextRun run : masker.split(content)) {
				builder.appendRun(run, null);
			}
			return builder.build();
		}

		final MarkupNode root;
		try {
			root = this.parser.parse(content);
		} catch (MarkupParseException e) {
			this.log.warn("Row " + row.rowIndex() + " contains malformed markup, nothing extracted: " + e.getMessage());
			return new RowTemplate(row.rowIndex(), content, List.of());
		}

		final TemplateBuilder builder = new TemplateBuilder(row.rowIndex(), allocator, segments);
		int cursor = 0;
		for (final MarkupNode textNode : TextNodeWalker.textLeaves(root)) {
			if (textNode.getStart() < cursor) {
				continue;
			}
			builder.appendSource(content, cursor, textNode.getStart());
			final List<TextRun> runs = masker.split(Objects.requireNonNull(textNode.getText()));
			if (splitsCharacterReference(textNode, runs)) {
				builder.appendSource(content, textNode.getStart(), textNode.getEnd());
			} else {
				final LeafSource leaf = new LeafSource(content, textNode);
				for (final TextRun run : runs) {
					builder.appendRun(run, leaf);
				}
			}
			cursor = textNode.getEnd();
		}
		builder.appendSource(content, cursor, content.length());
		return builder.build();
	}

	/**
	 * Returns true if a run or trimmed segment boundary falls inside a character reference, where no
	 * source offset exists to cut at.
	 */
	private static boolean splitsCharacterReference(@Nonnull MarkupNode textNode, @Nonnull List<TextRun> runs) {
		int position = 0;
		for (final TextRun run : runs) {
			final String value = run.value();
			if (textNode.sourceOffset(position) < 0) {
				return true;
			}
			if (!run.protectedTerm() && !isBlank(value)) {
				if (textNode.sourceOffset(position + leadingSpaceEnd(value)) < 0
					|| textNode.sourceOffset(position + trailingSpaceStart(value)) < 0) {
					return true;
				}
			}
			position += value.length();
		}
		return false;
	}

	/**
	 * Returns true if the text holds nothing but whitespace and non-breaking-space entities.
	 */
	static boolean isBlank(@Nonnull String text) {
		final String withoutEntities = NBSP_ENTITY.matcher(text).replaceAll("");
		for (int i = 0; i < withoutEntities.length(); i++) {
			if (!isSpace(withoutEntities.charAt(i))) {
				return false;
			}
		}
		return true;
	}

	private static int leadingSpaceEnd(@Nonnull String text) {
		int i = 0;
		while (i < text.length() && isSpace(text.charAt(i))) {
			i++;
		}
		return i;
	}

	private static int trailingSpaceStart(@Nonnull String text) {
		int i = text.length();
		while (i > 0 && isSpace(text.charAt(i - 1))) {
			i--;
		}
		return i;
	}

	private static boolean isSpace(char ch) {
		return Character.isWhitespace(ch) || Character.isSpaceChar(ch);
	}

	/**
	 * Decoded text of a markup leaf and the source it was decoded from.
	 */
	private static final class LeafSource {
		@Nonnull
		private final String content;
		@Nonnull
		private final MarkupNode textNode;
		private int position;

		LeafSource(@Nonnull String content, @Nonnull MarkupNode textNode) {
			this.content = content;
			this.textNode = textNode;
		}

		/**
		 * Returns the source slice of the decoded range [from, to) of the leaf.
		 */
		@Nonnull
		String source(int from, int to) {
			return this.content.substring(this.textNode.sourceOffset(from), this.textNode.sourceOffset(to));
		}
	}

	/**
	 * Accumulates the template, its placeholders and the segments of one row.
	 */
	private static final class TemplateBuilder {
		private final int rowIndex;
		@Nonnull
		private final IdAllocator allocator;
		@Nonnull
		private final List<ExtractedSegment> segments;
		private final StringBuilder template = new StringBuilder();
		private final List<RowTemplate.Placeholder> placeholders = new ArrayList<>();

		TemplateBuilder(int rowIndex, @Nonnull IdAllocator allocator, @Nonnull List<ExtractedSegment> segments) {
			this.rowIndex = rowIndex;
			this.allocator = allocator;
			this.segments = segments;
		}

		void appendSource(@Nonnull String content, int from, int to) {
			this.template.append(content, from, to);
		}

		/**
		 * Appends one run. Plain text runs are their own source; runs of a markup leaf are decoded and
		 * their source slices are written instead.
		 */
		void appendRun(@Nonnull TextRun run, @Nullable LeafSource leaf) {
			final String value = run.value();
			final int from = leaf == null ? 0 : leaf.position;
			if (leaf != null) {
				leaf.position += value.length();
			}
			if (run.protectedTerm() || isBlank(value)) {
				this.template.append(leaf == null ? value : leaf.source(from, from + value.length()));
				return;
			}
			final int coreStart = leadingSpaceEnd(value);
			final int coreEnd = trailingSpaceStart(value);
			final String text = value.substring(coreStart, coreEnd);
			final String id = this.allocator.next();
			this.segments.add(new ExtractedSegment(id, this.rowIndex, text));

			if (leaf == null) {
				this.template.append(value, 0, coreStart);
				this.placeholders.add(RowTemplate.Placeholder.plain(id, this.template.length()));
				this.template.append(IdAllocator.placeholder(id));
				this.template.append(value, coreEnd, value.length());
			} else {
				this.template.append(leaf.source(from, from + coreStart));
				this.placeholders.add(RowTemplate.Placeholder.markup(
					id, this.template.length(), text, leaf.source(from + coreStart, from + coreEnd)
				));
				this.template.append(IdAllocator.placeholder(id));
				this.template.append(leaf.source(from + coreEnd, from + value.length()));
			}
		}

		@Nonnull
		RowTemplate build() {
			return new RowTemplate(this.rowIndex, this.template.toString(), this.placeholders);
		}
	}
}
