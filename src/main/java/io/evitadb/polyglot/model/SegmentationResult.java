package io.evitadb.polyglot.model;

import javax.annotation.Nonnull;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Output of one segmentation pass: the extracted segments and one template per input row,
 * both in document order.
 *
 * @param segments  extracted segments in id order
 * @param templates one template per source row, in input order
 */
public record SegmentationResult(
	@Nonnull List<ExtractedSegment> segments,
	@Nonnull List<RowTemplate> templates
) {

	public SegmentationResult {
		Objects.requireNonNull(segments, "segments must not be null");
		Objects.requireNonNull(templates, "templates must not be null");
		segments = List.copyOf(segments);
		templates = List.copyOf(templates);
	}

	/**
	 * Returns the templates keyed by row index.
	 *
	 * @return insertion-ordered map of row index to template
	 */
	@Nonnull
	public Map<Integer, RowTemplate> templatesByRow() {
		final Map<Integer, RowTemplate> result = new LinkedHashMap<>();
		for (final RowTemplate template : this.templates) {
			result.put(template.rowIndex(), template);
		}
		return result;
	}

	/**
	 * Returns the original text of every segment keyed by id.
	 *
	 * @return insertion-ordered map of segment id to extracted text
	 */
	@Nonnull
	public Map<String, String> textById() {
		final Map<String, String> result = new LinkedHashMap<>();
		for (final ExtractedSegment segment : this.segments) {
			result.put(segment.id(), segment.text());
		}
		return result;
	}
}
