package io.evitadb.polyglot.dedup;

import io.evitadb.polyglot.model.ExtractedSegment;
import io.evitadb.polyglot.model.SegmentationResult;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Groups extracted segments of one or more documents by their text.
 *
 * The key is the extracted text itself, compared exactly. The surrounding markup is not part of a
 * segment, so the same words inside `<b>` and inside `<p>` share one record.
 */
public final class Deduplicator {

	private Deduplicator() {
		// utility class
	}

	/**
	 * Builds the index over the segmentation results of a batch; a document's index is its position
	 * in the list.
	 *
	 * @param documents segmentation result of each document
	 * @return unique string index
	 */
	@Nonnull
	public static UniqueStringIndex index(@Nonnull List<SegmentationResult> documents) {
		Objects.requireNonNull(documents, "documents must not be null");
		final Map<String, List<Occurrence>> occurrencesByText = new LinkedHashMap<>();
		for (int documentIndex = 0; documentIndex < documents.size(); documentIndex++) {
			final SegmentationResult document = Objects.requireNonNull(
				documents.get(documentIndex), "document must not be null"
			);
			for (final ExtractedSegment segment : document.segments()) {
				occurrencesByText.computeIfAbsent(segment.text(), k -> new ArrayList<>())
					.add(new Occurrence(documentIndex, segment.rowIndex(), segment.id()));
			}
		}
		final List<UniqueStringRecord> records = new ArrayList<>(occurrencesByText.size());
		for (final Map.Entry<String, List<Occurrence>> entry : occurrencesByText.entrySet()) {
			records.add(new UniqueStringRecord(entry.getKey(), entry.getValue()));
		}
		return new UniqueStringIndex(records, documents.size());
	}

	/**
	 * Builds the index over the segmentation result of a single document.
	 *
	 * @param document segmentation result
	 * @return unique string index with the document at index 0
	 */
	@Nonnull
	public static UniqueStringIndex index(@Nonnull SegmentationResult document) {
		return index(List.of(Objects.requireNonNull(document, "document must not be null")));
	}
}
