package io.evitadb.polyglot.dedup;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Place where a unique string was extracted.
 *
 * @param documentIndex index of the document in the batch
 * @param rowIndex      row of the document
 * @param segmentId     id of the segment within the document's segmentation pass
 */
public record Occurrence(int documentIndex, int rowIndex, @Nonnull String segmentId) {

	public Occurrence {
		Objects.requireNonNull(segmentId, "segmentId must not be null");
	}
}
