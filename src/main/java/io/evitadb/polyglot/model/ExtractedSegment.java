package io.evitadb.polyglot.model;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * One minimal unit of translatable text pulled out of a row.
 * The id is unique within a single segmentation pass and is referenced from the row template
 * through the placeholder `{id}`.
 *
 * @param id       segment id allocated by {@link IdAllocator} (e.g. `T7`)
 * @param rowIndex index of the row the segment was extracted from
 * @param text     the trimmed translatable text
 */
public record ExtractedSegment(
	@Nonnull String id,
	int rowIndex,
	@Nonnull String text
) {

	public ExtractedSegment {
		Objects.requireNonNull(id, "id must not be null");
		Objects.requireNonNull(text, "text must not be null");
	}

	/**
	 * Returns the placeholder that stands for this segment inside a template.
	 *
	 * @return placeholder in the form `{T<n>}`
	 */
	@Nonnull
	public String placeholder() {
		return IdAllocator.placeholder(this.id);
	}
}
