package io.evitadb.polyglot.dedup;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;

/**
 * One distinct extracted text and every place it occurs.
 *
 * @param text        the extracted text
 * @param occurrences occurrences in extraction order, never empty
 */
public record UniqueStringRecord(@Nonnull String text, @Nonnull List<Occurrence> occurrences) {

	public UniqueStringRecord {
		Objects.requireNonNull(text, "text must not be null");
		Objects.requireNonNull(occurrences, "occurrences must not be null");
		if (occurrences.isEmpty()) {
			throw new IllegalArgumentException("occurrences must not be empty");
		}
		occurrences = List.copyOf(occurrences);
	}

	public int occurrenceCount() {
		return this.occurrences.size();
	}
}
