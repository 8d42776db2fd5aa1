package io.evitadb.polyglot.dedup;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Distinct extracted texts of a batch with all their occurrences, in order of first appearance.
 *
 * The index is built once per batch by {@link Deduplicator} and is used to send every distinct text
 * for translation once and to hand the translation back to each occurrence.
 */
public final class UniqueStringIndex {

	@Nonnull
	private final Map<String, UniqueStringRecord> records;
	private final int documentCount;

	UniqueStringIndex(@Nonnull List<UniqueStringRecord> records, int documentCount) {
		final Map<String, UniqueStringRecord> byText = new LinkedHashMap<>();
		for (final UniqueStringRecord record : records) {
			byText.put(record.text(), record);
		}
		this.records = byText;
		this.documentCount = documentCount;
	}

	/**
	 * Returns all records in order of first appearance.
	 *
	 * @return immutable record list
	 */
	@Nonnull
	public List<UniqueStringRecord> records() {
		return List.copyOf(this.records.values());
	}

	/**
	 * Returns the distinct texts in order of first appearance.
	 *
	 * @return immutable text list
	 */
	@Nonnull
	public List<String> texts() {
		return List.copyOf(this.records.keySet());
	}

	@Nonnull
	public Optional<UniqueStringRecord> record(@Nonnull String text) {
		return Optional.ofNullable(this.records.get(text));
	}

	public int uniqueCount() {
		return this.records.size();
	}

	/**
	 * Returns the number of all occurrences of all texts.
	 *
	 * @return total occurrence count
	 */
	public int occurrenceCount() {
		int count = 0;
		for (final UniqueStringRecord record : this.records.values()) {
			count += record.occurrenceCount();
		}
		return count;
	}

	/**
	 * Computes the savings of this index.
	 *
	 * @return deduplication statistics
	 */
	@Nonnull
	public DeduplicationStats stats() {
		final int totalStrings = occurrenceCount();
		final int uniqueStrings = uniqueCount();
		final int duplicateStrings = totalStrings - uniqueStrings;
		long totalCharacters = 0;
		long uniqueCharacters = 0;
		for (final UniqueStringRecord record : this.records.values()) {
			totalCharacters += (long) record.text().length() * record.occurrenceCount();
			uniqueCharacters += record.text().length();
		}
		final int percentage = totalStrings > 0
			? (int) Math.round(duplicateStrings * 100.0 / totalStrings)
			: 0;
		return new DeduplicationStats(
			this.documentCount,
			totalStrings,
			uniqueStrings,
			duplicateStrings,
			percentage,
			duplicateStrings,
			totalCharacters,
			uniqueCharacters,
			totalCharacters - uniqueCharacters
		);
	}

	/**
	 * Hands translations of distinct texts back to every occurrence.
	 *
	 * Texts without a translation are left out, so a missing translation surfaces later as a
	 * missing segment id.
	 *
	 * @param translationsByText translation keyed by distinct text
	 * @return per document (by index), translation keyed by segment id
	 */
	@Nonnull
	public Map<Integer, Map<String, String>> distribute(@Nonnull Map<String, String> translationsByText) {
		Objects.requireNonNull(translationsByText, "translationsByText must not be null");
		final Map<Integer, Map<String, String>> result = new TreeMap<>();
		for (int i = 0; i < this.documentCount; i++) {
			result.put(i, new LinkedHashMap<>());
		}
		for (final UniqueStringRecord record : this.records.values()) {
			final String translation = translationsByText.get(record.text());
			if (translation == null) {
				continue;
			}
			for (final Occurrence occurrence : record.occurrences()) {
				result.computeIfAbsent(occurrence.documentIndex(), k -> new LinkedHashMap<>())
					.put(occurrence.segmentId(), translation);
			}
		}
		return result;
	}

	/**
	 * Returns a copy of the index without the given texts.
	 *
	 * @param excluded texts to drop
	 * @return filtered index over the same documents
	 */
	@Nonnull
	public UniqueStringIndex without(@Nonnull Collection<String> excluded) {
		Objects.requireNonNull(excluded, "excluded must not be null");
		final List<UniqueStringRecord> kept = new ArrayList<>(this.records.size());
		for (final UniqueStringRecord record : this.records.values()) {
			if (!excluded.contains(record.text())) {
				kept.add(record);
			}
		}
		return new UniqueStringIndex(kept, this.documentCount);
	}
}
