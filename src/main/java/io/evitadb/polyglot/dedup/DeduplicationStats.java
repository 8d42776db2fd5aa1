package io.evitadb.polyglot.dedup;

/**
 * Savings achieved by translating each distinct string once.
 *
 * @param totalDocuments           number of documents in the batch
 * @param totalStrings             number of extracted segments
 * @param uniqueStrings            number of distinct texts
 * @param duplicateStrings         segments that need no own translation request
 * @param deduplicationPercentage  duplicate share of all segments, rounded to whole percent
 * @param savedRequests            translation requests saved per target language
 * @param totalCharacters          characters of all segments
 * @param uniqueCharacters         characters of the distinct texts
 * @param characterSavings         characters that are not sent for translation
 */
public record DeduplicationStats(
	int totalDocuments,
	int totalStrings,
	int uniqueStrings,
	int duplicateStrings,
	int deduplicationPercentage,
	int savedRequests,
	long totalCharacters,
	long uniqueCharacters,
	long characterSavings
) {
}
