package io.evitadb.polyglot.merge;

import javax.annotation.Nonnull;
import java.util.List;
import java.util.Objects;

/**
 * Everything the merge engine decided and every problem it met.
 *
 * @param entries          one entry per processed row and language, in processing order
 * @param warnings         integrity warnings in processing order
 * @param skippedLanguages target languages left untouched because their translation table was missing or empty
 */
public record MergeAudit(
	@Nonnull List<AuditEntry> entries,
	@Nonnull List<IntegrityWarning> warnings,
	@Nonnull List<String> skippedLanguages
) {

	public MergeAudit {
		Objects.requireNonNull(entries, "entries must not be null");
		Objects.requireNonNull(warnings, "warnings must not be null");
		Objects.requireNonNull(skippedLanguages, "skippedLanguages must not be null");
		entries = List.copyOf(entries);
		warnings = List.copyOf(warnings);
		skippedLanguages = List.copyOf(skippedLanguages);
	}

	/**
	 * Returns the number of cells into which the source content was copied.
	 *
	 * @return count of {@link MergeAction#COPY_SOURCE} entries
	 */
	public int sourceCopiedCount() {
		return count(MergeAction.COPY_SOURCE);
	}

	/**
	 * Returns the number of cells that received a rebuilt translation.
	 *
	 * @return count of {@link MergeAction#WRITE_TRANSLATION} entries
	 */
	public int translatedCount() {
		return count(MergeAction.WRITE_TRANSLATION);
	}

	/**
	 * Returns the number of cells left unchanged.
	 *
	 * @return count of {@link MergeAction#SKIP} entries
	 */
	public int skippedCount() {
		return count(MergeAction.SKIP);
	}

	/**
	 * Returns the entries for one language.
	 *
	 * @param language target language code
	 * @return entries of the language in row order
	 */
	@Nonnull
	public List<AuditEntry> entriesFor(@Nonnull String language) {
		return this.entries.stream()
			.filter(entry -> entry.language().equals(language))
			.toList();
	}

	public boolean hasWarnings() {
		return !this.warnings.isEmpty();
	}

	private int count(@Nonnull MergeAction action) {
		int count = 0;
		for (final AuditEntry entry : this.entries) {
			if (entry.action() == action) {
				count++;
			}
		}
		return count;
	}
}
