package io.evitadb.polyglot.merge;

import io.evitadb.polyglot.model.OverwritePolicy;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Objects;

/**
 * Decision table of the merge engine. Every combination of inputs maps to exactly one decision.
 *
 * Rows without translatable segments:
 *
 * | verbatim | source content | column   | policy        | target blank | decision                   |
 * |----------|----------------|----------|---------------|--------------|----------------------------|
 * | yes      | yes            | any      | any           | any          | copy, verbatim row         |
 * | any      | no             | any      | any           | any          | skip, no source content    |
 * | no       | yes            | new      | any           | yes          | copy, new language column  |
 * | no       | yes            | new      | any           | no           | skip, new column filled    |
 * | no       | yes            | existing | fill-empty    | yes          | copy, target empty         |
 * | no       | yes            | existing | fill-empty    | no           | skip, target filled        |
 * | no       | yes            | existing | overwrite-all | any          | copy, overwrite-all        |
 * | no       | yes            | existing | keep          | any          | skip, keep                 |
 *
 * Rows with translatable segments:
 *
 * | target                 | policy        | decision               |
 * |------------------------|---------------|------------------------|
 * | blank                  | any           | write, target empty    |
 * | formula marker         | any           | write, formula marker  |
 * | real content           | overwrite-all | write, overwrite-all   |
 * | real content           | fill-empty    | skip, target filled    |
 * | real content           | keep          | skip, keep             |
 *
 * A cell of a newly created column is always blank. A formula marker counts as blank in both tables.
 */
public final class CopyDecisionTable {

	private CopyDecisionTable() {
		// utility class
	}

	/**
	 * Decides about a row without translatable segments.
	 *
	 * @param verbatimEligible  the caller flagged the row for verbatim copy
	 * @param existingLanguage  the language column existed before the merge
	 * @param policy            overwrite policy of the language
	 * @param targetEmpty       the target cell is blank or holds a formula marker
	 * @param sourceHasContent  the source cell holds non-blank content
	 * @return the decision
	 */
	@Nonnull
	public static MergeDecision decideUntranslatable(
		boolean verbatimEligible,
		boolean existingLanguage,
		@Nonnull OverwritePolicy policy,
		boolean targetEmpty,
		boolean sourceHasContent
	) {
		Objects.requireNonNull(policy, "policy must not be null");
		if (!sourceHasContent) {
			return MergeDecision.skip(MergeReason.NO_SOURCE_CONTENT);
		}
		if (verbatimEligible) {
			return MergeDecision.copy(MergeReason.VERBATIM_ROW);
		}
		if (!existingLanguage) {
			return targetEmpty
				? MergeDecision.copy(MergeReason.NEW_LANGUAGE_COLUMN)
				: MergeDecision.skip(MergeReason.NEW_LANGUAGE_COLUMN_FILLED);
		}
		return switch (policy) {
			case FILL_EMPTY -> targetEmpty
				? MergeDecision.copy(MergeReason.TARGET_EMPTY)
				: MergeDecision.skip(MergeReason.TARGET_FILLED);
			case OVERWRITE_ALL -> MergeDecision.copy(MergeReason.OVERWRITE_ALL);
			case KEEP -> MergeDecision.skip(MergeReason.KEEP);
		};
	}

	/**
	 * Decides about a row with translatable segments.
	 *
	 * @param policy        overwrite policy of the language
	 * @param targetValue   current value of the target cell, may be null
	 * @return the decision
	 */
	@Nonnull
	public static MergeDecision decideTranslated(@Nonnull OverwritePolicy policy, @Nullable String targetValue) {
		Objects.requireNonNull(policy, "policy must not be null");
		if (targetValue == null || targetValue.isBlank()) {
			return MergeDecision.write(MergeReason.TARGET_EMPTY);
		}
		if (TranslationFormulas.isFormula(targetValue)) {
			return MergeDecision.write(MergeReason.FORMULA_MARKER);
		}
		return switch (policy) {
			case OVERWRITE_ALL -> MergeDecision.write(MergeReason.OVERWRITE_ALL);
			case FILL_EMPTY -> MergeDecision.skip(MergeReason.TARGET_FILLED);
			case KEEP -> MergeDecision.skip(MergeReason.KEEP);
		};
	}
}
