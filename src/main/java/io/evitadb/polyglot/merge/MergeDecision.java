package io.evitadb.polyglot.merge;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Outcome of the decision table for one target cell.
 *
 * @param action what to do with the cell
 * @param reason why
 */
public record MergeDecision(@Nonnull MergeAction action, @Nonnull MergeReason reason) {

	public MergeDecision {
		Objects.requireNonNull(action, "action must not be null");
		Objects.requireNonNull(reason, "reason must not be null");
	}

	@Nonnull
	public static MergeDecision copy(@Nonnull MergeReason reason) {
		return new MergeDecision(MergeAction.COPY_SOURCE, reason);
	}

	@Nonnull
	public static MergeDecision write(@Nonnull MergeReason reason) {
		return new MergeDecision(MergeAction.WRITE_TRANSLATION, reason);
	}

	@Nonnull
	public static MergeDecision skip(@Nonnull MergeReason reason) {
		return new MergeDecision(MergeAction.SKIP, reason);
	}

	public boolean writes() {
		return this.action != MergeAction.SKIP;
	}
}
