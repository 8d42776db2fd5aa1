package io.evitadb.polyglot.merge;

import javax.annotation.Nonnull;

/**
 * Reason behind a merge decision, recorded in the audit.
 */
public enum MergeReason {
	VERBATIM_ROW("verbatim row, no translation needed"),
	NO_SOURCE_CONTENT("source cell is empty"),
	NEW_LANGUAGE_COLUMN("new language column, target was empty"),
	NEW_LANGUAGE_COLUMN_FILLED("new language column, target already filled"),
	TARGET_EMPTY("target was empty"),
	FORMULA_MARKER("target held an unresolved translation formula"),
	TARGET_FILLED("fill-empty mode, target already filled"),
	OVERWRITE_ALL("overwrite-all mode"),
	KEEP("keep mode");

	@Nonnull
	private final String description;

	MergeReason(@Nonnull String description) {
		this.description = description;
	}

	@Nonnull
	public String getDescription() {
		return this.description;
	}

	@Override
	public String toString() {
		return this.description;
	}
}
