package io.evitadb.polyglot.merge;

/**
 * What the merge engine did with one target cell.
 */
public enum MergeAction {
	/**
	 * The source content was copied unchanged.
	 */
	COPY_SOURCE,
	/**
	 * The rebuilt translation was written.
	 */
	WRITE_TRANSLATION,
	/**
	 * The cell was left as it was.
	 */
	SKIP
}
