package io.evitadb.polyglot.glossary;

/**
 * Where the translation of a text came from.
 */
public enum TranslationOrigin {
	/**
	 * The whole text matched a glossary entry.
	 */
	GLOSSARY,
	/**
	 * A translation memory match reached the auto-apply threshold.
	 */
	MEMORY,
	/**
	 * The text was machine translated, possibly with glossary terms substituted.
	 */
	MACHINE,
	/**
	 * Translation failed; the text holds the failure sentinel.
	 */
	FAILED
}
