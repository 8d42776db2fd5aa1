package io.evitadb.polyglot.glossary;

import io.evitadb.polyglot.model.GlossaryEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("GlossarySubstitutor")
class GlossarySubstitutorTest {

	private GlossarySubstitutor substitutor;

	@BeforeEach
	void setUp() {
		substitutor = new GlossarySubstitutor(List.of(
			GlossaryEntry.of("en-GB", "catalog", "fr-FR", "catalogue"),
			GlossaryEntry.of("en-GB", "Product catalog", "fr-FR", "Catalogue produits"),
			GlossaryEntry.of("en-GB", "Save", "fr-FR", "Enregistrer"),
			GlossaryEntry.of("en-GB", "Zürich", "fr-FR", "Zurich")
		));
	}

	@Test
	@DisplayName("returns the glossary term for a whole-segment match ignoring case and padding")
	void shouldFindFullMatch() {
		final GlossarySubstitution result = substitutor.substitute("  save ", "en-GB", "fr-FR");

		assertTrue(result.isFullMatch());
		assertEquals("Enregistrer", result.fullMatchTranslation());
		assertEquals(Optional.of("Enregistrer"), substitutor.findFullMatch("SAVE", "en-GB", "fr-FR"));
	}

	@Test
	@DisplayName("replaces the longest term first")
	void shouldReplaceLongestTermFirst() {
		final GlossarySubstitution result = substitutor.substitute("Open the Product catalog now", "en-GB", "fr-FR");

		assertFalse(result.isFullMatch());
		assertEquals("Open the __GLOSS_0__ now", result.processedText());
		assertEquals(Map.of("__GLOSS_0__", "Catalogue produits"), result.substitutions());
	}

	@Test
	@DisplayName("uses one token for every occurrence of a term")
	void shouldReuseTokenForRepeatedTerm() {
		final GlossarySubstitution result = substitutor.substitute("catalog and catalog, then Save", "en-GB", "fr-FR");

		assertEquals("__GLOSS_0__ and __GLOSS_0__, then __GLOSS_1__", result.processedText());
		assertEquals(2, result.substitutions().size());
	}

	@Test
	@DisplayName("respects word boundaries for single words")
	void shouldRespectWordBoundaries() {
		final GlossarySubstitution result = substitutor.substitute("Browse the catalogs near Zürichsee", "en-GB", "fr-FR");

		assertFalse(result.hasSubstitutions());
		assertEquals("Browse the catalogs near Zürichsee", result.processedText());
		assertEquals(
			"Visit __GLOSS_0__ today",
			substitutor.substitute("Visit Zürich today", "en-GB", "fr-FR").processedText()
		);
	}

	@Test
	@DisplayName("matches embedded terms case-sensitively")
	void shouldMatchEmbeddedTermsCaseSensitively() {
		assertFalse(substitutor.substitute("Click save now", "en-GB", "fr-FR").hasSubstitutions());
	}

	@Test
	@DisplayName("ignores entries without a term in the target language")
	void shouldIgnoreEntriesWithoutTargetTerm() {
		final GlossarySubstitution result = substitutor.substitute("Save the catalog", "en-GB", "de-DE");

		assertFalse(result.hasSubstitutions());
		assertFalse(result.isFullMatch());
		assertTrue(substitutor.findFullMatch("Save", "en-GB", "de-DE").isEmpty());
	}

	@Test
	@DisplayName("restores tokens literally")
	void shouldRestoreLiterally() {
		final GlossarySubstitution result = substitutor.substitute("Open the Product catalog", "en-GB", "fr-FR");

		assertEquals("Ouvrir le Catalogue produits", result.restore("Ouvrir le __GLOSS_0__"));
		assertEquals("x $1 cost", GlossarySubstitutor.restore("x __GLOSS_0__", Map.of("__GLOSS_0__", "$1 cost")));
	}

	@Test
	@DisplayName("leaves text untouched with an empty glossary")
	void shouldHandleEmptyGlossary() {
		final GlossarySubstitution result = new GlossarySubstitutor(List.of()).substitute("Save", "en-GB", "fr-FR");

		assertFalse(result.isFullMatch());
		assertEquals("Save", result.processedText());
	}
}
