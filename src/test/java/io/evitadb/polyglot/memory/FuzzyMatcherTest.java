package io.evitadb.polyglot.memory;

import io.evitadb.polyglot.model.TranslationMemoryUnit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FuzzyMatcher")
class FuzzyMatcherTest {

	private static final List<TranslationMemoryUnit> UNITS = List.of(
		new TranslationMemoryUnit("Save changes", "fr-FR", "Enregistrer les modifications"),
		new TranslationMemoryUnit("Save all changes", "fr-FR", "Enregistrer toutes les modifications"),
		new TranslationMemoryUnit("Save changes", "de-DE", "Änderungen speichern"),
		new TranslationMemoryUnit("<b>Delete</b> item", "fr-CA", "Supprimer l'élément")
	);

	@Test
	@DisplayName("ranks exact and fuzzy matches of the target language")
	void shouldRankMatches() {
		final List<MemoryMatch> matches = new FuzzyMatcher(UNITS).findMatches("  SAVE   changes ", "fr-FR");

		assertEquals(2, matches.size());
		assertEquals(100, matches.get(0).score());
		assertEquals(MatchType.EXACT, matches.get(0).matchType());
		assertEquals("Enregistrer les modifications", matches.get(0).targetText());
		assertEquals(75, matches.get(1).score());
		assertEquals(MatchType.FUZZY, matches.get(1).matchType());
	}

	@Test
	@DisplayName("accepts units of the same base language and ignores markup")
	void shouldMatchSameBaseLanguage() {
		final List<MemoryMatch> matches = new FuzzyMatcher(UNITS).findMatches("Delete item", "fr-FR");

		assertEquals(1, matches.size());
		assertEquals("Supprimer l'élément", matches.get(0).targetText());
		assertEquals(100, matches.get(0).score());
	}

	@Test
	@DisplayName("drops matches below the threshold")
	void shouldRespectThreshold() {
		final FuzzyMatcher matcher = new FuzzyMatcher(UNITS, 80);

		final List<MemoryMatch> matches = matcher.findMatches("Save changes", "fr-FR");

		assertEquals(1, matches.size());
		assertEquals(80, matcher.getFuzzyThreshold());
	}

	@Test
	@DisplayName("keeps every score between 0 and 100")
	void shouldKeepScoresInBounds() {
		final List<MemoryMatch> matches = new FuzzyMatcher(UNITS, 0).findMatches("xyz", "fr-FR");

		assertEquals(3, matches.size());
		for (final MemoryMatch match : matches) {
			assertTrue(match.score() >= 0 && match.score() <= 100);
		}
	}

	@Test
	@DisplayName("finds nothing in an empty store or for another language")
	void shouldFindNothing() {
		assertTrue(new FuzzyMatcher(List.of()).findMatches("Save changes", "fr-FR").isEmpty());
		assertTrue(new FuzzyMatcher(UNITS).findBest("Save changes", "ja-JP").isEmpty());
	}

	@Test
	@DisplayName("returns the best match and tells whether it may be applied")
	void shouldReturnBestMatch() {
		final MemoryMatch best = new FuzzyMatcher(UNITS).findBest("Save all change", "fr-FR").orElseThrow();

		assertEquals("Enregistrer toutes les modifications", best.targetText());
		assertEquals(94, best.score());
		assertFalse(best.reaches(FuzzyMatcher.DEFAULT_AUTO_APPLY_THRESHOLD));
		assertTrue(best.reaches(90));
	}

	@Test
	@DisplayName("rejects thresholds outside 0 to 100")
	void shouldRejectInvalidThreshold() {
		assertThrows(IllegalArgumentException.class, () -> new FuzzyMatcher(UNITS, 101));
		assertThrows(IllegalArgumentException.class, () -> FuzzyMatcher.checkThreshold(-1, "autoApplyThreshold"));
	}
}
