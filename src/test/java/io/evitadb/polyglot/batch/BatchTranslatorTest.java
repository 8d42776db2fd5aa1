package io.evitadb.polyglot.batch;

import dev.langchain4j.exception.AuthenticationException;
import dev.langchain4j.exception.NonRetriableException;
import io.evitadb.polyglot.dedup.Deduplicator;
import io.evitadb.polyglot.dedup.UniqueStringIndex;
import io.evitadb.polyglot.glossary.GlossarySubstitutor;
import io.evitadb.polyglot.glossary.GlossaryTranslator;
import io.evitadb.polyglot.glossary.SegmentTranslationException;
import io.evitadb.polyglot.glossary.SegmentTranslator;
import io.evitadb.polyglot.glossary.TranslationOrigin;
import io.evitadb.polyglot.memory.FuzzyMatcher;
import io.evitadb.polyglot.model.ExtractedSegment;
import io.evitadb.polyglot.model.GlossaryEntry;
import io.evitadb.polyglot.model.SegmentationResult;
import io.evitadb.polyglot.model.TranslationMemoryUnit;
import org.apache.maven.plugin.logging.Log;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@DisplayName("BatchTranslator")
class BatchTranslatorTest {

	private SegmentTranslator translator;
	private Log log;
	private BatchTranslator batchTranslator;
	private UniqueStringIndex index;

	@BeforeEach
	void setUp() throws Exception {
		translator = mock(SegmentTranslator.class);
		log = mock(Log.class);
		final GlossaryTranslator glossaryTranslator = new GlossaryTranslator(
			new GlossarySubstitutor(List.of(
				GlossaryEntry.of("en-GB", "Save", "fr-FR", "Enregistrer"),
				GlossaryEntry.of("en-GB", "Product catalog", "fr-FR", "Catalogue produits")
			)),
			translator,
			log
		);
		final FuzzyMatcher memory = new FuzzyMatcher(List.of(
			new TranslationMemoryUnit("Delete item", "fr-FR", "Supprimer l'élément")
		));
		batchTranslator = new BatchTranslator(glossaryTranslator, memory, FuzzyMatcher.DEFAULT_AUTO_APPLY_THRESHOLD, log);
		index = Deduplicator.index(List.of(
			new SegmentationResult(List.of(
				new ExtractedSegment("T1", 1, "Save"),
				new ExtractedSegment("T2", 2, "Open the Product catalog now"),
				new ExtractedSegment("T3", 3, "Hello world")
			), List.of()),
			new SegmentationResult(List.of(
				new ExtractedSegment("T1", 1, "Delete item"),
				new ExtractedSegment("T2", 2, "Hello world")
			), List.of())
		));

		when(translator.translate("Open the __GLOSS_0__ now", "en-GB", "fr-FR"))
			.thenReturn("Ouvrir le __GLOSS_0__ maintenant");
		when(translator.translate("Hello world", "en-GB", "fr-FR"))
			.thenThrow(new SegmentTranslationException("timeout"));
	}

	@Test
	@DisplayName("prefers glossary, then memory, then machine translation")
	void shouldResolveInOrder() throws Exception {
		final BatchResult result = batchTranslator.translate(index, "en-GB", List.of("fr-FR"));

		final Map<String, String> texts = result.textsFor("fr-FR");
		assertEquals("Enregistrer", texts.get("Save"));
		assertEquals("Ouvrir le Catalogue produits maintenant", texts.get("Open the Product catalog now"));
		assertEquals("Supprimer l'élément", texts.get("Delete item"));
		assertEquals("[Translation failed: timeout]", texts.get("Hello world"));
		assertEquals(TranslationOrigin.MEMORY, result.translations().get("fr-FR").get("Delete item").origin());

		verify(translator, never()).translate(eq("Save"), anyString(), anyString());
		verify(translator, never()).translate(eq("Delete item"), anyString(), anyString());
	}

	@Test
	@DisplayName("translates every unique string once per language")
	void shouldTranslateUniqueStringsOnce() throws Exception {
		batchTranslator.translate(index, "en-GB", List.of("fr-FR"));

		verify(translator, times(1)).translate("Hello world", "en-GB", "fr-FR");
		verify(translator, times(2)).translate(anyString(), anyString(), anyString());
	}

	@Test
	@DisplayName("counts results per origin")
	void shouldCountStatistics() {
		final BatchResult result = batchTranslator.translate(index, "en-GB", List.of("FR-fr"));

		assertEquals(new LanguageStats("fr-FR", 1, 1, 1, 1), result.stats().get("fr-FR"));
		assertEquals(75, result.stats().get("fr-FR").successRate());
		assertTrue(result.hasFailures());
	}

	@Test
	@DisplayName("distributes translations back to every document")
	void shouldDistributeToDocuments() {
		final BatchResult result = batchTranslator.translate(index, "en-GB", List.of("fr-FR"));

		final Map<Integer, Map<String, Map<String, String>>> distributed = result.distribute(index);

		assertEquals("Enregistrer", distributed.get(0).get("fr-FR").get("T1"));
		assertEquals("Supprimer l'élément", distributed.get(1).get("fr-FR").get("T1"));
		assertEquals("[Translation failed: timeout]", distributed.get(1).get("fr-FR").get("T2"));
	}

	@Test
	@DisplayName("stops on permanent failures")
	void shouldStopOnPermanentFailure() throws Exception {
		when(translator.translate(anyString(), anyString(), eq("de-DE")))
			.thenThrow(new AuthenticationException("Invalid API key"));

		assertThrows(NonRetriableException.class,
			() -> batchTranslator.translate(index, "en-GB", List.of("de-DE")));
	}

	@Test
	@DisplayName("reports full success for an empty index")
	void shouldHandleEmptyIndex() {
		final BatchResult result = batchTranslator.translate(Deduplicator.index(List.of()), "en-GB", List.of("fr-FR"));

		assertEquals(100, result.stats().get("fr-FR").successRate());
		assertFalse(result.hasFailures());
	}
}
