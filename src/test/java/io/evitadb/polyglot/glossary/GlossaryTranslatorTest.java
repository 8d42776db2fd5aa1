package io.evitadb.polyglot.glossary;

import dev.langchain4j.exception.AuthenticationException;
import dev.langchain4j.exception.NonRetriableException;
import io.evitadb.polyglot.model.GlossaryEntry;
import org.apache.maven.plugin.logging.Log;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@DisplayName("GlossaryTranslator")
class GlossaryTranslatorTest {

	private SegmentTranslator translator;
	private Log log;
	private GlossaryTranslator glossaryTranslator;

	@BeforeEach
	void setUp() {
		translator = mock(SegmentTranslator.class);
		log = mock(Log.class);
		glossaryTranslator = new GlossaryTranslator(
			new GlossarySubstitutor(List.of(
				GlossaryEntry.of("en-GB", "Product catalog", "fr-FR", "Catalogue produits"),
				GlossaryEntry.of("en-GB", "Save", "fr-FR", "Enregistrer")
			)),
			translator,
			log
		);
	}

	@Test
	@DisplayName("answers full matches without calling the translator")
	void shouldNotTranslateFullMatch() throws Exception {
		final SegmentTranslation result = glossaryTranslator.translate("Save", "en-GB", "fr-FR");

		assertEquals(new SegmentTranslation("Enregistrer", TranslationOrigin.GLOSSARY), result);
		verify(translator, never()).translate(anyString(), anyString(), anyString());
	}

	@Test
	@DisplayName("translates protected text and restores glossary terms")
	void shouldRestoreGlossaryTerms() throws Exception {
		when(translator.translate("Open the __GLOSS_0__ now", "en-GB", "fr-FR"))
			.thenReturn("Ouvrir le __GLOSS_0__ maintenant");

		final SegmentTranslation result = glossaryTranslator.translate("Open the Product catalog now", "en-GB", "fr-FR");

		assertEquals("Ouvrir le Catalogue produits maintenant", result.text());
		assertEquals(TranslationOrigin.MACHINE, result.origin());
	}

	@Test
	@DisplayName("turns translation failures into sentinels")
	void shouldReturnSentinelOnFailure() throws Exception {
		when(translator.translate(anyString(), anyString(), anyString()))
			.thenThrow(new SegmentTranslationException("quota exceeded"));

		final SegmentTranslation result = glossaryTranslator.translate("Hello world", "en-GB", "fr-FR");

		assertTrue(result.isFailed());
		assertEquals("[Translation failed: quota exceeded]", result.text());
		assertTrue(SegmentTranslation.isFailureSentinel(result.text()));
		verify(log).error(any(CharSequence.class));
	}

	@Test
	@DisplayName("propagates permanent failures")
	void shouldPropagatePermanentFailure() throws Exception {
		when(translator.translate(anyString(), anyString(), anyString()))
			.thenThrow(new AuthenticationException("Invalid API key"));

		assertThrows(NonRetriableException.class,
			() -> glossaryTranslator.translate("Hello world", "en-GB", "fr-FR"));
	}

	@Test
	@DisplayName("looks up full matches only")
	void shouldLookUpGlossaryOnly() {
		assertNotNull(glossaryTranslator.fromGlossary(" save ", "en-GB", "fr-FR"));
		assertNull(glossaryTranslator.fromGlossary("Save changes", "en-GB", "fr-FR"));
	}
}
