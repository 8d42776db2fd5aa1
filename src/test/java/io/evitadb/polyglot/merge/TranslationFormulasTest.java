package io.evitadb.polyglot.merge;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TranslationFormulas")
class TranslationFormulasTest {

	@Test
	@DisplayName("recognizes translation formula markers")
	void shouldRecognizeFormulas() {
		assertTrue(TranslationFormulas.isFormula("=TRANSLATE(C3,\"en\",\"fr\")"));
		assertTrue(TranslationFormulas.isFormula("  COPILOT(\"translate\", C3)"));
		assertFalse(TranslationFormulas.isFormula("<p>Bonjour</p>"));
		assertFalse(TranslationFormulas.isFormula("=SUM(A1:A3)"));
		assertFalse(TranslationFormulas.isFormula(null));
	}

	@Test
	@DisplayName("treats blank cells and formula markers as fillable")
	void shouldTreatFormulaAsBlank() {
		assertTrue(TranslationFormulas.isBlankOrFormula(null));
		assertTrue(TranslationFormulas.isBlankOrFormula(" "));
		assertTrue(TranslationFormulas.isBlankOrFormula("=COPILOT(x)"));
		assertFalse(TranslationFormulas.isBlankOrFormula("Bonjour"));
	}
}
