package io.evitadb.polyglot.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TargetLanguage")
class TargetLanguageTest {

	@Test
	@DisplayName("normalizes the code and remembers the column")
	void shouldNormalizeCode() {
		final TargetLanguage target = TargetLanguage.existing("fr_fr", 4, OverwritePolicy.KEEP);

		assertEquals("fr-FR", target.code());
		assertTrue(target.isExisting());
		assertFalse(TargetLanguage.newColumn("de-DE", OverwritePolicy.KEEP).isExisting());
	}

	@Test
	@DisplayName("rejects a blank code and a negative column")
	void shouldRejectInvalidValues() {
		assertThrows(IllegalArgumentException.class, () -> TargetLanguage.newColumn(" ", OverwritePolicy.KEEP));
		assertThrows(IllegalArgumentException.class, () -> TargetLanguage.existing("fr-FR", -1, OverwritePolicy.KEEP));
	}
}
