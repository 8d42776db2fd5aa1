package io.evitadb.polyglot.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RowTemplate")
class RowTemplateTest {

	@Test
	@DisplayName("substitutes every placeholder")
	void shouldFillPlaceholders() {
		final RowTemplate template = RowTemplate.of(1, "<p>{T1} <b>{T2}</b></p>", List.of("T1", "T2"));

		assertEquals(List.of("T1", "T2"), template.segmentIds());
		assertEquals("<p>Bonjour <b>monde</b></p>", template.fill(Map.of("T1", "Bonjour", "T2", "monde")));
	}

	@Test
	@DisplayName("leaves placeholders without a value in place")
	void shouldKeepUnresolvedPlaceholders() {
		final RowTemplate template = RowTemplate.of(1, "{T1} and {T2}", List.of("T1", "T2"));

		assertEquals("{T1} and deux", template.fill(Map.of("T2", "deux")));
	}

	@Test
	@DisplayName("does not rescan inserted values")
	void shouldNotRescanInsertedValues() {
		final RowTemplate template = RowTemplate.of(1, "{T1} {T2}", List.of("T1", "T2"));

		assertEquals("{T2} b", template.fill(Map.of("T1", "{T2}", "T2", "b")));
	}

	@Test
	@DisplayName("inserts values containing regex replacement characters literally")
	void shouldInsertLiterally() {
		final RowTemplate template = RowTemplate.of(0, "Price: {T1}", List.of("T1"));

		assertEquals("Price: $1 \\ 5", template.fill(Map.of("T1", "$1 \\ 5")));
	}

	@Test
	@DisplayName("fills the recorded position and leaves identical literal text alone")
	void shouldFillByPosition() {
		final RowTemplate template = new RowTemplate(
			0, "{T1} {T1}", List.of(RowTemplate.Placeholder.plain("T1", 5))
		);

		assertEquals("{T1} Bonjour", template.fill(Map.of("T1", "Bonjour")));
	}

	@Test
	@DisplayName("escapes values of markup placeholders and keeps the source encoding of unchanged text")
	void shouldEscapeMarkupValues() {
		final RowTemplate template = new RowTemplate(
			0, "<p>{T1}</p>", List.of(RowTemplate.Placeholder.markup("T1", 3, "Café & bar", "Caf&eacute; &amp; bar"))
		);

		assertEquals("<p>Caf&eacute; &amp; bar</p>", template.fill(Map.of("T1", "Café & bar")));
		assertEquals("<p>R&amp;D &lt;3</p>", template.fill(Map.of("T1", "R&D <3")));
		assertTrue(template.placeholders().get(0).isMarkup());
	}

	@Test
	@DisplayName("rejects placeholders that are not where they claim to be")
	void shouldRejectMisplacedPlaceholders() {
		assertThrows(IllegalArgumentException.class,
			() -> new RowTemplate(0, "{T1} x", List.of(RowTemplate.Placeholder.plain("T1", 2))));
		assertThrows(IllegalArgumentException.class,
			() -> new RowTemplate(0, "{T1}{T2}", List.of(
				RowTemplate.Placeholder.plain("T2", 4), RowTemplate.Placeholder.plain("T1", 0)
			)));
		assertThrows(IllegalArgumentException.class, () -> RowTemplate.of(0, "{T1}", List.of("T2")));
	}

	@Test
	@DisplayName("reports whether it carries segments")
	void shouldReportSegments() {
		assertTrue(RowTemplate.of(0, "https://example.com", List.of()).hasNoSegments());
		assertFalse(RowTemplate.of(0, "{T1}", List.of("T1")).hasNoSegments());
	}
}
