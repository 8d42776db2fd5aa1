package io.evitadb.polyglot.memory;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("EditDistance")
class EditDistanceTest {

	@Test
	@DisplayName("counts insertions, deletions and substitutions")
	void shouldComputeDistance() {
		assertEquals(3, EditDistance.between("kitten", "sitting"));
		assertEquals(2, EditDistance.between("flaw", "lawn"));
		assertEquals(3, EditDistance.between("", "abc"));
		assertEquals(0, EditDistance.between("same", "same"));
	}

	@Test
	@DisplayName("scores similarity as a percentage of the longer text")
	void shouldComputeSimilarity() {
		assertEquals(100, EditDistance.similarity("abc", "abc"));
		assertEquals(100, EditDistance.similarity("", ""));
		assertEquals(75, EditDistance.similarity("abcd", "abce"));
		assertEquals(0, EditDistance.similarity("abc", ""));
	}
}
