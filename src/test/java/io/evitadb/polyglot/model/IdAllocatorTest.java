package io.evitadb.polyglot.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("IdAllocator")
class IdAllocatorTest {

	@Test
	@DisplayName("allocates sequential ids starting at T1")
	void shouldAllocateSequentially() {
		final IdAllocator allocator = new IdAllocator();

		assertEquals("T1", allocator.next());
		assertEquals("T2", allocator.next());
		assertEquals(3, allocator.peek());
		assertEquals(2, allocator.allocatedCount());
	}

	@Test
	@DisplayName("restarts from its first id after reset")
	void shouldReset() {
		final IdAllocator allocator = IdAllocator.startingAt(7);
		allocator.next();
		allocator.next();

		allocator.reset();

		assertEquals("T7", allocator.next());
	}

	@Test
	@DisplayName("rejects a start below one")
	void shouldRejectInvalidStart() {
		assertThrows(IllegalArgumentException.class, () -> IdAllocator.startingAt(0));
	}

	@Test
	@DisplayName("formats and parses ids")
	void shouldFormatAndParse() {
		assertEquals("{T12}", IdAllocator.placeholder("T12"));
		assertEquals(12, IdAllocator.parse("T12"));
		assertThrows(IllegalArgumentException.class, () -> IdAllocator.parse("T0"));
		assertThrows(IllegalArgumentException.class, () -> IdAllocator.parse("X3"));
		assertThrows(IllegalArgumentException.class, () -> IdAllocator.parse("{T3}"));
	}
}
