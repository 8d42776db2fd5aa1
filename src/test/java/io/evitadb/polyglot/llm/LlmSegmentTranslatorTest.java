package io.evitadb.polyglot.llm;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.AuthenticationException;
import dev.langchain4j.exception.NonRetriableException;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import io.evitadb.polyglot.glossary.SegmentTranslationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

@DisplayName("LlmSegmentTranslator")
class LlmSegmentTranslatorTest {

	private ChatModel mockModel;
	private LlmSegmentTranslator translator;

	@BeforeEach
	void setUp() {
		mockModel = mock(ChatModel.class);
		translator = new LlmSegmentTranslator(new LlmClient(mockModel), new PromptLoader());
	}

	private void reply(String text) {
		when(mockModel.chat(anyList())).thenReturn(ChatResponse.builder().aiMessage(AiMessage.from(text)).build());
	}

	@Test
	@DisplayName("sends rendered prompts and trims the reply")
	@SuppressWarnings("unchecked")
	void shouldTranslate() throws Exception {
		reply("  Bonjour __GLOSS_0__ \n");

		assertEquals("Bonjour __GLOSS_0__", translator.translate("Hello __GLOSS_0__", "en-GB", "fr-FR"));

		final ArgumentCaptor<List<ChatMessage>> captor = ArgumentCaptor.forClass(List.class);
		verify(mockModel).chat(captor.capture());
		final List<ChatMessage> messages = captor.getValue();
		assertTrue(((SystemMessage) messages.get(0)).text().contains("from en-GB to fr-FR"));
		assertEquals("Hello __GLOSS_0__", ((UserMessage) messages.get(1)).singleText());
	}

	@Test
	@DisplayName("rejects replies that drop glossary tokens")
	void shouldRejectDroppedToken() {
		reply("Bonjour catalogue");

		final SegmentTranslationException ex = assertThrows(SegmentTranslationException.class,
			() -> translator.translate("Hello __GLOSS_0__", "en-GB", "fr-FR"));
		assertTrue(ex.getMessage().contains("__GLOSS_0__"));
	}

	@Test
	@DisplayName("rejects empty replies")
	void shouldRejectEmptyReply() {
		reply("   ");

		assertThrows(SegmentTranslationException.class, () -> translator.translate("Hello", "en-GB", "fr-FR"));
	}

	@Test
	@DisplayName("wraps retriable model errors")
	void shouldWrapRetriableErrors() {
		when(mockModel.chat(anyList())).thenThrow(new RateLimitException("Rate limit exceeded"));

		final SegmentTranslationException ex = assertThrows(SegmentTranslationException.class,
			() -> translator.translate("Hello", "en-GB", "fr-FR"));
		assertEquals("Rate limit exceeded", ex.getMessage());
		assertInstanceOf(RateLimitException.class, ex.getCause());
	}

	@Test
	@DisplayName("propagates permanent failures")
	void shouldPropagatePermanentFailure() {
		when(mockModel.chat(anyList())).thenThrow(new AuthenticationException("Invalid API key"));

		assertThrows(NonRetriableException.class, () -> translator.translate("Hello", "en-GB", "fr-FR"));
	}
}
