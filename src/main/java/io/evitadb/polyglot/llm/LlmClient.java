package io.evitadb.polyglot.llm;

import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.exception.LangChain4jException;
import dev.langchain4j.exception.NonRetriableException;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.TokenUsage;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Sends system/user prompt pairs to a LangChain4j {@link ChatModel} and remembers permanent failures.
 *
 * Retries with backoff are left to LangChain4j. Once the model reports a {@link NonRetriableException}
 * (invalid credentials, exhausted quota, malformed request) the client is closed for good: the
 * exception propagates and every later request rethrows it without contacting the model. Other
 * exceptions propagate as-is and leave the client usable.
 *
 * Token usage of all successful requests is summed up.
 */
public final class LlmClient {

	@Nonnull
	private final ChatModel model;
	@Nonnull
	private final AtomicReference<NonRetriableException> permanentFailure = new AtomicReference<>();
	@Nonnull
	private final AtomicLong inputTokens = new AtomicLong();
	@Nonnull
	private final AtomicLong outputTokens = new AtomicLong();

	/**
	 * Creates a client for the model.
	 *
	 * @param model the underlying chat model
	 */
	public LlmClient(@Nonnull ChatModel model) {
		this.model = Objects.requireNonNull(model, "model must not be null");
	}

	/**
	 * Sends one request.
	 *
	 * @param systemPrompt instructions for the model
	 * @param userPrompt   the text to work on
	 * @return the model's answer
	 * @throws NonRetriableException if the model failed permanently, now or in an earlier request
	 * @throws LangChain4jException  for other model errors
	 */
	@Nonnull
	public LlmReply complete(@Nonnull String systemPrompt, @Nonnull String userPrompt) {
		Objects.requireNonNull(systemPrompt, "systemPrompt must not be null");
		Objects.requireNonNull(userPrompt, "userPrompt must not be null");

		final NonRetriableException previous = this.permanentFailure.get();
		if (previous != null) {
			throw previous;
		}

		final ChatResponse response;
		try {
			response = this.model.chat(List.of(SystemMessage.from(systemPrompt), UserMessage.from(userPrompt)));
		} catch (NonRetriableException e) {
			this.permanentFailure.compareAndSet(null, e);
			throw e;
		}

		final TokenUsage usage = response.tokenUsage();
		final long input = usage != null && usage.inputTokenCount() != null ? usage.inputTokenCount() : 0;
		final long output = usage != null && usage.outputTokenCount() != null ? usage.outputTokenCount() : 0;
		this.inputTokens.addAndGet(input);
		this.outputTokens.addAndGet(output);

		final String text = response.aiMessage() == null ? null : response.aiMessage().text();
		return new LlmReply(text == null ? "" : text, input, output);
	}

	/**
	 * Returns true once the model has failed permanently.
	 *
	 * @return true when every further request fails immediately
	 */
	public boolean hasPermanentFailure() {
		return this.permanentFailure.get() != null;
	}

	/**
	 * Returns the permanent failure, if any.
	 *
	 * @return the exception that closed the client or null
	 */
	@Nullable
	public NonRetriableException getFailureCause() {
		return this.permanentFailure.get();
	}

	public long getInputTokens() {
		return this.inputTokens.get();
	}

	public long getOutputTokens() {
		return this.outputTokens.get();
	}
}
