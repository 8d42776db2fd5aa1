package io.evitadb.polyglot.llm;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * Text returned by the model for one request together with its token usage.
 *
 * @param text         the model's answer
 * @param inputTokens  tokens consumed by the prompt, 0 when the provider does not report usage
 * @param outputTokens tokens generated, 0 when the provider does not report usage
 */
public record LlmReply(@Nonnull String text, long inputTokens, long outputTokens) {

	public LlmReply {
		Objects.requireNonNull(text, "text must not be null");
	}
}
