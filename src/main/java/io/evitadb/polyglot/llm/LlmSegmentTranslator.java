package io.evitadb.polyglot.llm;

import dev.langchain4j.exception.NonRetriableException;
import io.evitadb.polyglot.glossary.GlossarySubstitutor;
import io.evitadb.polyglot.glossary.SegmentTranslationException;
import io.evitadb.polyglot.glossary.SegmentTranslator;

import javax.annotation.Nonnull;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@link SegmentTranslator} asking a chat model for the translation of one segment.
 *
 * The prompts come from `translate-segment-system.txt` and `translate-segment-user.txt`. The answer
 * is trimmed and must contain every glossary token of the request; an empty answer, a lost token or
 * a model error make the segment fail. A permanent model failure is not converted: it propagates so
 * the caller can stop the batch.
 */
public final class LlmSegmentTranslator implements SegmentTranslator {

	static final String SYSTEM_TEMPLATE = "translate-segment-system.txt";
	static final String USER_TEMPLATE = "translate-segment-user.txt";

	private static final Pattern GLOSSARY_TOKEN = Pattern.compile(
		Pattern.quote(GlossarySubstitutor.PLACEHOLDER_PREFIX) + "\\d+" + Pattern.quote(GlossarySubstitutor.PLACEHOLDER_SUFFIX)
	);

	@Nonnull
	private final LlmClient client;
	@Nonnull
	private final PromptLoader promptLoader;

	/**
	 * Creates the translator.
	 *
	 * @param client       client of the chat model
	 * @param promptLoader loader of the prompt templates
	 */
	public LlmSegmentTranslator(@Nonnull LlmClient client, @Nonnull PromptLoader promptLoader) {
		this.client = Objects.requireNonNull(client, "client must not be null");
		this.promptLoader = Objects.requireNonNull(promptLoader, "promptLoader must not be null");
	}

	@Nonnull
	@Override
	public String translate(
		@Nonnull String text,
		@Nonnull String sourceLanguage,
		@Nonnull String targetLanguage
	) throws SegmentTranslationException {
		Objects.requireNonNull(text, "text must not be null");
		final Map<String, String> values = Map.of(
			"sourceLanguage", sourceLanguage,
			"targetLanguage", targetLanguage,
			"text", text
		);
		final String systemPrompt = this.promptLoader.render(SYSTEM_TEMPLATE, values);
		final String userPrompt = this.promptLoader.render(USER_TEMPLATE, values);

		final LlmReply reply;
		try {
			reply = this.client.complete(systemPrompt, userPrompt);
		} catch (NonRetriableException e) {
			throw e;
		} catch (RuntimeException e) {
			throw new SegmentTranslationException(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage(), e);
		}

		final String translated = reply.text().trim();
		if (translated.isEmpty()) {
			throw new SegmentTranslationException("Model returned an empty translation");
		}
		final Matcher matcher = GLOSSARY_TOKEN.matcher(text);
		while (matcher.find()) {
			if (!translated.contains(matcher.group())) {
				throw new SegmentTranslationException("Model dropped glossary token " + matcher.group());
			}
		}
		return translated;
	}
}
