package io.evitadb.polyglot.llm;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Loads prompt templates from the classpath directory `META-INF/prompts/` and fills in their
 * `{{name}}` placeholders. Loaded templates are cached; line endings are normalized to `\n` and
 * a trailing line break is dropped.
 */
public final class PromptLoader {

	/**
	 * Classpath directory holding the templates.
	 */
	public static final String PROMPTS_PATH = "META-INF/prompts/";

	private static final Pattern PLACEHOLDER_PATTERN = Pattern.compile("\\{\\{(\\w+)}}");

	private final Map<String, String> cache = new ConcurrentHashMap<>();

	/**
	 * Returns the template.
	 *
	 * @param templateName file name inside {@link #PROMPTS_PATH}
	 * @return template text
	 * @throws IllegalArgumentException if the template does not exist or cannot be read
	 */
	@Nonnull
	public String load(@Nonnull String templateName) {
		Objects.requireNonNull(templateName, "templateName must not be null");
		return this.cache.computeIfAbsent(templateName, PromptLoader::read);
	}

	/**
	 * Returns the template with placeholders replaced.
	 *
	 * @param templateName file name inside {@link #PROMPTS_PATH}
	 * @param values       placeholder values keyed by name (without braces)
	 * @return rendered prompt
	 * @throws IllegalArgumentException if the template does not exist or cannot be read
	 */
	@Nonnull
	public String render(@Nonnull String templateName, @Nonnull Map<String, String> values) {
		return interpolate(load(templateName), values);
	}

	/**
	 * Replaces `{{name}}` placeholders. A placeholder without a value stays in the text.
	 *
	 * @param template text with placeholders
	 * @param values   placeholder values keyed by name
	 * @return interpolated text
	 */
	@Nonnull
	public static String interpolate(@Nonnull String template, @Nonnull Map<String, String> values) {
		Objects.requireNonNull(template, "template must not be null");
		Objects.requireNonNull(values, "values must not be null");
		final Matcher matcher = PLACEHOLDER_PATTERN.matcher(template);
		final StringBuilder result = new StringBuilder(template.length());
		while (matcher.find()) {
			final String value = values.get(matcher.group(1));
			matcher.appendReplacement(result, Matcher.quoteReplacement(value == null ? matcher.group() : value));
		}
		matcher.appendTail(result);
		return result.toString();
	}

	/**
	 * Drops all cached templates.
	 */
	public void clearCache() {
		this.cache.clear();
	}

	@Nonnull
	private static String read(@Nonnull String templateName) {
		final String resourcePath = PROMPTS_PATH + templateName;
		try (final InputStream stream = PromptLoader.class.getClassLoader().getResourceAsStream(resourcePath)) {
			if (stream == null) {
				throw new IllegalArgumentException("Prompt template not found: " + resourcePath);
			}
			final String content = new String(stream.readAllBytes(), StandardCharsets.UTF_8).replace("\r\n", "\n");
			return content.endsWith("\n") ? content.substring(0, content.length() - 1) : content;
		} catch (IOException e) {
			throw new IllegalArgumentException("Failed to read prompt template: " + resourcePath, e);
		}
	}
}
