package io.evitadb.polyglot.model;

import org.jsoup.nodes.Entities;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Original row content with every extracted segment replaced by its placeholder.
 * Everything else (markup, whitespace, protected terms) is byte-identical to the source.
 *
 * Placeholders are addressed by their recorded position, never by searching the template, so
 * source text that itself looks like a placeholder (`{T1}` protected as a curly token) stays put.
 *
 * @param rowIndex     index of the row in the source document matrix
 * @param template     the template text
 * @param placeholders placeholders in the template, in document order
 */
public record RowTemplate(
	int rowIndex,
	@Nonnull String template,
	@Nonnull List<Placeholder> placeholders
) {

	public RowTemplate {
		Objects.requireNonNull(template, "template must not be null");
		Objects.requireNonNull(placeholders, "placeholders must not be null");
		placeholders = List.copyOf(placeholders);
		int cursor = 0;
		for (final Placeholder placeholder : placeholders) {
			if (placeholder.offset() < cursor || !template.startsWith(placeholder.token(), placeholder.offset())) {
				throw new IllegalArgumentException(
					"Placeholder " + placeholder.token() + " not found at offset " + placeholder.offset() + " of the template"
				);
			}
			cursor = placeholder.offset() + placeholder.token().length();
		}
	}

	/**
	 * Creates a template from text whose placeholders are located left to right, in the order of the
	 * given ids. Values are written into it verbatim.
	 *
	 * @param rowIndex   index of the row in the source document matrix
	 * @param template   the template text
	 * @param segmentIds ids of the placeholders in document order
	 * @return the template
	 * @throws IllegalArgumentException if a placeholder is missing
	 */
	@Nonnull
	public static RowTemplate of(int rowIndex, @Nonnull String template, @Nonnull List<String> segmentIds) {
		Objects.requireNonNull(template, "template must not be null");
		Objects.requireNonNull(segmentIds, "segmentIds must not be null");
		final List<Placeholder> placeholders = new ArrayList<>(segmentIds.size());
		int cursor = 0;
		for (final String id : segmentIds) {
			final String token = IdAllocator.placeholder(id);
			final int offset = template.indexOf(token, cursor);
			if (offset < 0) {
				throw new IllegalArgumentException("Placeholder " + token + " missing from template: " + template);
			}
			placeholders.add(Placeholder.plain(id, offset));
			cursor = offset + token.length();
		}
		return new RowTemplate(rowIndex, template, placeholders);
	}

	/**
	 * Returns the ids of the segments referenced from the template, in document order.
	 *
	 * @return segment ids
	 */
	@Nonnull
	public List<String> segmentIds() {
		final List<String> ids = new ArrayList<>(this.placeholders.size());
		for (final Placeholder placeholder : this.placeholders) {
			ids.add(placeholder.id());
		}
		return ids;
	}

	/**
	 * Returns true if nothing translatable was found in the row.
	 *
	 * @return true when the template references no segment
	 */
	public boolean hasNoSegments() {
		return this.placeholders.isEmpty();
	}

	/**
	 * Replaces every placeholder with the value found in the map. Placeholders without a value
	 * are left untouched.
	 *
	 * @param valuesById replacement text keyed by segment id
	 * @return the filled template
	 */
	@Nonnull
	public String fill(@Nonnull Map<String, String> valuesById) {
		Objects.requireNonNull(valuesById, "valuesById must not be null");
		return fill(valuesById::get);
	}

	/**
	 * Replaces every placeholder with the value produced by the resolver. A `null` value leaves
	 * the placeholder untouched. Inserted values are never scanned again.
	 *
	 * @param resolver function returning the replacement for a segment id
	 * @return the filled template
	 */
	@Nonnull
	public String fill(@Nonnull Function<String, String> resolver) {
		Objects.requireNonNull(resolver, "resolver must not be null");
		final StringBuilder result = new StringBuilder(this.template.length());
		int cursor = 0;
		for (final Placeholder placeholder : this.placeholders) {
			result.append(this.template, cursor, placeholder.offset());
			final String value = resolver.apply(placeholder.id());
			result.append(value == null ? placeholder.token() : placeholder.render(value));
			cursor = placeholder.offset() + placeholder.token().length();
		}
		result.append(this.template, cursor, this.template.length());
		return result.toString();
	}

	/**
	 * One placeholder of the template.
	 *
	 * A placeholder standing for text of a markup leaf remembers the extracted text and the source
	 * slice it was decoded from. Values are escaped for markup, except a value equal to the extracted
	 * text, which is written back in its source encoding.
	 *
	 * @param id           segment id
	 * @param offset       position of the placeholder token in the template
	 * @param sourceText   extracted text, null for plain placeholders
	 * @param sourceMarkup encoded source slice of the extracted text, null for plain placeholders
	 */
	public record Placeholder(
		@Nonnull String id,
		int offset,
		@Nullable String sourceText,
		@Nullable String sourceMarkup
	) {

		public Placeholder {
			Objects.requireNonNull(id, "id must not be null");
			if (offset < 0) {
				throw new IllegalArgumentException("offset must not be negative: " + offset);
			}
			if ((sourceText == null) != (sourceMarkup == null)) {
				throw new IllegalArgumentException("sourceText and sourceMarkup must be given together");
			}
		}

		/**
		 * Creates a placeholder whose values are written verbatim.
		 */
		@Nonnull
		public static Placeholder plain(@Nonnull String id, int offset) {
			return new Placeholder(id, offset, null, null);
		}

		/**
		 * Creates a placeholder standing for decoded text of a markup leaf.
		 */
		@Nonnull
		public static Placeholder markup(@Nonnull String id, int offset, @Nonnull String sourceText, @Nonnull String sourceMarkup) {
			return new Placeholder(
				id, offset,
				Objects.requireNonNull(sourceText, "sourceText must not be null"),
				Objects.requireNonNull(sourceMarkup, "sourceMarkup must not be null")
			);
		}

		/**
		 * Returns the placeholder token, e.g. `{T1}`.
		 */
		@Nonnull
		public String token() {
			return IdAllocator.placeholder(this.id);
		}

		/**
		 * Returns true if values are escaped for markup.
		 */
		public boolean isMarkup() {
			return this.sourceMarkup != null;
		}

		@Nonnull
		String render(@Nonnull String value) {
			if (this.sourceMarkup == null) {
				return value;
			}
			return value.equals(this.sourceText) ? this.sourceMarkup : Entities.escape(value);
		}
	}
}
