package io.evitadb.polyglot.merge;

import io.evitadb.polyglot.glossary.SegmentTranslation;
import io.evitadb.polyglot.mask.DoNotTranslateMasker;
import io.evitadb.polyglot.model.RowTemplate;
import io.evitadb.polyglot.model.TargetLanguage;
import org.apache.maven.plugin.logging.Log;
import org.apache.maven.plugin.logging.SystemStreamLog;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Merges per-language translations back into a multi-column document.
 *
 * For each target language the engine writes into the existing language column or appends a new
 * one after the widest row (headed by the language code) and decides for every data row with
 * {@link CopyDecisionTable}:
 *
 * - a row without segments may receive a verbatim copy of its source content,
 * - a row with segments receives its template with every placeholder replaced by the translation,
 *   unless the overwrite policy protects the current cell content.
 *
 * A segment id without a translation is replaced by an empty string and reported as an integrity
 * warning. Internal Do-Not-Translate envelopes that survived translation are stripped back to the
 * literal term before the value is written. A language whose translation table is missing or empty
 * is skipped entirely, so a translation run that produced nothing cannot blank out a column.
 *
 * The input matrix is never modified; the result is built on a copy. The engine keeps no state
 * between calls, so identical requests produce identical results.
 */
public final class TemplateRebuilder {

	@Nonnull
	private final Log log;

	/**
	 * Creates a rebuilder logging to standard output.
	 */
	public TemplateRebuilder() {
		this(new SystemStreamLog());
	}

	/**
	 * Creates a rebuilder.
	 *
	 * @param log Maven log for warnings and per-row decisions
	 */
	public TemplateRebuilder(@Nonnull Log log) {
		this.log = Objects.requireNonNull(log, "log must not be null");
	}

	/**
	 * Merges the translations.
	 *
	 * @param request merge input
	 * @return merged matrix and audit
	 */
	@Nonnull
	public MergeResult rebuild(@Nonnull MergeRequest request) {
		Objects.requireNonNull(request, "request must not be null");

		final List<List<String>> matrix = copy(request.matrix());
		final List<AuditEntry> entries = new ArrayList<>();
		final List<IntegrityWarning> warnings = new ArrayList<>();
		final List<String> skippedLanguages = new ArrayList<>();

		for (final TargetLanguage target : request.targets()) {
			final Map<String, String> translations = request.translations().get(target.code());
			if (translations == null || translations.isEmpty()) {
				this.log.warn("No translations supplied for " + target.code() + ", language left untouched.");
				skippedLanguages.add(target.code());
				continue;
			}

			final int column;
			if (target.isExisting()) {
				column = target.existingColumn();
			} else {
				column = width(matrix);
				set(matrix.get(0), column, target.code());
			}

			for (int row = 1; row < matrix.size(); row++) {
				final RowTemplate template = request.templatesByRow().get(row);
				final List<String> cells = matrix.get(row);
				final String current = get(cells, column);
				if (template == null || template.hasNoSegments()) {
					final String source = get(request.matrix().get(row), request.sourceColumn());
					final MergeDecision decision = CopyDecisionTable.decideUntranslatable(
						request.verbatimRows().contains(row),
						target.isExisting(),
						target.policy(),
						TranslationFormulas.isBlankOrFormula(current),
						source != null && !source.isBlank()
					);
					if (decision.writes()) {
						set(cells, column, source);
					}
					entries.add(audit(row, target, decision, decision.writes() ? source : null));
				} else {
					final MergeDecision decision = CopyDecisionTable.decideTranslated(target.policy(), current);
					String value = null;
					if (decision.writes()) {
						value = fill(template, row, target.code(), translations, warnings);
						set(cells, column, value);
					}
					entries.add(audit(row, target, decision, value));
				}
			}
		}

		final List<List<String>> result = new ArrayList<>(matrix.size());
		for (final List<String> cells : matrix) {
			result.add(Collections.unmodifiableList(cells));
		}
		return new MergeResult(
			Collections.unmodifiableList(result),
			new MergeAudit(entries, warnings, skippedLanguages)
		);
	}

	@Nonnull
	private String fill(
		@Nonnull RowTemplate template,
		int row,
		@Nonnull String language,
		@Nonnull Map<String, String> translations,
		@Nonnull List<IntegrityWarning> warnings
	) {
		final Map<String, String> values = new HashMap<>();
		for (final String id : template.segmentIds()) {
			final String translation = translations.get(id);
			if (translation == null) {
				this.log.warn("Row " + row + " (" + language + "): no translation for segment " + id + ", leaving it empty.");
				warnings.add(new IntegrityWarning(row, language, id, IntegrityWarning.Kind.MISSING_TRANSLATION));
				values.put(id, "");
			} else {
				if (SegmentTranslation.isFailureSentinel(translation)) {
					this.log.warn("Row " + row + " (" + language + "): segment " + id + " failed to translate.");
					warnings.add(new IntegrityWarning(row, language, id, IntegrityWarning.Kind.FAILED_TRANSLATION));
				}
				values.put(id, DoNotTranslateMasker.unmask(translation));
			}
		}
		return template.fill(values);
	}

	@Nonnull
	private AuditEntry audit(
		int row,
		@Nonnull TargetLanguage target,
		@Nonnull MergeDecision decision,
		@Nullable String written
	) {
		if (this.log.isDebugEnabled()) {
			this.log.debug("Row " + row + " (" + target.code() + "): " + decision.action() + ", " + decision.reason());
		}
		return new AuditEntry(row, target.code(), decision.action(), decision.reason(), written == null ? "" : written);
	}

	@Nonnull
	private static List<List<String>> copy(@Nonnull List<List<String>> matrix) {
		final List<List<String>> copy = new ArrayList<>(matrix.size());
		for (final List<String> row : matrix) {
			copy.add(row == null ? new ArrayList<>() : new ArrayList<>(row));
		}
		return copy;
	}

	/**
	 * Returns the number of columns of the widest row, the first free column for every row.
	 */
	private static int width(@Nonnull List<List<String>> matrix) {
		int width = 0;
		for (final List<String> cells : matrix) {
			width = Math.max(width, cells.size());
		}
		return width;
	}

	@Nullable
	private static String get(@Nullable List<String> cells, int column) {
		return cells == null || column >= cells.size() ? null : cells.get(column);
	}

	private static void set(@Nonnull List<String> cells, int column, @Nullable String value) {
		while (cells.size() <= column) {
			cells.add("");
		}
		cells.set(column, value);
	}
}
