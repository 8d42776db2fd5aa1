package io.evitadb.polyglot;

import io.evitadb.polyglot.dedup.DeduplicationStats;
import io.evitadb.polyglot.dedup.Deduplicator;
import io.evitadb.polyglot.mask.DoNotTranslateMasker;
import io.evitadb.polyglot.mask.DoNotTranslateSuggester;
import io.evitadb.polyglot.mask.WordSuggestion;
import io.evitadb.polyglot.memory.FuzzyMatcher;
import io.evitadb.polyglot.model.ExtractedSegment;
import io.evitadb.polyglot.model.LanguagePolicies;
import io.evitadb.polyglot.model.RowTemplate;
import io.evitadb.polyglot.model.SegmentationResult;
import io.evitadb.polyglot.model.SourceRow;
import io.evitadb.polyglot.segment.MarkupSegmenter;
import org.apache.maven.plugin.AbstractMojo;
import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugin.logging.Log;
import org.apache.maven.plugins.annotations.LifecyclePhase;
import org.apache.maven.plugins.annotations.Mojo;
import org.apache.maven.plugins.annotations.Parameter;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mojo of the Polyglot plugin providing actions:
 * - show-config: prints the resolved configuration
 * - preview: segments the configured content and prints segments, template and suggestions
 */
@Mojo(name = "run", defaultPhase = LifecyclePhase.NONE, threadSafe = true)
public class PolyglotMojo extends AbstractMojo {

	private static final int PREVIEW_SUGGESTIONS = 10;

	/** Which action to perform: "show-config" or "preview". */
	@Parameter(property = "polyglot.action", defaultValue = "show-config")
	private String action;

	/** Legacy global overwrite mode: "keep-all", "overwrite-empty" or "overwrite-all" (no default). */
	@Parameter(property = "polyglot.overwriteMode")
	private String overwriteMode;

	/** Source language of the content. */
	@Parameter(property = "polyglot.sourceLanguage", defaultValue = "en-GB")
	private String sourceLanguage = "en-GB";

	/** Collection of target languages (no default). */
	@Parameter(property = "polyglot.targets")
	private List<Target> targets;

	/** Terms that must never be translated. */
	@Parameter(property = "polyglot.doNotTranslate")
	private List<String> doNotTranslate;

	/** Minimal score of a reported translation memory match (default 70). */
	@Parameter(property = "polyglot.fuzzyThreshold", defaultValue = "70")
	private int fuzzyThreshold = FuzzyMatcher.DEFAULT_FUZZY_THRESHOLD;

	/** Score from which a translation memory match is applied without review (default 95). */
	@Parameter(property = "polyglot.autoApplyThreshold", defaultValue = "95")
	private int autoApplyThreshold = FuzzyMatcher.DEFAULT_AUTO_APPLY_THRESHOLD;

	/** Content segmented by the preview action; one row per line. */
	@Parameter(property = "polyglot.content")
	private String content;

	@Override
	public void execute() throws MojoExecutionException {
		if (this.action == null || this.action.isBlank()) {
			this.action = "show-config";
		}
		switch (this.action) {
			case "show-config" -> showConfig(getLog());
			case "preview" -> preview(getLog());
			default -> throw new MojoExecutionException(
				"Unknown action: " + this.action + ". Supported actions: show-config, preview"
			);
		}
	}

	private void showConfig(@Nonnull final Log log) throws MojoExecutionException {
		final LanguagePolicies policies = resolvePolicies();
		log.info("Polyglot Plugin Configuration:");
		log.info(" - sourceLanguage: " + this.sourceLanguage);
		log.info(" - overwriteMode: " + (isBlank(this.overwriteMode) ? "<not set>" : this.overwriteMode));
		if (this.targets == null || this.targets.isEmpty()) {
			log.info(" - targets: <none>");
			log.warn("No target languages configured");
		} else {
			log.info(" - targets:");
			for (final Target t : this.targets) {
				final String locale = t == null ? null : t.getLocale();
				if (isBlank(locale)) {
					log.warn("Target locale is not set");
					continue;
				}
				log.info("   - locale: " + locale + ", overwritePolicy: " + policies.policyFor(locale));
			}
		}
		log.info(" - default overwritePolicy: " + policies.fallback());
		final List<String> terms = doNotTranslateTerms();
		log.info(" - doNotTranslate: " + (terms.isEmpty() ? "<none>" : String.join(", ", terms)));
		log.info(" - fuzzyThreshold: " + this.fuzzyThreshold);
		log.info(" - autoApplyThreshold: " + this.autoApplyThreshold);
		if (this.autoApplyThreshold < this.fuzzyThreshold) {
			log.warn("autoApplyThreshold is lower than fuzzyThreshold, every reported match will be applied");
		}
	}

	private void preview(@Nonnull final Log log) throws MojoExecutionException {
		resolvePolicies();
		if (isBlank(this.content)) {
			log.error("Content must be specified for preview action");
			return;
		}

		final List<SourceRow> rows = new ArrayList<>();
		final String[] lines = this.content.split("\\R", -1);
		for (int i = 0; i < lines.length; i++) {
			rows.add(new SourceRow(i, lines[i]));
		}
		final List<String> terms = doNotTranslateTerms();
		final SegmentationResult result = new MarkupSegmenter(log).segment(rows, terms);

		log.info("Segments:");
		for (final ExtractedSegment segment : result.segments()) {
			log.info(" - " + segment.id() + " (row " + segment.rowIndex() + "): " + segment.text());
		}
		final Map<String, String> originals = result.textById();
		log.info("Templates:");
		for (final RowTemplate template : result.templates()) {
			log.info(" - row " + template.rowIndex() + ": " + template.template());
			final String rebuilt = DoNotTranslateMasker.unmask(template.fill(originals));
			if (!rebuilt.equals(rows.get(template.rowIndex()).content())) {
				log.warn("Row " + template.rowIndex() + " does not rebuild to its original content");
			}
		}

		final DeduplicationStats stats = Deduplicator.index(result).stats();
		log.info(
			"Strings: " + stats.totalStrings() + " total, " + stats.uniqueStrings() + " unique, " +
				stats.deduplicationPercentage() + "% duplicates, " + stats.characterSavings() + " characters saved"
		);

		final List<WordSuggestion> suggestions = DoNotTranslateSuggester.suggest(
			new ArrayList<>(originals.values()), terms
		);
		if (!suggestions.isEmpty()) {
			log.info("Do-not-translate candidates:");
			for (final WordSuggestion suggestion : suggestions.subList(0, Math.min(PREVIEW_SUGGESTIONS, suggestions.size()))) {
				log.info(" - " + suggestion.word() + " (" + suggestion.frequency() + "x" +
					(suggestion.likelyProperNoun() ? ", proper noun" : "") + ")");
			}
		}
	}

	@Nonnull
	private LanguagePolicies resolvePolicies() throws MojoExecutionException {
		try {
			FuzzyMatcher.checkThreshold(this.fuzzyThreshold, "fuzzyThreshold");
			FuzzyMatcher.checkThreshold(this.autoApplyThreshold, "autoApplyThreshold");
			final Map<String, String> perLanguage = new LinkedHashMap<>();
			final List<String> languages = new ArrayList<>();
			if (this.targets != null) {
				for (final Target t : this.targets) {
					if (t == null || isBlank(t.getLocale())) {
						continue;
					}
					languages.add(t.getLocale());
					if (!isBlank(t.getOverwritePolicy())) {
						perLanguage.put(t.getLocale(), t.getOverwritePolicy());
					}
				}
			}
			return LanguagePolicies.resolve(this.overwriteMode, perLanguage, languages);
		} catch (IllegalArgumentException e) {
			throw new MojoExecutionException("Invalid configuration: " + e.getMessage(), e);
		}
	}

	@Nonnull
	private List<String> doNotTranslateTerms() {
		return this.doNotTranslate == null ? List.of() : DoNotTranslateMasker.deduplicate(this.doNotTranslate);
	}

	private static boolean isBlank(@Nullable final String value) {
		return value == null || value.isBlank();
	}

	// Setters to aid testing without Maven parameter injection
	void setAction(@Nullable final String action) { this.action = action; }
	void setOverwriteMode(@Nullable final String overwriteMode) { this.overwriteMode = overwriteMode; }
	void setSourceLanguage(@Nonnull final String sourceLanguage) { this.sourceLanguage = sourceLanguage; }
	void setTargets(@Nullable final List<Target> targets) { this.targets = targets; }
	void setDoNotTranslate(@Nullable final List<String> doNotTranslate) { this.doNotTranslate = doNotTranslate; }
	void setFuzzyThreshold(final int fuzzyThreshold) { this.fuzzyThreshold = fuzzyThreshold; }
	void setAutoApplyThreshold(final int autoApplyThreshold) { this.autoApplyThreshold = autoApplyThreshold; }
	void setContent(@Nullable final String content) { this.content = content; }

	/** Target language configuration. */
	public static class Target {
		@Parameter
		private String locale;
		@Parameter
		private String overwritePolicy;

		public Target() {}

		public Target(@Nullable final String locale, @Nullable final String overwritePolicy) {
			this.locale = locale;
			this.overwritePolicy = overwritePolicy;
		}

		@Nullable
		public String getLocale() { return this.locale; }
		@Nullable
		public String getOverwritePolicy() { return this.overwritePolicy; }

		public void setLocale(@Nullable final String locale) { this.locale = locale; }
		public void setOverwritePolicy(@Nullable final String overwritePolicy) { this.overwritePolicy = overwritePolicy; }
	}
}
