package io.evitadb.polyglot;

import org.apache.maven.plugin.MojoExecutionException;
import org.apache.maven.plugin.logging.Log;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class PolyglotMojoTest {

    private PolyglotMojo mojo;
    private StringBuilder out;

    @BeforeEach
    public void setUp() {
        mojo = new PolyglotMojo();
        out = new StringBuilder();
        // Prepare capturing log
        Log capturingLog = new Log() {
            @Override public boolean isDebugEnabled() { return true; }
            @Override public void debug(CharSequence content) { out.append(content).append('\n'); }
            @Override public void debug(CharSequence content, Throwable error) { out.append(content).append('\n'); }
            @Override public void debug(Throwable error) { out.append(String.valueOf(error)).append('\n'); }
            @Override public boolean isInfoEnabled() { return true; }
            @Override public void info(CharSequence content) { out.append(content).append('\n'); }
            @Override public void info(CharSequence content, Throwable error) { out.append(content).append('\n'); }
            @Override public void info(Throwable error) { out.append(String.valueOf(error)).append('\n'); }
            @Override public boolean isWarnEnabled() { return true; }
            @Override public void warn(CharSequence content) { out.append(content).append('\n'); }
            @Override public void warn(CharSequence content, Throwable error) { out.append(content).append('\n'); }
            @Override public void warn(Throwable error) { out.append(String.valueOf(error)).append('\n'); }
            @Override public boolean isErrorEnabled() { return true; }
            @Override public void error(CharSequence content) { out.append(content).append('\n'); }
            @Override public void error(CharSequence content, Throwable error) { out.append(content).append('\n'); }
            @Override public void error(Throwable error) { out.append(String.valueOf(error)).append('\n'); }
        };
        mojo.setLog(capturingLog);
    }

    @Test
    public void testShowConfigDisplaysDefaultsAndWarnsForMissingTargets() throws MojoExecutionException {
        mojo.setAction("show-config");
        // leave other properties unset to trigger defaults and warnings

        mojo.execute();

        String log = out.toString();
        assertTrue(log.contains("Polyglot Plugin Configuration:"), "Should contain header");
        assertTrue(log.contains(" - sourceLanguage: en-GB"), "Should show default source language");
        assertTrue(log.contains(" - overwriteMode: <not set>"), "Should show unset legacy mode");
        assertTrue(log.contains(" - default overwritePolicy: fill-empty"), "Should default to fill-empty");
        assertTrue(log.contains(" - fuzzyThreshold: 70"), "Should show default fuzzy threshold");
        assertTrue(log.contains(" - autoApplyThreshold: 95"), "Should show default auto-apply threshold");
        assertTrue(log.contains("No target languages configured"), "Should warn about missing targets");
    }

    @Test
    public void testShowConfigResolvesPoliciesPerTarget() throws MojoExecutionException {
        mojo.setAction("show-config");
        mojo.setOverwriteMode("keep-all");
        mojo.setTargets(List.of(
            new PolyglotMojo.Target("fr-FR", null),
            new PolyglotMojo.Target("de-DE", "overwrite-all")
        ));
        mojo.setDoNotTranslate(List.of("Acme", "ACME", "evitaDB"));

        mojo.execute();

        String log = out.toString();
        assertTrue(log.contains("   - locale: fr-FR, overwritePolicy: keep"), "Legacy mode should apply to fr-FR");
        assertTrue(log.contains("   - locale: de-DE, overwritePolicy: overwrite-all"), "Per-language policy should win");
        assertTrue(log.contains(" - doNotTranslate: Acme, evitaDB"), "Terms should be deduplicated");
    }

    @Test
    public void testInvalidPolicyFailsTheBuild() {
        mojo.setAction("show-config");
        mojo.setTargets(List.of(new PolyglotMojo.Target("fr-FR", "sometimes")));

        MojoExecutionException ex = assertThrows(MojoExecutionException.class, () -> mojo.execute());
        assertTrue(ex.getMessage().startsWith("Invalid configuration:"));
    }

    @Test
    public void testInvalidThresholdFailsTheBuild() {
        mojo.setAction("show-config");
        mojo.setFuzzyThreshold(120);

        assertThrows(MojoExecutionException.class, () -> mojo.execute());
    }

    @Test
    public void testUnknownActionFails() {
        mojo.setAction("translate-everything");

        MojoExecutionException ex = assertThrows(MojoExecutionException.class, () -> mojo.execute());
        assertTrue(ex.getMessage().contains("Supported actions: show-config, preview"));
    }

    @Test
    public void testPreviewPrintsSegmentsAndTemplates() throws MojoExecutionException {
        mojo.setAction("preview");
        mojo.setDoNotTranslate(List.of("Acme"));
        mojo.setContent("<p>Hello <b>Acme</b> world</p>\nVisit Acme\n<p>Hello</p>");

        mojo.execute();

        String log = out.toString();
        assertTrue(log.contains(" - T1 (row 0): Hello"), "Should list first segment");
        assertTrue(log.contains(" - T3 (row 1): Visit"), "Should list plain text segment");
        assertTrue(log.contains(" - row 0: <p>{T1} <b>Acme</b> {T2}</p>"), "Should show template with protected term");
        assertTrue(log.contains(" - row 1: {T3} Acme"), "Should keep term outside the placeholder");
        assertTrue(log.contains("Strings: 4 total, 3 unique, 25% duplicates, 5 characters saved"), "Should show savings");
        assertFalse(log.contains("does not rebuild"), "Every row should rebuild");
    }

    @Test
    public void testPreviewRequiresContent() throws MojoExecutionException {
        mojo.setAction("preview");

        mojo.execute();

        assertTrue(out.toString().contains("Content must be specified for preview action"));
    }
}
