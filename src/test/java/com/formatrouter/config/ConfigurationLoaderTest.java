package com.formatrouter.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ConfigurationLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("The bundled defaults are complete and cached")
    void testDefaults() {
        FormatterConfig config = ConfigurationLoader.loadDefaultConfig();

        assertSame(config, ConfigurationLoader.loadDefaultConfig());
        assertEquals(80, (int) config.get("maxColumn", 0));
        assertEquals("latest", config.get("edition", ""));
        assertEquals(2, (int) config.get("continuationIndent.callSite", 0));
        assertTrue(config.get("align.ifWhileOpenParen", false));
        assertTrue(config.getSectionConfigsMap().containsKey("editions"));
    }

    @Test
    @DisplayName("A missing file falls back to the defaults")
    void testMissingFile() {
        FormatterConfig config = ConfigurationLoader.loadConfig(tempDir.resolve("absent.yml"));

        assertSame(ConfigurationLoader.loadDefaultConfig(), config);
        assertSame(ConfigurationLoader.loadDefaultConfig(), ConfigurationLoader.loadConfig(null));
    }

    @Test
    @DisplayName("A malformed file falls back to the defaults")
    void testMalformedFile() throws IOException {
        Path file = tempDir.resolve("broken.yml");
        Files.writeString(file, "general: [unclosed\n  maxColumn: : :\n");

        assertSame(ConfigurationLoader.loadDefaultConfig(), ConfigurationLoader.loadConfig(file));
    }

    @Test
    @DisplayName("Options missing from a file get their default values")
    void testPartialFile() throws IOException {
        Path file = tempDir.resolve("style.yml");
        Files.writeString(file, "general:\n  maxColumn: 120\nsections:\n  binPack:\n    callSite: true\n");

        FormatterConfig config = ConfigurationLoader.loadConfig(file);

        assertEquals(120, (int) config.get("maxColumn", 0));
        assertTrue(config.get("binPack.callSite", false));
        assertFalse(config.get("binPack.defnSite", true));
        assertEquals(4, (int) config.get("continuationIndent.defnSite", 0));
        assertEquals("noBinPack", config.get("importSelectors", ""));
    }

    @Test
    @DisplayName("Out-of-range values are dropped in favor of the defaults")
    void testRangeValidation() {
        FormatterConfig config = ConfigurationLoader.parseConfig(
                "general:\n  maxColumn: 5\n  forceConfigStyleMinArgCount: 0\n"
                        + "sections:\n  continuationIndent:\n    callSite: 40\n    defnSite: 6\n");
        FormatStyle style = FormatStyle.fromConfig(config);

        assertEquals(80, style.getMaxColumn());
        assertEquals(2, style.getContinuationIndentCallSite());
        assertEquals(6, style.getContinuationIndentDefnSite());
        assertEquals(2, style.getForceConfigStyleMinArgCount());
    }

    @Test
    @DisplayName("An unknown import selector layout is replaced")
    void testImportSelectors() {
        FormatterConfig config = ConfigurationLoader.parseConfig("general:\n  importSelectors: diagonal\n");

        assertEquals("noBinPack", config.get("importSelectors", ""));
        assertEquals(ImportSelectors.BIN_PACK,
                FormatStyle.fromConfig(ConfigurationLoader.parseConfig("general:\n  importSelectors: BINPACK\n"))
                        .getImportSelectors());
    }

    @Test
    @DisplayName("Edition overrides keep their string keys")
    void testEditionKeys() {
        FormatterConfig config = ConfigurationLoader.parseConfig(
                "general:\n  edition: \"2019-11\"\nsections:\n  editions:\n    \"2020-03\": true\n");

        assertEquals("2019-11", config.get("edition", ""));
        assertEquals(Boolean.TRUE, config.getSectionConfig("editions", "2020-03", (Object) null));
    }

    @Test
    @DisplayName("An empty document is the default style")
    void testEmptyDocument() {
        FormatterConfig config = ConfigurationLoader.parseConfig("");

        assertEquals(80, (int) config.get("maxColumn", 0));
        assertEquals("^(&&|\\|\\|)$", config.get("indentOperator.exclude", ""));
    }

    @Test
    @DisplayName("A saved configuration loads back")
    void testSaveAndLoad() throws IOException {
        FormatterConfig config = ConfigurationLoader.loadDefaultConfig()
                .with("maxColumn", 100)
                .with("newlines.afterCurlyLambda", "always");
        Path file = tempDir.resolve("nested/dir/style.yml");

        ConfigurationLoader.saveConfig(config, file);
        FormatterConfig loaded = ConfigurationLoader.loadConfig(file);

        assertTrue(Files.exists(file));
        assertEquals(100, (int) loaded.get("maxColumn", 0));
        assertEquals("always", loaded.get("newlines.afterCurlyLambda", ""));
        assertEquals(config.getSectionConfigsMap().keySet(), loaded.getSectionConfigsMap().keySet());
    }

    @Test
    @DisplayName("Replacing an option leaves the original untouched")
    void testWith() {
        FormatterConfig base = ConfigurationLoader.loadDefaultConfig();
        FormatterConfig changed = base.with("spaces.inParentheses", true);

        assertTrue(changed.get("spaces.inParentheses", false));
        assertFalse(base.get("spaces.inParentheses", true));
        assertEquals(7, (int) base.with("extra.option", 7).get("extra.option", 0));
    }
}
