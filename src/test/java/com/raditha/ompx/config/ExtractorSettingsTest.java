package com.raditha.ompx.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ExtractorSettingsTest {

    @TempDir
    Path tempDir;

    private File write(String yaml) throws IOException {
        return Files.writeString(tempDir.resolve("ompx.yml"), yaml).toFile();
    }

    @Test
    void testLoadConfig_Defaults() {
        ExtractorConfig config = ExtractorSettings.loadConfig(Map.of(), false, null, null);

        assertEquals(ExtractorConfig.defaults(), config);
        assertTrue(config.codeSnippets());
        assertTrue(config.skipSystemHeaders());
        assertTrue(config.getOutputDirectory().isEmpty());
    }

    @Test
    void testLoadConfig_FromYaml() throws IOException {
        File file = write("""
                ompx:
                  code_snippets: false
                  source_root: src
                  output: build/ompx
                  skip_system_headers: false
                """);

        ExtractorConfig config = ExtractorSettings.loadConfig(ExtractorSettings.loadConfigMap(file), false, null, null);

        assertFalse(config.codeSnippets());
        assertEquals(Path.of("src"), config.sourceRoot());
        assertEquals(Path.of("build/ompx"), config.outputDirectory());
        assertFalse(config.skipSystemHeaders());
    }

    @Test
    void testLoadConfig_CliOverridesYaml() throws IOException {
        File file = write("""
                ompx:
                  code_snippets: true
                  source_root: src
                  output: build/ompx
                """);

        ExtractorConfig config = ExtractorSettings.loadConfig(
                ExtractorSettings.loadConfigMap(file), true, "other", "reports");

        assertFalse(config.codeSnippets());
        assertEquals(Path.of("other"), config.sourceRoot());
        assertEquals(Path.of("reports"), config.outputDirectory());
        assertTrue(config.skipSystemHeaders());
    }

    @Test
    void testLoadConfig_OtherSectionsIgnored() throws IOException {
        File file = write("""
                linter:
                  threshold: 80
                """);

        assertEquals(ExtractorConfig.defaults(),
                ExtractorSettings.loadConfig(ExtractorSettings.loadConfigMap(file), false, null, null));
    }

    @Test
    void testLoadConfig_SectionMustBeMapping() throws IOException {
        File file = write("ompx: yes please\n");
        Map<String, Object> document = ExtractorSettings.loadConfigMap(file);

        assertThrows(IllegalArgumentException.class,
                () -> ExtractorSettings.loadConfig(document, false, null, null));
    }

    @Test
    void testLoadConfig_FlagMustBeBoolean() throws IOException {
        File file = write("""
                ompx:
                  code_snippets: sometimes
                """);
        Map<String, Object> document = ExtractorSettings.loadConfigMap(file);

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> ExtractorSettings.loadConfig(document, false, null, null));
        assertTrue(e.getMessage().contains("code_snippets"));
    }

    @Test
    void testLoadConfigMap_EmptyFile() throws IOException {
        assertTrue(ExtractorSettings.loadConfigMap(write("")).isEmpty());
    }

    @Test
    void testLoadConfigMap_InvalidYaml() throws IOException {
        File file = write("ompx: [unclosed\n");

        assertThrows(IllegalArgumentException.class, () -> ExtractorSettings.loadConfigMap(file));
    }

    @Test
    void testConfig_BlankOutputRejected() {
        ExtractorConfig defaults = ExtractorConfig.defaults();

        assertThrows(IllegalArgumentException.class, () -> defaults.withOutputDirectory(Path.of("")));
        assertEquals(ExtractorConfig.DEFAULT_SOURCE_ROOT,
                new ExtractorConfig(true, null, null, true).sourceRoot());
    }
}
