package com.raditha.ompx.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

/**
 * Loads extractor configuration from a YAML file with CLI overrides.
 * <p>
 * Configuration priority: CLI arguments > ompx.yml > defaults
 * <p>
 * The file holds an {@code ompx} section:
 * <pre>
 * ompx:
 *   code_snippets: true
 *   source_root: src
 *   output: build/ompx
 *   skip_system_headers: true
 * </pre>
 */
public class ExtractorSettings {

    public static final String DEFAULT_CONFIG_FILE = "ompx.yml";

    private static final String CONFIG_KEY = "ompx";
    private static final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    private ExtractorSettings() {
        /* this is only a utility class */
    }

    /**
     * Read the default configuration file from the working directory.
     *
     * @return the parsed document, empty when the file does not exist
     */
    public static Map<String, Object> loadConfigMap() throws IOException {
        File file = new File(DEFAULT_CONFIG_FILE);
        if (!file.exists()) {
            return Map.of();
        }
        return loadConfigMap(file);
    }

    /**
     * Read a YAML configuration file.
     *
     * @throws IllegalArgumentException if the file is not valid YAML
     * @throws IOException              if the file cannot be read
     */
    public static Map<String, Object> loadConfigMap(File file) throws IOException {
        if (file.length() == 0) {
            return Map.of();
        }
        try {
            Map<String, Object> document = yamlMapper.readValue(file, new TypeReference<Map<String, Object>>() {
            });
            return document == null ? Map.of() : document;
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid configuration file " + file + ": " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Build the configuration, applying CLI overrides where provided.
     *
     * @param document         parsed configuration file, possibly empty
     * @param noSnippetsCLI    {@code --no-code-snippets} was given
     * @param sourceRootCLI    CLI source root ({@code null} = use YAML/default)
     * @param outputCLI        CLI output directory ({@code null} = use YAML/default)
     * @return complete configuration
     */
    public static ExtractorConfig loadConfig(Map<String, Object> document, boolean noSnippetsCLI,
                                             String sourceRootCLI, String outputCLI) {
        Object section = document.get(CONFIG_KEY);
        if (section != null && !(section instanceof Map)) {
            throw new IllegalArgumentException("'" + CONFIG_KEY + "' must be a mapping");
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> config = section == null ? Map.of() : (Map<String, Object>) section;
        ExtractorConfig defaults = ExtractorConfig.defaults();

        boolean snippets = !noSnippetsCLI && getBoolean(config, "code_snippets", defaults.codeSnippets());
        String sourceRoot = sourceRootCLI != null ? sourceRootCLI : getString(config, "source_root", null);
        String output = outputCLI != null ? outputCLI : getString(config, "output", null);
        boolean skipSystemHeaders = getBoolean(config, "skip_system_headers", defaults.skipSystemHeaders());

        return new ExtractorConfig(
                snippets,
                sourceRoot != null ? Path.of(sourceRoot) : defaults.sourceRoot(),
                output != null ? Path.of(output) : null,
                skipSystemHeaders);
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        throw new IllegalArgumentException("'" + key + "' must be true or false, got: " + value);
    }

    private static String getString(Map<String, Object> map, String key, String defaultValue) {
        Object value = map.get(key);
        if (value != null) {
            return value.toString();
        }
        return defaultValue;
    }
}
