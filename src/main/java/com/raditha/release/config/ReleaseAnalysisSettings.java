package com.raditha.release.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

/**
 * Loads release analysis configuration from a YAML file (closer.yml) with
 * CLI overrides.
 *
 * Configuration priority: CLI arguments > closer.yml > defaults
 */
public class ReleaseAnalysisSettings {
    private static final Logger logger = LoggerFactory.getLogger(ReleaseAnalysisSettings.class);

    static final String CONFIG_KEY = "release_analysis";
    public static final String DEFAULT_CONFIG_FILE = "closer.yml";

    private static final ObjectMapper YAML = new ObjectMapper(new YAMLFactory());

    private ReleaseAnalysisSettings() {
        /* only static helpers */
    }

    /**
     * Load configuration, applying CLI overrides where provided.
     *
     * @param configFile  YAML file to read; closer.yml in the working directory is tried when null
     * @param maxDepthCLI CLI maximum path depth (0 = use YAML/default)
     * @param presetCLI   CLI preset name (null = use YAML/default)
     * @return Complete release analysis configuration
     * @throws IOException if the file exists but cannot be read or parsed
     */
    public static ReleaseAnalysisConfig loadConfig(@Nullable Path configFile, int maxDepthCLI,
                                                   @Nullable String presetCLI) throws IOException {
        Path file = configFile;
        if (file == null) {
            Path fallback = Path.of(DEFAULT_CONFIG_FILE);
            file = Files.isRegularFile(fallback) ? fallback : null;
        } else if (!Files.isRegularFile(file)) {
            throw new IOException("Configuration file not found: " + file);
        }
        Map<String, Object> section = file == null ? Map.of() : readSection(file);
        return fromMap(section, maxDepthCLI, presetCLI);
    }

    /**
     * The {@code release_analysis} section of a YAML file, or an empty map.
     */
    static Map<String, Object> readSection(Path file) throws IOException {
        logger.debug("Reading configuration from {}", file);
        String content = Files.readString(file);
        if (content.isBlank()) {
            return Map.of();
        }
        Map<String, Object> root = YAML.readValue(content, new TypeReference<Map<String, Object>>() {
        });
        if (root == null) {
            return Map.of();
        }
        Object section = root.get(CONFIG_KEY);
        if (!(section instanceof Map)) {
            return Map.of();
        }
        @SuppressWarnings("unchecked")
        Map<String, Object> config = (Map<String, Object>) section;
        return config;
    }

    /**
     * Build a configuration from an already parsed section.
     */
    public static ReleaseAnalysisConfig fromMap(Map<String, Object> config, int maxDepthCLI,
                                                @Nullable String presetCLI) {
        // Determine preset (CLI > YAML)
        String preset = presetCLI != null ? presetCLI : getString(config, "preset", null);
        ReleaseAnalysisConfig base = preset == null ? ReleaseAnalysisConfig.defaults() : forPreset(preset);

        int maxDepth = maxDepthCLI != 0 ? maxDepthCLI : getInt(config, "max_path_depth", base.maxPathDepth());

        return new ReleaseAnalysisConfig(
                maxDepth,
                getInt(config, "max_block_repeats", base.maxBlockRepeats()),
                getInt(config, "max_paths", base.maxPaths()),
                getListString(config, "release_methods", base.releaseMethods()),
                getListString(config, "static_release_methods", base.staticReleaseMethods()),
                getListString(config, "release_keywords", base.releaseKeywords()),
                getListString(config, "ownership_keywords", base.ownershipKeywords()),
                getListString(config, "resource_types", base.resourceTypes()),
                getListString(config, "resource_type_suffixes", base.resourceTypeSuffixes()),
                getListString(config, "exclude_patterns", base.excludePatterns()),
                getInt(config, "threads", base.threads()),
                getBoolean(config, "use_symbol_solver", base.useSymbolSolver()));
    }

    static ReleaseAnalysisConfig forPreset(String preset) {
        return switch (preset) {
            case "thorough" -> ReleaseAnalysisConfig.thorough();
            case "fast" -> ReleaseAnalysisConfig.fast();
            case "defaults", "default" -> ReleaseAnalysisConfig.defaults();
            default -> throw new IllegalArgumentException("Unknown preset: " + preset);
        };
    }

    private static int getInt(Map<String, Object> map, String key, int defaultValue) {
        Object value = map.get(key);
        if (value instanceof Number number) {
            return number.intValue();
        }
        return defaultValue;
    }

    private static boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value instanceof Boolean flag) {
            return flag;
        }
        return defaultValue;
    }

    private static @Nullable String getString(Map<String, Object> map, String key, @Nullable String defaultValue) {
        Object value = map.get(key);
        if (value != null) {
            return value.toString();
        }
        return defaultValue;
    }

    private static List<String> getListString(Map<String, Object> map, String key, List<String> defaultValue) {
        Object value = map.get(key);
        if (value instanceof List<?> list) {
            return list.stream().map(String::valueOf).toList();
        }
        return defaultValue;
    }
}
