package com.raditha.release.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ReleaseAnalysisSettingsTest {

    @TempDir
    Path tempDir;

    private static Path testConfig() throws URISyntaxException {
        return Path.of(ReleaseAnalysisSettingsTest.class.getResource("/closer-test.yml").toURI());
    }

    @Test
    void testLoadFromYaml() throws Exception {
        ReleaseAnalysisConfig config = ReleaseAnalysisSettings.loadConfig(testConfig(), 0, null);

        assertEquals(60, config.maxPathDepth());
        assertEquals(10, config.maxPaths());
        assertEquals(ReleaseAnalysisConfig.fast().maxBlockRepeats(), config.maxBlockRepeats(),
                "unset keys come from the preset");
        assertEquals(List.of("close", "shutdown"), config.releaseMethods());
        assertEquals(List.of("closeQuietly"), config.staticReleaseMethods());
        assertEquals(List.of("owner", "sink"), config.ownershipKeywords());
        assertEquals(List.of("Connection", "Lease"), config.resourceTypes());
        assertEquals(List.of("**/generated/**"), config.excludePatterns());
        assertEquals(2, config.threads());
        assertFalse(config.useSymbolSolver());
    }

    @Test
    void testCliOverridesYaml() throws Exception {
        ReleaseAnalysisConfig config = ReleaseAnalysisSettings.loadConfig(testConfig(), 25, "thorough");

        assertEquals(25, config.maxPathDepth());
        assertEquals(ReleaseAnalysisConfig.thorough().maxBlockRepeats(), config.maxBlockRepeats());
        assertEquals(10, config.maxPaths(), "explicit YAML values still apply over the preset");
        assertFalse(config.useSymbolSolver());
    }

    @Test
    void testMissingSectionGivesDefaults() throws IOException {
        Path file = tempDir.resolve("other.yml");
        Files.writeString(file, "something_else:\n  key: 1\n");

        assertEquals(ReleaseAnalysisConfig.defaults(), ReleaseAnalysisSettings.loadConfig(file, 0, null));
    }

    @Test
    void testEmptyFileGivesDefaults() throws IOException {
        Path file = tempDir.resolve("empty.yml");
        Files.writeString(file, "");

        assertEquals(ReleaseAnalysisConfig.defaults(), ReleaseAnalysisSettings.loadConfig(file, 0, null));
    }

    @Test
    void testMissingFile() {
        Path missing = tempDir.resolve("missing.yml");

        assertThrows(IOException.class, () -> ReleaseAnalysisSettings.loadConfig(missing, 0, null));
    }

    @Test
    void testMalformedYaml() throws IOException {
        Path file = tempDir.resolve("broken.yml");
        Files.writeString(file, "release_analysis: [unclosed\n");

        assertThrows(IOException.class, () -> ReleaseAnalysisSettings.loadConfig(file, 0, null));
    }

    @Test
    void testUnknownPreset() {
        assertThrows(IllegalArgumentException.class,
                () -> ReleaseAnalysisSettings.fromMap(Map.of("preset", "reckless"), 0, null));
    }

    @Test
    void testInvalidValueRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> ReleaseAnalysisSettings.fromMap(Map.of("threads", 0), 0, null));
    }

    @Test
    void testWrongTypesFallBackToPreset() {
        ReleaseAnalysisConfig config = ReleaseAnalysisSettings.fromMap(
                Map.of("max_paths", "many", "use_symbol_solver", "yes", "release_methods", "close"), 0, "defaults");

        assertEquals(ReleaseAnalysisConfig.defaults(), config);
    }
}
