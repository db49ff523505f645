package com.raditha.release.config;

import java.util.List;

/**
 * Configuration for release analysis and leak scanning.
 *
 * @param maxPathDepth         longest execution path enumerated, in blocks
 * @param maxBlockRepeats      times one block may recur on a single path
 * @param maxPaths             paths enumerated per procedure before stopping
 * @param releaseMethods       receiver methods that release their target (x.close())
 * @param staticReleaseMethods static helpers that release their argument (closeQuietly(x))
 * @param releaseKeywords      callee name fragments that suggest the callee releases an argument
 * @param ownershipKeywords    parameter name fragments that suggest the callee takes ownership
 * @param resourceTypes        simple type names treated as resources without the symbol solver
 * @param resourceTypeSuffixes type name suffixes treated as resources without the symbol solver
 * @param excludePatterns      file patterns to skip (glob format)
 * @param threads              worker threads for scanning files
 * @param useSymbolSolver      resolve names and types with the JavaParser symbol solver
 */
public record ReleaseAnalysisConfig(
        int maxPathDepth,
        int maxBlockRepeats,
        int maxPaths,
        List<String> releaseMethods,
        List<String> staticReleaseMethods,
        List<String> releaseKeywords,
        List<String> ownershipKeywords,
        List<String> resourceTypes,
        List<String> resourceTypeSuffixes,
        List<String> excludePatterns,
        int threads,
        boolean useSymbolSolver) {

    /**
     * Validate configuration.
     */
    public ReleaseAnalysisConfig {
        if (maxPathDepth < 1) {
            throw new IllegalArgumentException("maxPathDepth must be >= 1");
        }
        if (maxBlockRepeats < 1) {
            throw new IllegalArgumentException("maxBlockRepeats must be >= 1");
        }
        if (maxPaths < 1) {
            throw new IllegalArgumentException("maxPaths must be >= 1");
        }
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be >= 1");
        }
        if (releaseMethods == null || releaseMethods.isEmpty()) {
            throw new IllegalArgumentException("releaseMethods cannot be empty");
        }
        releaseMethods = List.copyOf(releaseMethods);
        staticReleaseMethods = staticReleaseMethods == null ? List.of() : List.copyOf(staticReleaseMethods);
        releaseKeywords = releaseKeywords == null ? List.of() : List.copyOf(releaseKeywords);
        ownershipKeywords = ownershipKeywords == null ? List.of() : List.copyOf(ownershipKeywords);
        resourceTypes = resourceTypes == null ? List.of() : List.copyOf(resourceTypes);
        resourceTypeSuffixes = resourceTypeSuffixes == null ? List.of() : List.copyOf(resourceTypeSuffixes);
        excludePatterns = excludePatterns == null ? List.of() : List.copyOf(excludePatterns);
    }

    /**
     * Defaults preset: the path bounds the engine was tuned with
     * (depth 100, 3 repeats, 100 paths), single threaded.
     */
    public static ReleaseAnalysisConfig defaults() {
        return new ReleaseAnalysisConfig(
                100, // maxPathDepth
                3, // maxBlockRepeats
                100, // maxPaths
                List.of("close"),
                List.of("closeQuietly"),
                defaultReleaseKeywords(),
                List.of("owner"),
                defaultResourceTypes(),
                defaultResourceSuffixes(),
                defaultExcludePatterns(),
                1, // threads
                false); // useSymbolSolver
    }

    /**
     * Thorough preset: more path evidence and type-based resource detection.
     * Slower, needs the sources of referenced types to be useful.
     */
    public static ReleaseAnalysisConfig thorough() {
        return new ReleaseAnalysisConfig(
                250,
                4,
                500,
                List.of("close"),
                List.of("closeQuietly"),
                defaultReleaseKeywords(),
                List.of("owner", "resource"),
                defaultResourceTypes(),
                defaultResourceSuffixes(),
                defaultExcludePatterns(),
                1,
                true);
    }

    /**
     * Fast preset: minimal path evidence, several threads.
     * The verdicts are unchanged since they never depend on path enumeration.
     */
    public static ReleaseAnalysisConfig fast() {
        return new ReleaseAnalysisConfig(
                40,
                2,
                20,
                List.of("close"),
                List.of("closeQuietly"),
                defaultReleaseKeywords(),
                List.of("owner"),
                defaultResourceTypes(),
                defaultResourceSuffixes(),
                defaultExcludePatterns(),
                Math.max(1, Runtime.getRuntime().availableProcessors()),
                false);
    }

    public ReleaseAnalysisConfig withMaxPathDepth(int depth) {
        return new ReleaseAnalysisConfig(depth, maxBlockRepeats, maxPaths, releaseMethods, staticReleaseMethods,
                releaseKeywords, ownershipKeywords, resourceTypes, resourceTypeSuffixes, excludePatterns,
                threads, useSymbolSolver);
    }

    public ReleaseAnalysisConfig withThreads(int count) {
        return new ReleaseAnalysisConfig(maxPathDepth, maxBlockRepeats, maxPaths, releaseMethods,
                staticReleaseMethods, releaseKeywords, ownershipKeywords, resourceTypes, resourceTypeSuffixes,
                excludePatterns, count, useSymbolSolver);
    }

    public ReleaseAnalysisConfig withSymbolSolver(boolean enabled) {
        return new ReleaseAnalysisConfig(maxPathDepth, maxBlockRepeats, maxPaths, releaseMethods,
                staticReleaseMethods, releaseKeywords, ownershipKeywords, resourceTypes, resourceTypeSuffixes,
                excludePatterns, threads, enabled);
    }

    static List<String> defaultReleaseKeywords() {
        return List.of("close", "dispose", "release");
    }

    static List<String> defaultResourceTypes() {
        return List.of(
                "Socket",
                "ServerSocket",
                "Connection",
                "Statement",
                "PreparedStatement",
                "ResultSet",
                "Scanner",
                "ZipFile",
                "JarFile",
                "RandomAccessFile",
                "FileChannel",
                "Formatter");
    }

    static List<String> defaultResourceSuffixes() {
        return List.of("Stream", "Reader", "Writer", "Channel");
    }

    /**
     * Default file exclusion patterns.
     */
    static List<String> defaultExcludePatterns() {
        return List.of(
                "**/target/**",
                "**/build/**",
                "**/generated/**",
                "**/.git/**");
    }

    /**
     * Check if a file path matches any exclusion pattern.
     */
    public boolean shouldExclude(String filePath) {
        String normalized = filePath.replace('\\', '/');
        for (String pattern : excludePatterns) {
            if (matchesGlobPattern(normalized, pattern)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Simple glob pattern matching.
     * Supports ** and * wildcards.
     */
    private static boolean matchesGlobPattern(String path, String pattern) {
        String regex = pattern
                .replace(".", "\\.")
                .replace("**/", "\u0000")
                .replace("**", "\u0001")
                .replace("*", "[^/]*")
                .replace("\u0000", "(.*/)?")
                .replace("\u0001", ".*");
        return path.matches(regex);
    }
}
