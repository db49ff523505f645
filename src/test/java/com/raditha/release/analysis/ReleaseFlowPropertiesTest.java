package com.raditha.release.analysis;

import com.raditha.release.SourceFixture;
import com.raditha.release.model.Procedure;
import com.raditha.release.model.ReleasePattern;
import com.raditha.release.model.ReleaseVerdict;
import com.raditha.release.model.TrackedVariable;
import net.jqwik.api.*;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Properties of the release analysis over generated method bodies.
 */
class ReleaseFlowPropertiesTest {

    private final ReleaseFlowAnalyzer analyzer = new ReleaseFlowAnalyzer(new MethodNameReleaseClassifier());

    private static String method(List<String> statements) {
        return "void m(boolean c, int n) throws IOException {\n"
                + "    Reader r = new FileReader(\"a\");\n"
                + "    " + String.join("\n    ", statements) + "\n"
                + "}\n";
    }

    private ReleaseVerdict analyze(String source) {
        Procedure m = SourceFixture.method(SourceFixture.parseClass(source), "m");
        TrackedVariable r = SourceFixture.local(m, "r");
        return analyzer.analyze(m, r);
    }

    @Property(tries = 100)
    void analysisIsDeterministic(@ForAll("anySegments") List<String> segments) {
        Procedure m = SourceFixture.method(SourceFixture.parseClass(method(segments)), "m");
        TrackedVariable r = SourceFixture.local(m, "r");

        assertEquals(analyzer.analyze(m, r), analyzer.analyze(m, r));
    }

    @Property(tries = 100)
    void finallyReleaseIsGuaranteedCleanup(@ForAll("anySegments") List<String> segments) {
        String body = "try {\n" + String.join("\n", segments) + "\n} finally {\n r.close();\n}";

        ReleaseVerdict verdict = analyze(method(List.of(body)));

        assertTrue(verdict.releasedOnAllPaths());
        assertEquals(ReleasePattern.GUARANTEED_CLEANUP, verdict.pattern());
    }

    @Property(tries = 100)
    void closingAtTheEndReleasesOnAllPaths(@ForAll("nonExitSegments") List<String> segments) {
        List<String> statements = new ArrayList<>(segments);
        statements.add("r.close();");

        ReleaseVerdict verdict = analyze(method(statements));

        assertTrue(verdict.releasedOnAllPaths(), verdict.reason());
        assertEquals(ReleasePattern.EXPLICIT_ALL_PATHS, verdict.pattern());
        assertTrue(verdict.problematicPaths().isEmpty());
        assertFalse(verdict.syntacticFallback());
    }

    @Property(tries = 100)
    void pathEvidenceIsConsistent(@ForAll("anySegments") List<String> segments) {
        ReleaseVerdict verdict = analyze(method(segments));

        assertTrue(verdict.problematicPaths().size() <= verdict.totalPaths());
        if (verdict.releasedOnAllPaths()) {
            assertTrue(verdict.problematicPaths().isEmpty());
        }
        if (!verdict.succeeded()) {
            assertFalse(verdict.isLeak());
        }
    }

    @Provide
    Arbitrary<List<String>> nonExitSegments() {
        return Arbitraries.of(
                "r.read();",
                "if (c) r.read();",
                "if (c) { r.read(); } else { r.skip(1); }",
                "while (n-- > 0) { r.read(); }",
                "for (int i = 0; i < n; i++) { if (c) continue; r.read(); }",
                "switch (n) { case 1: r.read(); break; default: r.skip(2); }",
                "try { r.read(); } catch (IOException e) { log(e); }"
        ).list().ofMaxSize(5);
    }

    @Provide
    Arbitrary<List<String>> anySegments() {
        return Arbitraries.of(
                "r.read();",
                "r.close();",
                "if (c) r.close();",
                "if (c) { r.close(); return; }",
                "if (c) return;",
                "if (n > 3) throw new IOException(\"n\");",
                "while (n-- > 0) { if (c) r.close(); }",
                "for (int i = 0; i < n; i++) { if (c) break; r.read(); }",
                "try { r.read(); } catch (IOException e) { r.close(); }"
        ).list().ofMaxSize(5);
    }
}
