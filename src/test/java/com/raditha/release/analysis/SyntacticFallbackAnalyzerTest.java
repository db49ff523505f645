package com.raditha.release.analysis;

import com.raditha.release.SourceFixture;
import com.raditha.release.model.AbortSignal;
import com.raditha.release.model.Procedure;
import com.raditha.release.model.ReleasePattern;
import com.raditha.release.model.ReleaseVerdict;
import com.raditha.release.resolve.LexicalResolutionContext;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SyntacticFallbackAnalyzerTest {

    private final SyntacticFallbackAnalyzer fallback = new SyntacticFallbackAnalyzer(new MethodNameReleaseClassifier());

    private ReleaseVerdict scan(String method) {
        Procedure m = SourceFixture.method(SourceFixture.parseClass(method), "m");
        return fallback.analyze(m, SourceFixture.local(m, "r"), new LexicalResolutionContext(), AbortSignal.NONE);
    }

    @Test
    void testReleasedAtEnd() {
        ReleaseVerdict verdict = scan("void m() { Reader r = open(); r.read(); r.close(); }");

        assertTrue(verdict.releasedOnAllPaths());
        assertTrue(verdict.syntacticFallback());
        assertEquals("Released before every exit (statement-order scan)", verdict.reason());
    }

    @Test
    void testEveryVerdictIsMarked() {
        assertTrue(scan("void m() { Reader r = open(); }").syntacticFallback());
        assertTrue(scan("void m() { try (Reader r = open()) { r.read(); } }").syntacticFallback());
        assertTrue(scan("Reader m() { Reader r = open(); return r; }").syntacticFallback());
    }

    @Test
    void testNoReleaseEvents() {
        ReleaseVerdict verdict = scan("void m() { Reader r = open(); r.read(); }");

        assertTrue(verdict.isLeak());
        assertEquals(ReleasePattern.NONE, verdict.pattern());
    }

    @Test
    void testFinallyRelease() {
        ReleaseVerdict verdict = scan("void m() { Reader r = open(); try { r.read(); } finally { r.close(); } }");

        assertEquals(ReleasePattern.GUARANTEED_CLEANUP, verdict.pattern());
        assertTrue(verdict.releasedOnAllPaths());
    }

    @Test
    void testTopLevelThrowWithoutPriorRelease() {
        ReleaseVerdict verdict = scan("""
                void m(boolean c) {
                    Reader r = open();
                    if (c) r.close();
                    throw new IllegalStateException();
                }
                """);

        assertTrue(verdict.isLeak());
        assertEquals("Exit at line 9 is not preceded by a release", verdict.reason());
    }

    @Test
    void testReleaseBeforeTopLevelReturn() {
        ReleaseVerdict verdict = scan("""
                String m() {
                    Reader r = open();
                    r.close();
                    return "done";
                }
                """);

        assertTrue(verdict.releasedOnAllPaths());
    }

    @Test
    void testCompoundLastStatementIsUndetermined() {
        ReleaseVerdict verdict = scan("""
                void m(boolean c) {
                    Reader r = open();
                    r.read();
                    if (c) {
                        r.close();
                    } else {
                        r.close();
                    }
                }
                """);

        assertFalse(verdict.succeeded());
        assertFalse(verdict.releasedOnAllPaths());
        assertFalse(verdict.isLeak());
        assertTrue(verdict.reason().startsWith("Cannot see past the statement at line 9"));
    }

    @Test
    void testNestedExitIsUndetermined() {
        ReleaseVerdict verdict = scan("""
                void m(boolean c) {
                    Reader r = open();
                    if (c) return;
                    r.close();
                }
                """);

        assertFalse(verdict.succeeded());
        assertTrue(verdict.reason().startsWith("Exit nested in the statement at line 8"));
    }

    @Test
    void testNestedExitAfterReleaseIsFine() {
        ReleaseVerdict verdict = scan("""
                void m(boolean c) {
                    Reader r = open();
                    r.close();
                    if (c) return;
                    closeQuietly(r);
                }
                """);

        assertTrue(verdict.releasedOnAllPaths());
    }

    @Test
    void testAcquisitionAfterLastRelease() {
        ReleaseVerdict verdict = scan("""
                void m() {
                    Reader r = open();
                    r.close();
                    r = open();
                }
                """);

        assertTrue(verdict.isLeak());
        assertTrue(verdict.reason().startsWith("No release between the acquisition at line 9"));
    }
}
