package com.raditha.release.analysis;

import com.github.javaparser.ast.expr.MethodCallExpr;
import com.raditha.release.SourceFixture;
import com.raditha.release.model.Procedure;
import com.raditha.release.model.ReleaseEvent;
import com.raditha.release.model.TrackedVariable;
import com.raditha.release.resolve.LexicalResolutionContext;
import com.raditha.release.resolve.ResolutionContext;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CleanupPatternsTest {

    private final CleanupPatterns patterns = new CleanupPatterns();
    private final ReleaseEventLocator locator = new ReleaseEventLocator(new MethodNameReleaseClassifier());
    private final ResolutionContext context = new LexicalResolutionContext();

    @Test
    void testScopedAcquisition_DeclaredResource() {
        Procedure m = SourceFixture.method(SourceFixture.parseClass(
                "void m() throws IOException { try (Reader r = open(); Writer w = sink()) { r.read(); } }"), "m");

        assertTrue(patterns.isScopedAcquisition(m, SourceFixture.local(m, "r"), context));
        assertTrue(patterns.isScopedAcquisition(m, SourceFixture.local(m, "w"), context));
    }

    @Test
    void testScopedAcquisition_ExistingVariable() {
        Procedure m = SourceFixture.method(SourceFixture.parseClass(
                "void m() throws IOException { Reader r = open(); try (r) { r.read(); } }"), "m");

        assertTrue(patterns.isScopedAcquisition(m, SourceFixture.local(m, "r"), context));
    }

    @Test
    void testScopedAcquisition_OtherResource() {
        Procedure m = SourceFixture.method(SourceFixture.parseClass(
                "void m() throws IOException { Reader r = open(); try (Reader other = open()) { r.read(); } }"), "m");

        assertFalse(patterns.isScopedAcquisition(m, SourceFixture.local(m, "r"), context));
    }

    @Test
    void testScopedAcquisition_ResourceInNestedLambda() {
        Procedure m = SourceFixture.method(SourceFixture.parseClass("""
                void m() {
                    Reader r = open();
                    Runnable task = () -> {
                        try (r) {
                            r.read();
                        } catch (IOException e) {
                            log(e);
                        }
                    };
                }
                """), "m");

        assertFalse(patterns.isScopedAcquisition(m, SourceFixture.local(m, "r"), context));
    }

    @Test
    void testReleaseInFinally() {
        Procedure m = SourceFixture.method(SourceFixture.parseClass("""
                void m() throws IOException {
                    Reader r = open();
                    try {
                        r.read();
                        r.close();
                    } finally {
                        closeQuietly(r);
                    }
                }
                """), "m");
        TrackedVariable r = SourceFixture.local(m, "r");
        List<ReleaseEvent> events = locator.locate(m, r, context);

        Optional<ReleaseEvent> cleanup = patterns.releaseInFinally(m, events);

        assertEquals(2, events.size());
        assertTrue(cleanup.isPresent());
        assertEquals("closeQuietly", cleanup.get().call().getNameAsString());
    }

    @Test
    void testReleaseInTryBodyIsNotCleanup() {
        Procedure m = SourceFixture.method(SourceFixture.parseClass("""
                void m() throws IOException {
                    Reader r = open();
                    try {
                        r.close();
                    } catch (IOException e) {
                        r.close();
                    }
                }
                """), "m");
        TrackedVariable r = SourceFixture.local(m, "r");

        assertTrue(patterns.releaseInFinally(m, locator.locate(m, r, context)).isEmpty());
    }

    @Test
    void testReleaseInFinallyOfNestedTry() {
        Procedure m = SourceFixture.method(SourceFixture.parseClass("""
                void m(boolean c) throws IOException {
                    Reader r = open();
                    if (c) {
                        try {
                            r.read();
                        } finally {
                            r.close();
                        }
                    }
                }
                """), "m");
        TrackedVariable r = SourceFixture.local(m, "r");
        MethodCallExpr close = m.declaration().findFirst(MethodCallExpr.class,
                call -> call.getNameAsString().equals("close")).orElseThrow();

        Optional<ReleaseEvent> cleanup = patterns.releaseInFinally(m, locator.locate(m, r, context));

        assertTrue(cleanup.isPresent());
        assertSame(close, cleanup.get().call());
    }
}
