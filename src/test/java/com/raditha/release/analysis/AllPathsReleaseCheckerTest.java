package com.raditha.release.analysis;

import com.raditha.release.SourceFixture;
import com.raditha.release.cfg.BasicBlock;
import com.raditha.release.cfg.ControlFlowGraph;
import com.raditha.release.cfg.ControlFlowGraphBuilder;
import com.raditha.release.cfg.ExecutionPath;
import com.raditha.release.cfg.PathEnumerator;
import com.raditha.release.model.AbortSignal;
import com.raditha.release.model.AnalysisAbortedException;
import com.raditha.release.model.Procedure;
import com.raditha.release.model.ReleaseEvent;
import com.raditha.release.model.TrackedVariable;
import com.raditha.release.resolve.LexicalResolutionContext;
import com.raditha.release.resolve.ResolutionContext;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class AllPathsReleaseCheckerTest {

    private final AllPathsReleaseChecker checker = new AllPathsReleaseChecker();
    private final ReleaseEventLocator locator = new ReleaseEventLocator(new MethodNameReleaseClassifier());
    private final ResolutionContext context = new LexicalResolutionContext();

    private ControlFlowGraph cfg;
    private VariableFacts facts;

    private void prepare(String method, boolean parameter) {
        Procedure m = SourceFixture.method(SourceFixture.parseClass(method), "m");
        TrackedVariable r = parameter ? SourceFixture.parameter(m, "r") : SourceFixture.local(m, "r");
        cfg = new ControlFlowGraphBuilder().build(m).orElseThrow();
        List<ReleaseEvent> events = locator.locate(m, r, context);
        facts = new VariableFacts(m, r, events, locator.releaseBlocks(cfg, events), context,
                new OwnershipTransferResolver());
    }

    private boolean released(String method) {
        prepare(method, false);
        return checker.areAllPathsReleased(cfg, facts);
    }

    @Test
    void testStraightLineRelease() {
        assertTrue(released("void m() { Reader r = open(); r.read(); r.close(); }"));
    }

    @Test
    void testNoRelease() {
        prepare("void m() { Reader r = open(); r.read(); }", false);

        Optional<BasicBlock> violation = checker.findUnreleasedExit(cfg, facts, AbortSignal.NONE);
        assertTrue(violation.isPresent());
        assertTrue(violation.get().isExit());
    }

    @Test
    void testReleaseOnOneBranchOnly() {
        assertFalse(released("""
                void m(boolean c) {
                    Reader r = open();
                    if (c) r.close();
                }
                """));
    }

    @Test
    void testReleaseThenReturn() {
        assertTrue(released("""
                void m(boolean c) {
                    Reader r = open();
                    if (c) {
                        r.close();
                        return;
                    }
                    r.close();
                }
                """));
    }

    @Test
    void testBareReturnReachesExitUnreleased() {
        prepare("""
                void m(boolean c) {
                    Reader r = open();
                    if (c) return;
                    r.close();
                }
                """, false);

        BasicBlock violation = checker.findUnreleasedExit(cfg, facts, AbortSignal.NONE).orElseThrow();
        assertTrue(violation.isExit());
    }

    @Test
    void testThrowIsTheViolation() {
        prepare("""
                void m(boolean bad) {
                    Reader r = open();
                    if (bad) throw new IllegalStateException();
                    r.close();
                }
                """, false);

        BasicBlock violation = checker.findUnreleasedExit(cfg, facts, AbortSignal.NONE).orElseThrow();
        assertFalse(violation.isExit());
        assertTrue(violation.operations().stream().anyMatch(op -> op.toString().startsWith("throw")));
    }

    @Test
    void testValueReturnOfOtherObject() {
        assertFalse(released("""
                String m() {
                    Reader r = open();
                    return "done";
                }
                """));
    }

    @Test
    void testReturningTheVariableHandsItOver() {
        assertTrue(released("""
                Reader m(boolean c) {
                    Reader r = open();
                    if (c) return r;
                    r.close();
                    return null;
                }
                """));
    }

    @Test
    void testEarlyExitBeforeAcquisition() {
        assertTrue(released("""
                void m(boolean skip) {
                    if (skip) return;
                    Reader r = open();
                    r.close();
                }
                """));
    }

    @Test
    void testNullInitializerIsNotAnAcquisition() {
        assertTrue(released("""
                void m(boolean c) {
                    Reader r = null;
                    if (c) return;
                    r = open();
                    r.close();
                }
                """));
    }

    @Test
    void testAcquisitionAfterReleaseResetsState() {
        assertFalse(released("""
                void m() {
                    Reader r = open();
                    r.close();
                    r = open();
                }
                """));
    }

    @Test
    void testLoopReacquiresEachIteration() {
        assertTrue(released("""
                void m(List<String> names) {
                    for (String name : names) {
                        Reader r = open(name);
                        r.close();
                    }
                }
                """));
    }

    @Test
    void testThrowHandledByCatchThatReleases() {
        assertTrue(released("""
                void m(boolean bad) {
                    Reader r = open();
                    try {
                        if (bad) throw new IOException();
                        r.close();
                    } catch (IOException e) {
                        r.close();
                    }
                }
                """));
    }

    @Test
    void testParameterStartsUnreleased() {
        prepare("void m(Reader r, boolean c) { if (c) r.close(); }", true);
        assertFalse(checker.areAllPathsReleased(cfg, facts));

        prepare("void m(Reader r) { r.close(); }", true);
        assertTrue(checker.areAllPathsReleased(cfg, facts));
    }

    @Test
    void testViolatesAgreesWithWorklist() {
        prepare("""
                void m(boolean a, boolean b) {
                    Reader r = open();
                    if (a) r.read();
                    if (b) r.close();
                }
                """, false);

        List<ExecutionPath> paths = new PathEnumerator().findAllPaths(cfg);
        long violating = paths.stream().filter(p -> checker.violates(p, facts)).count();

        assertEquals(4, paths.size());
        assertEquals(2, violating);
        assertFalse(checker.areAllPathsReleased(cfg, facts));
    }

    @Test
    void testAbortStopsTheWorklist() {
        prepare("void m() { Reader r = open(); r.close(); }", false);
        AbortSignal abort = mock(AbortSignal.class);
        when(abort.isAborted()).thenReturn(true);
        doCallRealMethod().when(abort).throwIfAborted();

        assertThrows(AnalysisAbortedException.class, () -> checker.areAllPathsReleased(cfg, facts, abort));
    }

    @Test
    void testAbortStopsPathReplay() {
        prepare("""
                void m(boolean c) {
                    Reader r = open();
                    if (c) r.close();
                }
                """, false);
        List<ExecutionPath> paths = new PathEnumerator().findAllPaths(cfg);
        AbortSignal abort = mock(AbortSignal.class);
        when(abort.isAborted()).thenReturn(true);
        doCallRealMethod().when(abort).throwIfAborted();

        assertEquals(2, paths.size());
        for (ExecutionPath path : paths) {
            assertThrows(AnalysisAbortedException.class, () -> checker.violates(path, facts, abort));
        }
        verify(abort, atLeastOnce()).isAborted();
    }

    @Test
    void testAbortStopsEventLocation() {
        Procedure m = SourceFixture.method(SourceFixture.parseClass(
                "void m() { Reader r = open(); r.close(); }"), "m");
        TrackedVariable r = SourceFixture.local(m, "r");

        assertThrows(AnalysisAbortedException.class, () -> locator.locate(m, r, context, () -> true));
        assertEquals(1, locator.locate(m, r, context, AbortSignal.NONE).size());
    }
}
