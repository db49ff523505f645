package com.raditha.release.analysis;

import com.raditha.release.SourceFixture;
import com.raditha.release.config.ReleaseAnalysisConfig;
import com.raditha.release.model.AbortSignal;
import com.raditha.release.model.InterproceduralInfo;
import com.raditha.release.model.Procedure;
import com.raditha.release.model.TrackedVariable;
import com.raditha.release.resolve.CallTarget;
import com.raditha.release.resolve.LexicalResolutionContext;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InterproceduralAnnotatorTest {

    private final InterproceduralAnnotator annotator = InterproceduralAnnotator.from(ReleaseAnalysisConfig.defaults());

    private InterproceduralInfo annotate(String members) {
        Procedure m = SourceFixture.method(SourceFixture.parseClass(members), "m");
        TrackedVariable r = SourceFixture.local(m, "r");
        return annotator.annotate(m, r, new LexicalResolutionContext(), AbortSignal.NONE);
    }

    @Test
    void testCalleeNamedLikeRelease() {
        InterproceduralInfo info = annotate("""
                void m() {
                    Reader r = open();
                    disposeLater(r);
                    print(r);
                }
                """);

        assertEquals(2, info.callsWithVariable().size());
        assertEquals(List.of("disposeLater (line 8)"), info.potentialReleasingCallees());
        assertTrue(info.mayBeReleasedByCallee());
    }

    @Test
    void testOwnershipParameterName() {
        InterproceduralInfo info = annotate("""
                void m() {
                    Reader r = open();
                    adopt(r, 0);
                }

                void adopt(Reader owner, int flags) {
                }
                """);

        assertEquals(1, info.potentialReleasingCallees().size());
        assertTrue(info.potentialReleasingCallees().get(0).startsWith("adopt"));
    }

    @Test
    void testOtherParameterName() {
        InterproceduralInfo info = annotate("""
                void m() {
                    Reader r = open();
                    copy(r, 0);
                }

                void copy(Reader source, int flags) {
                }
                """);

        assertEquals(1, info.callsWithVariable().size());
        assertFalse(info.mayBeReleasedByCallee());
    }

    @Test
    void testCallsInsideClosuresIgnored() {
        InterproceduralInfo info = annotate("""
                void m() {
                    Reader r = open();
                    Runnable later = () -> closeLater(r);
                }
                """);

        assertTrue(info.callsWithVariable().isEmpty());
        assertEquals(InterproceduralInfo.none(), info);
    }

    @Test
    void testMightRelease() {
        InterproceduralAnnotator custom = new InterproceduralAnnotator(List.of("Release"), List.of("SINK"));

        assertTrue(custom.mightRelease(CallTarget.unresolved("releaseAll"), 0));
        assertFalse(custom.mightRelease(CallTarget.unresolved("closeAll"), 0));
        assertTrue(custom.mightRelease(new CallTarget("push", List.of("sink"), true), 0));
        assertFalse(custom.mightRelease(new CallTarget("push", List.of("sink"), true), 1));
    }
}
