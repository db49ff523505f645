package com.raditha.release.cfg;

import com.github.javaparser.ast.CompilationUnit;
import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.body.Parameter;
import com.github.javaparser.ast.stmt.CatchClause;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.ThrowStmt;
import com.raditha.release.SourceFixture;
import com.raditha.release.model.Procedure;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ControlFlowGraphBuilderTest {

    private final ControlFlowGraphBuilder builder = new ControlFlowGraphBuilder();

    private ControlFlowGraph build(String members, String method) {
        CompilationUnit cu = SourceFixture.parseClass(members);
        return builder.build(SourceFixture.method(cu, method)).orElseThrow();
    }

    @Test
    void testBuild_StraightLine() {
        ControlFlowGraph cfg = build("void m() { a(); b(); }", "m");

        assertEquals(3, cfg.size(), "entry, one body block, exit");
        assertTrue(cfg.entry().isEntry());
        assertTrue(cfg.exit().isExit());
        BasicBlock body = cfg.block(1);
        assertEquals(2, body.operations().size());
        assertSame(body, cfg.entry().fallThrough().orElseThrow());
        assertSame(cfg.exit(), body.fallThrough().orElseThrow());
        assertTrue(cfg.exit().successors().isEmpty());
    }

    @Test
    void testBuild_OrdinalsFollowBlockOrder() {
        ControlFlowGraph cfg = build("void m(boolean c) { if (c) { a(); } else { b(); } }", "m");

        for (int i = 0; i < cfg.size(); i++) {
            assertEquals(i, cfg.block(i).ordinal());
            assertSame(cfg, cfg.block(i).graph());
            assertEquals("B" + i, cfg.block(i).toString());
        }
    }

    @Test
    void testBuild_IfWithoutElseHasTwoSuccessors() {
        ControlFlowGraph cfg = build("void m(boolean c) { if (c) { a(); } b(); }", "m");

        BasicBlock condition = cfg.block(1);
        assertEquals(2, condition.successors().size());
        assertTrue(condition.conditional().isPresent(), "true branch is the conditional edge");
        assertEquals("c", condition.operations().get(0).toString());
    }

    @Test
    void testBuild_ReturnGoesToExit() {
        ControlFlowGraph cfg = build("void m(boolean c) { if (c) { a(); return; } b(); }", "m");

        ReturnStmt ret = cfg.procedure().declaration().findFirst(ReturnStmt.class).orElseThrow();
        BasicBlock block = cfg.blockContaining(ret).orElseThrow();
        assertSame(cfg.exit(), block.fallThrough().orElseThrow());
        assertEquals(1, block.successors().size());
    }

    @Test
    void testBuild_WhileLoopRegion() {
        ControlFlowGraph cfg = build("void m(int n) { while (n > 0) { n--; } done(); }", "m");

        List<BasicBlock> loopBlocks = cfg.blocksWithin(RegionKind.LOOP);
        assertFalse(loopBlocks.isEmpty());
        BasicBlock condition = loopBlocks.get(0);
        assertEquals("n > 0", condition.operations().get(0).toString());
        BasicBlock body = condition.conditional().orElseThrow();
        assertTrue(body.isWithin(RegionKind.LOOP));
        assertTrue(body.successors().contains(condition), "body loops back to the condition");
        assertFalse(condition.fallThrough().orElseThrow().isWithin(RegionKind.LOOP));
    }

    @Test
    void testBuild_InfiniteLoopHasNoExitEdge() {
        ControlFlowGraph cfg = build("void m() { while (true) { work(); } }", "m");

        BasicBlock condition = cfg.blocksWithin(RegionKind.LOOP).get(0);
        assertEquals(1, condition.successors().size());
        assertTrue(condition.fallThrough().isEmpty());
    }

    @Test
    void testBuild_ForEachVariableIsAnOperation() {
        ControlFlowGraph cfg = build("void m(List<String> xs) { for (String x : xs) { use(x); } }", "m");

        BasicBlock header = cfg.blocksWithin(RegionKind.LOOP).get(0);
        assertEquals("String x", header.operations().get(0).toString());
        assertEquals(2, header.successors().size());
    }

    @Test
    void testBuild_CatchParameterInCatchRegion() {
        ControlFlowGraph cfg = build("""
                void m() {
                    try {
                        a();
                    } catch (IOException e) {
                        b(e);
                    }
                }
                """, "m");

        Parameter parameter = cfg.procedure().declaration().findFirst(CatchClause.class).orElseThrow().getParameter();
        BasicBlock catchBlock = cfg.blockContaining(parameter).orElseThrow();
        assertTrue(catchBlock.isWithin(RegionKind.CATCH));
        assertFalse(cfg.blocksWithin(RegionKind.TRY).isEmpty());
    }

    @Test
    void testBuild_ThrowInsideTryGoesToCatch() {
        ControlFlowGraph cfg = build("""
                void m() {
                    try {
                        throw new IOException();
                    } catch (IOException e) {
                        b();
                    }
                }
                """, "m");

        ThrowStmt thrown = cfg.procedure().declaration().findFirst(ThrowStmt.class).orElseThrow();
        BasicBlock block = cfg.blockContaining(thrown).orElseThrow();
        BasicBlock target = block.fallThrough().orElseThrow();
        assertFalse(target.isExit(), "the catch dispatch handles it");
    }

    @Test
    void testBuild_ThrowOutsideTryGoesToExit() {
        ControlFlowGraph cfg = build("void m(boolean c) { if (c) throw new IllegalStateException(); a(); }", "m");

        ThrowStmt thrown = cfg.procedure().declaration().findFirst(ThrowStmt.class).orElseThrow();
        assertSame(cfg.exit(), cfg.blockContaining(thrown).orElseThrow().fallThrough().orElseThrow());
    }

    @Test
    void testBuild_FinallyRegion() {
        ControlFlowGraph cfg = build("void m() { try { a(); } finally { b(); } }", "m");

        List<BasicBlock> finallyBlocks = cfg.blocksWithin(RegionKind.FINALLY);
        assertEquals(1, finallyBlocks.size());
        assertEquals("b();", finallyBlocks.get(0).operations().get(0).toString());
    }

    @Test
    void testBuild_LabeledBreakAndContinue() {
        Optional<ControlFlowGraph> cfg = builder.build(SourceFixture.method(SourceFixture.parseClass("""
                void m(int[][] grid) {
                    outer:
                    for (int[] row : grid) {
                        for (int v : row) {
                            if (v < 0) continue outer;
                            if (v == 0) break outer;
                        }
                    }
                }
                """), "m"));

        assertTrue(cfg.isPresent());
    }

    @Test
    void testBuild_SwitchFallThrough() {
        ControlFlowGraph cfg = build("""
                void m(int k) {
                    switch (k) {
                        case 1: a();
                        case 2: b(); break;
                        default: c();
                    }
                }
                """, "m");

        assertEquals(3, new PathEnumerator().findAllPaths(cfg).size());
    }

    @Test
    void testBuild_NestedLambdaStaysInOneOperation() {
        ControlFlowGraph cfg = build("void m() { Runnable r = () -> { if (x()) return; y(); }; r.run(); }", "m");

        assertEquals(3, cfg.size());
        ReturnStmt inner = cfg.procedure().declaration().findFirst(ReturnStmt.class).orElseThrow();
        Node operation = cfg.operationContaining(inner).orElseThrow();
        assertTrue(operation.toString().startsWith("Runnable r"));
    }

    @Test
    void testBuild_FailsForExpressionLambda() {
        CompilationUnit cu = SourceFixture.parseClass("Runnable r = () -> System.out.println();");
        assertTrue(builder.build(SourceFixture.firstLambda(cu)).isEmpty());
    }

    @Test
    void testBuild_FailsWithoutBody() {
        CompilationUnit cu = SourceFixture.parse("abstract class A { abstract void m(); }");
        assertTrue(builder.build(SourceFixture.method(cu, "m")).isEmpty());
    }

    @Test
    void testBuild_FailsForUnresolvedLabel() {
        CompilationUnit cu = SourceFixture.parseClass("void m() { while (x()) { break missing; } }");
        assertTrue(builder.build(SourceFixture.method(cu, "m")).isEmpty());
    }

    @Test
    void testBuild_FailsForContinueOutsideLoop() {
        CompilationUnit cu = SourceFixture.parseClass("void m() { a(); continue; }");
        assertTrue(builder.build(SourceFixture.method(cu, "m")).isEmpty());
    }

    @Test
    void testBuild_BlocksAreFrozen() {
        ControlFlowGraph cfg = build("void m() { a(); }", "m");
        BasicBlock body = cfg.block(1);
        assertThrows(IllegalStateException.class, () -> body.setFallThrough(cfg.exit()));
        assertThrows(UnsupportedOperationException.class, () -> body.operations().clear());
    }
}
