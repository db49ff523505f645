package com.raditha.release.cfg;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.BooleanLiteralExpr;
import com.github.javaparser.ast.expr.EnclosedExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.BreakStmt;
import com.github.javaparser.ast.stmt.CatchClause;
import com.github.javaparser.ast.stmt.ContinueStmt;
import com.github.javaparser.ast.stmt.DoStmt;
import com.github.javaparser.ast.stmt.EmptyStmt;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.ForEachStmt;
import com.github.javaparser.ast.stmt.ForStmt;
import com.github.javaparser.ast.stmt.IfStmt;
import com.github.javaparser.ast.stmt.LabeledStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.stmt.SwitchEntry;
import com.github.javaparser.ast.stmt.SwitchStmt;
import com.github.javaparser.ast.stmt.SynchronizedStmt;
import com.github.javaparser.ast.stmt.ThrowStmt;
import com.github.javaparser.ast.stmt.TryStmt;
import com.github.javaparser.ast.stmt.UnparsableStmt;
import com.github.javaparser.ast.stmt.WhileStmt;
import com.github.javaparser.ast.stmt.YieldStmt;
import com.raditha.release.model.AbortSignal;
import com.raditha.release.model.Procedure;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Builds a {@link ControlFlowGraph} from the block body of a procedure.
 * <p>
 * Operations are statements and the expressions that decide control flow:
 * if and loop conditions, switch selectors, for-each iterables, try
 * resources and catch parameters. Compound statements never appear as
 * operations; their parts do. Nested closures stay inside the operation that
 * contains them and are never expanded.
 * <p>
 * A try body gets a leading block whose conditional edge leads to the catch
 * dispatch chain, which models an exception raised before anything in the
 * body completes. A throw statement inside a try body with catch clauses
 * jumps to that dispatch; any other throw leaves the procedure.
 */
public class ControlFlowGraphBuilder {
    private static final Logger logger = LoggerFactory.getLogger(ControlFlowGraphBuilder.class);

    /**
     * Build the graph, or return empty when the body has a shape the builder
     * does not model.
     */
    public Optional<ControlFlowGraph> build(Procedure procedure) {
        return build(procedure, AbortSignal.NONE);
    }

    /**
     * Build the graph, polling {@code abort} before each statement. An abort
     * propagates as {@code AnalysisAbortedException} and yields no graph.
     */
    public Optional<ControlFlowGraph> build(Procedure procedure, AbortSignal abort) {
        Optional<BlockStmt> body = procedure.body();
        if (body.isEmpty()) {
            logger.debug("No block body for {}, control flow graph not available", procedure);
            return Optional.empty();
        }
        try {
            ControlFlowGraph graph = new Construction(procedure, abort).run(body.get());
            logger.debug("Built {}", graph);
            return Optional.of(graph);
        } catch (UnsupportedConstructException e) {
            logger.debug("Control flow graph construction failed for {}: {}", procedure, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Signals a body shape the builder gives up on. Never leaves this class.
     */
    private static final class UnsupportedConstructException extends RuntimeException {
        UnsupportedConstructException(String message) {
            super(message);
        }
    }

    /**
     * Where break and continue statements may go.
     */
    private static final class JumpTarget {
        private final @Nullable String label;
        private final boolean loop;
        private final boolean breakable;
        private final @Nullable BasicBlock continueTarget;
        private final List<BasicBlock> breakSources = new ArrayList<>();

        JumpTarget(@Nullable String label, boolean loop, boolean breakable, @Nullable BasicBlock continueTarget) {
            this.label = label;
            this.loop = loop;
            this.breakable = breakable;
            this.continueTarget = continueTarget;
        }
    }

    /**
     * One construction pass over one procedure.
     */
    private static final class Construction {
        private final Procedure procedure;
        private final AbortSignal abort;
        private final List<BasicBlock> blocks = new ArrayList<>();
        private final Deque<ControlFlowRegion> regions = new ArrayDeque<>();
        private final Deque<JumpTarget> jumpTargets = new ArrayDeque<>();
        private final Deque<BasicBlock> handlers = new ArrayDeque<>();
        private final BasicBlock exit;
        private BasicBlock current;
        private @Nullable String pendingLabel;

        Construction(Procedure procedure, AbortSignal abort) {
            this.procedure = procedure;
            this.abort = abort;
            regions.push(new ControlFlowRegion(RegionKind.ROOT, null, procedure.declaration()));
            BasicBlock entry = new BasicBlock(BasicBlock.Kind.ENTRY, regions.peek());
            blocks.add(entry);
            exit = new BasicBlock(BasicBlock.Kind.EXIT, regions.peek());
            current = newBlock();
            entry.setFallThrough(current);
        }

        ControlFlowGraph run(BlockStmt body) {
            buildStatement(body);
            link(current, exit);
            blocks.add(exit);
            return new ControlFlowGraph(procedure, blocks);
        }

        private BasicBlock newBlock() {
            BasicBlock block = new BasicBlock(BasicBlock.Kind.BODY, regions.peek());
            blocks.add(block);
            return block;
        }

        private void pushRegion(RegionKind kind, Node owner) {
            regions.push(new ControlFlowRegion(kind, regions.peek(), owner));
        }

        private void popRegion() {
            regions.pop();
        }

        private static void link(BasicBlock from, BasicBlock to) {
            if (from.fallThrough().isEmpty()) {
                from.setFallThrough(to);
            }
        }

        /**
         * Code after an unconditional jump goes into a fresh block with no
         * predecessors.
         */
        private void startUnreachable() {
            current = newBlock();
        }

        private @Nullable String takePendingLabel() {
            String label = pendingLabel;
            pendingLabel = null;
            return label;
        }

        private void buildStatement(Statement stmt) {
            abort.throwIfAborted();
            if (stmt instanceof BlockStmt block) {
                for (Statement s : block.getStatements()) {
                    buildStatement(s);
                }
            } else if (stmt instanceof ExpressionStmt) {
                current.addOperation(stmt);
            } else if (stmt instanceof IfStmt ifStmt) {
                buildIf(ifStmt);
            } else if (stmt instanceof WhileStmt whileStmt) {
                buildWhile(whileStmt);
            } else if (stmt instanceof DoStmt doStmt) {
                buildDo(doStmt);
            } else if (stmt instanceof ForStmt forStmt) {
                buildFor(forStmt);
            } else if (stmt instanceof ForEachStmt forEach) {
                buildForEach(forEach);
            } else if (stmt instanceof SwitchStmt switchStmt) {
                buildSwitch(switchStmt);
            } else if (stmt instanceof TryStmt tryStmt) {
                buildTry(tryStmt);
            } else if (stmt instanceof ReturnStmt) {
                current.addOperation(stmt);
                link(current, exit);
                startUnreachable();
            } else if (stmt instanceof ThrowStmt) {
                current.addOperation(stmt);
                link(current, handlers.isEmpty() ? exit : handlers.peek());
                startUnreachable();
            } else if (stmt instanceof BreakStmt breakStmt) {
                buildBreak(breakStmt);
            } else if (stmt instanceof ContinueStmt continueStmt) {
                buildContinue(continueStmt);
            } else if (stmt instanceof LabeledStmt labeled) {
                buildLabeled(labeled);
            } else if (stmt instanceof SynchronizedStmt sync) {
                current.addOperation(sync.getExpression());
                buildStatement(sync.getBody());
            } else if (stmt instanceof EmptyStmt) {
                // nothing to record
            } else if (stmt instanceof YieldStmt) {
                throw new UnsupportedConstructException("yield outside a switch expression");
            } else if (stmt instanceof UnparsableStmt) {
                throw new UnsupportedConstructException("unparsable statement at " + stmt.getBegin().orElse(null));
            } else {
                // assert, explicit constructor calls, local class and record declarations
                current.addOperation(stmt);
            }
        }

        private void buildIf(IfStmt stmt) {
            current.addOperation(stmt.getCondition());
            BasicBlock condition = current;
            BasicBlock thenStart = newBlock();
            condition.setConditional(thenStart);
            current = thenStart;
            buildStatement(stmt.getThenStmt());
            BasicBlock thenEnd = current;

            BasicBlock elseEnd = null;
            if (stmt.getElseStmt().isPresent()) {
                BasicBlock elseStart = newBlock();
                condition.setFallThrough(elseStart);
                current = elseStart;
                buildStatement(stmt.getElseStmt().get());
                elseEnd = current;
            }

            BasicBlock after = newBlock();
            link(thenEnd, after);
            if (elseEnd != null) {
                link(elseEnd, after);
            } else {
                condition.setFallThrough(after);
            }
            current = after;
        }

        private void buildWhile(WhileStmt stmt) {
            String label = takePendingLabel();
            pushRegion(RegionKind.LOOP, stmt);
            BasicBlock condition = newBlock();
            link(current, condition);
            condition.addOperation(stmt.getCondition());
            BasicBlock bodyStart = newBlock();
            condition.setConditional(bodyStart);

            JumpTarget target = new JumpTarget(label, true, true, condition);
            jumpTargets.push(target);
            current = bodyStart;
            buildStatement(stmt.getBody());
            link(current, condition);
            jumpTargets.pop();
            popRegion();

            finishLoop(condition, target, !isConstantTrue(stmt.getCondition()));
        }

        private void buildDo(DoStmt stmt) {
            String label = takePendingLabel();
            pushRegion(RegionKind.LOOP, stmt);
            BasicBlock bodyStart = newBlock();
            link(current, bodyStart);
            BasicBlock condition = newBlock();

            JumpTarget target = new JumpTarget(label, true, true, condition);
            jumpTargets.push(target);
            current = bodyStart;
            buildStatement(stmt.getBody());
            link(current, condition);
            jumpTargets.pop();

            condition.addOperation(stmt.getCondition());
            condition.setConditional(bodyStart);
            popRegion();

            finishLoop(condition, target, !isConstantTrue(stmt.getCondition()));
        }

        private void buildFor(ForStmt stmt) {
            String label = takePendingLabel();
            stmt.getInitialization().forEach(current::addOperation);
            pushRegion(RegionKind.LOOP, stmt);
            BasicBlock condition = newBlock();
            link(current, condition);
            stmt.getCompare().ifPresent(condition::addOperation);
            BasicBlock bodyStart = newBlock();
            condition.setConditional(bodyStart);
            BasicBlock update = newBlock();
            stmt.getUpdate().forEach(update::addOperation);
            update.setFallThrough(condition);

            JumpTarget target = new JumpTarget(label, true, true, update);
            jumpTargets.push(target);
            current = bodyStart;
            buildStatement(stmt.getBody());
            link(current, update);
            jumpTargets.pop();
            popRegion();

            boolean canFinish = stmt.getCompare().map(c -> !isConstantTrue(c)).orElse(false);
            finishLoop(condition, target, canFinish);
        }

        private void buildForEach(ForEachStmt stmt) {
            String label = takePendingLabel();
            current.addOperation(stmt.getIterable());
            pushRegion(RegionKind.LOOP, stmt);
            BasicBlock header = newBlock();
            link(current, header);
            header.addOperation(stmt.getVariable());
            BasicBlock bodyStart = newBlock();
            header.setConditional(bodyStart);

            JumpTarget target = new JumpTarget(label, true, true, header);
            jumpTargets.push(target);
            current = bodyStart;
            buildStatement(stmt.getBody());
            link(current, header);
            jumpTargets.pop();
            popRegion();

            finishLoop(header, target, true);
        }

        private void finishLoop(BasicBlock condition, JumpTarget target, boolean canFinish) {
            BasicBlock after = newBlock();
            if (canFinish) {
                condition.setFallThrough(after);
            }
            for (BasicBlock source : target.breakSources) {
                link(source, after);
            }
            current = after;
        }

        private void buildSwitch(SwitchStmt stmt) {
            String label = takePendingLabel();
            current.addOperation(stmt.getSelector());
            List<SwitchEntry> entries = stmt.getEntries();
            List<BasicBlock> entryBlocks = new ArrayList<>();
            for (int i = 0; i < entries.size(); i++) {
                entryBlocks.add(newBlock());
            }

            BasicBlock dispatch = current;
            BasicBlock defaultBlock = null;
            for (int i = 0; i < entries.size(); i++) {
                SwitchEntry entry = entries.get(i);
                if (entry.getLabels().isEmpty()) {
                    defaultBlock = entryBlocks.get(i);
                    continue;
                }
                dispatch.setConditional(entryBlocks.get(i));
                BasicBlock next = newBlock();
                dispatch.setFallThrough(next);
                dispatch = next;
            }

            JumpTarget target = new JumpTarget(label, false, true, null);
            jumpTargets.push(target);
            for (int i = 0; i < entries.size(); i++) {
                SwitchEntry entry = entries.get(i);
                current = entryBlocks.get(i);
                for (Statement s : entry.getStatements()) {
                    buildStatement(s);
                }
                boolean fallsIntoNext = entry.getType() == SwitchEntry.Type.STATEMENT_GROUP && i + 1 < entries.size();
                if (fallsIntoNext) {
                    link(current, entryBlocks.get(i + 1));
                } else {
                    target.breakSources.add(current);
                }
            }
            jumpTargets.pop();

            BasicBlock after = newBlock();
            link(dispatch, defaultBlock != null ? defaultBlock : after);
            for (BasicBlock source : target.breakSources) {
                link(source, after);
            }
            current = after;
        }

        private void buildTry(TryStmt stmt) {
            List<CatchClause> catches = stmt.getCatchClauses();
            pushRegion(RegionKind.TRY, stmt);
            BasicBlock tryStart = newBlock();
            link(current, tryStart);
            BasicBlock dispatch = null;
            if (!catches.isEmpty()) {
                dispatch = newBlock();
                tryStart.setConditional(dispatch);
            }
            BasicBlock body = newBlock();
            tryStart.setFallThrough(body);
            current = body;
            stmt.getResources().forEach(current::addOperation);

            if (dispatch != null) {
                handlers.push(dispatch);
            }
            buildStatement(stmt.getTryBlock());
            if (dispatch != null) {
                handlers.pop();
            }
            List<BasicBlock> ends = new ArrayList<>();
            ends.add(current);
            popRegion();

            if (dispatch != null) {
                List<BasicBlock> catchEntries = new ArrayList<>();
                for (CatchClause clause : catches) {
                    pushRegion(RegionKind.CATCH, clause);
                    BasicBlock entry = newBlock();
                    entry.addOperation(clause.getParameter());
                    catchEntries.add(entry);
                    current = entry;
                    buildStatement(clause.getBody());
                    ends.add(current);
                    popRegion();
                }
                wireDispatch(dispatch, catchEntries);
            }

            Optional<BlockStmt> finallyBlock = stmt.getFinallyBlock();
            if (finallyBlock.isPresent()) {
                pushRegion(RegionKind.FINALLY, finallyBlock.get());
                BasicBlock finallyStart = newBlock();
                for (BasicBlock end : ends) {
                    link(end, finallyStart);
                }
                current = finallyStart;
                buildStatement(finallyBlock.get());
                BasicBlock finallyEnd = current;
                popRegion();
                BasicBlock after = newBlock();
                link(finallyEnd, after);
                current = after;
            } else {
                BasicBlock after = newBlock();
                for (BasicBlock end : ends) {
                    link(end, after);
                }
                current = after;
            }
        }

        /**
         * Chain the catch clauses so each dispatch block has two successors:
         * its clause and the next test. The last clause takes the fall-through.
         */
        private void wireDispatch(BasicBlock dispatch, List<BasicBlock> catchEntries) {
            BasicBlock test = dispatch;
            for (int i = 0; i < catchEntries.size() - 1; i++) {
                test.setConditional(catchEntries.get(i));
                BasicBlock next = newBlock();
                test.setFallThrough(next);
                test = next;
            }
            test.setFallThrough(catchEntries.get(catchEntries.size() - 1));
        }

        private void buildBreak(BreakStmt stmt) {
            current.addOperation(stmt);
            JumpTarget target = stmt.getLabel()
                    .map(label -> findLabeled(label.asString()))
                    .orElseGet(() -> findInnermost(t -> t.breakable, "break outside a loop or switch"));
            target.breakSources.add(current);
            startUnreachable();
        }

        private void buildContinue(ContinueStmt stmt) {
            current.addOperation(stmt);
            JumpTarget target = stmt.getLabel()
                    .map(label -> findLabeled(label.asString()))
                    .orElseGet(() -> findInnermost(t -> t.loop, "continue outside a loop"));
            if (target.continueTarget == null) {
                throw new UnsupportedConstructException("continue to a label that is not a loop");
            }
            link(current, target.continueTarget);
            startUnreachable();
        }

        private void buildLabeled(LabeledStmt stmt) {
            String label = stmt.getLabel().asString();
            Statement inner = stmt.getStatement();
            if (inner instanceof WhileStmt || inner instanceof DoStmt || inner instanceof ForStmt
                    || inner instanceof ForEachStmt || inner instanceof SwitchStmt) {
                pendingLabel = label;
                buildStatement(inner);
                return;
            }
            JumpTarget target = new JumpTarget(label, false, false, null);
            jumpTargets.push(target);
            buildStatement(inner);
            jumpTargets.pop();
            BasicBlock after = newBlock();
            link(current, after);
            for (BasicBlock source : target.breakSources) {
                link(source, after);
            }
            current = after;
        }

        private JumpTarget findLabeled(String label) {
            for (JumpTarget target : jumpTargets) {
                if (label.equals(target.label)) {
                    return target;
                }
            }
            throw new UnsupportedConstructException("unresolved label " + label);
        }

        private JumpTarget findInnermost(Predicate<JumpTarget> accepts, String failure) {
            for (JumpTarget target : jumpTargets) {
                if (accepts.test(target)) {
                    return target;
                }
            }
            throw new UnsupportedConstructException(failure);
        }

        private static boolean isConstantTrue(Expression condition) {
            Expression e = condition;
            while (e instanceof EnclosedExpr enclosed) {
                e = enclosed.getInner();
            }
            return e instanceof BooleanLiteralExpr literal && literal.getValue();
        }
    }
}
