package com.raditha.release.analysis;

import com.github.javaparser.ast.Node;
import com.github.javaparser.ast.expr.ConditionalExpr;
import com.github.javaparser.ast.expr.Expression;
import com.github.javaparser.ast.expr.LambdaExpr;
import com.github.javaparser.ast.expr.MethodCallExpr;
import com.github.javaparser.ast.expr.SwitchExpr;
import com.github.javaparser.ast.stmt.BlockStmt;
import com.github.javaparser.ast.stmt.ExpressionStmt;
import com.github.javaparser.ast.stmt.ReturnStmt;
import com.github.javaparser.ast.stmt.Statement;
import com.github.javaparser.ast.stmt.SwitchEntry;
import com.github.javaparser.ast.stmt.ThrowStmt;
import com.github.javaparser.ast.stmt.YieldStmt;
import com.raditha.release.cfg.BasicBlock;
import com.raditha.release.cfg.ControlFlowGraph;
import com.raditha.release.model.AbortSignal;
import com.raditha.release.model.Procedure;
import com.raditha.release.model.TrackedVariable;
import com.raditha.release.resolve.ResolutionContext;
import com.raditha.release.util.ASTUtility;
import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.List;

/**
 * Decides whether a procedure hands its variable back to the caller on every
 * explicit exit.
 * <p>
 * Each returned value is classified by one recursive function over
 * {@link ExitValueShape}. A value either transfers the variable, terminates
 * abnormally (a throwing arm), or keeps the variable in this procedure. A
 * composite value transfers when at least one part transfers and every other
 * part terminates.
 */
public class OwnershipTransferResolver {

    private enum Outcome {
        TRANSFERS,
        TERMINATES,
        RETAINS
    }

    /**
     * True when at least one value-returning exit exists and all of them
     * return the variable.
     *
     * @param cfg the procedure's graph; when null, or when the context is
     *            semantic, exits are found on the syntax tree instead
     */
    public boolean isOwnershipTransferred(Procedure procedure, TrackedVariable variable, ResolutionContext context,
                                          @Nullable ControlFlowGraph cfg, AbortSignal abort) {
        List<ReturnStmt> exits = context.isSemantic() || cfg == null
                ? syntacticExits(procedure)
                : graphExits(cfg, abort);
        if (exits.isEmpty()) {
            return procedure.expressionBody().map(body -> transfers(body, variable, context)).orElse(false);
        }
        for (ReturnStmt exit : exits) {
            abort.throwIfAborted();
            if (!returnsVariable(exit, variable, context)) {
                return false;
            }
        }
        return true;
    }

    /**
     * True when this return statement hands the variable to the caller.
     */
    public boolean returnsVariable(ReturnStmt exit, TrackedVariable variable, ResolutionContext context) {
        return exit.getExpression().map(value -> transfers(value, variable, context)).orElse(false);
    }

    /**
     * True when the value, with every terminating branch removed, is the variable.
     */
    public boolean transfers(Expression value, TrackedVariable variable, ResolutionContext context) {
        return classify(value, variable, context) == Outcome.TRANSFERS;
    }

    /**
     * Return statements with a value that belong to this procedure.
     */
    List<ReturnStmt> syntacticExits(Procedure procedure) {
        return ASTUtility.findOutsideClosures(procedure.declaration(), ReturnStmt.class).stream()
                .filter(r -> r.getExpression().isPresent())
                .toList();
    }

    List<ReturnStmt> graphExits(ControlFlowGraph cfg, AbortSignal abort) {
        List<ReturnStmt> exits = new ArrayList<>();
        for (BasicBlock block : cfg.blocks()) {
            abort.throwIfAborted();
            for (Node op : block.operations()) {
                if (op instanceof ReturnStmt ret && ret.getExpression().isPresent()) {
                    exits.add(ret);
                }
            }
        }
        return exits;
    }

    private Outcome classify(Expression value, TrackedVariable variable, ResolutionContext context) {
        return switch (ExitValueShape.of(value)) {
            case REFERENCE -> context.refersTo(value, variable) ? Outcome.TRANSFERS : Outcome.RETAINS;
            case WRAPPER -> classify(ExitValueShape.unwrapOnce(value), variable, context);
            case CONDITIONAL -> {
                ConditionalExpr conditional = value.asConditionalExpr();
                yield combine(List.of(
                        classify(conditional.getThenExpr(), variable, context),
                        classify(conditional.getElseExpr(), variable, context)));
            }
            case COALESCE -> classifyCoalesce(value.asMethodCallExpr(), variable, context);
            case SWITCH -> classifySwitch(value.asSwitchExpr(), variable, context);
            case OTHER -> Outcome.RETAINS;
        };
    }

    /**
     * The left operand must transfer. The fallback may transfer or terminate.
     */
    private Outcome classifyCoalesce(MethodCallExpr call, TrackedVariable variable, ResolutionContext context) {
        Expression left = ExitValueShape.coalescedValue(call).orElseThrow();
        if (classify(left, variable, context) != Outcome.TRANSFERS) {
            return Outcome.RETAINS;
        }
        Outcome fallback = switch (call.getNameAsString()) {
            case "orElseThrow" -> Outcome.TERMINATES;
            case "orElse", "requireNonNullElse" -> classify(call.getArgument(call.getArguments().size() - 1),
                    variable, context);
            default -> classifySupplier(call.getArgument(call.getArguments().size() - 1), variable, context);
        };
        return fallback == Outcome.RETAINS ? Outcome.RETAINS : Outcome.TRANSFERS;
    }

    private Outcome classifySupplier(Expression supplier, TrackedVariable variable, ResolutionContext context) {
        if (!(supplier instanceof LambdaExpr lambda)) {
            return Outcome.RETAINS;
        }
        if (lambda.getExpressionBody().isPresent()) {
            return classify(lambda.getExpressionBody().get(), variable, context);
        }
        BlockStmt body = lambda.getBody().asBlockStmt();
        List<Outcome> outcomes = new ArrayList<>();
        for (ReturnStmt ret : ASTUtility.findOutsideClosures(lambda, ReturnStmt.class)) {
            outcomes.add(ret.getExpression().map(v -> classify(v, variable, context)).orElse(Outcome.RETAINS));
        }
        if (outcomes.isEmpty()) {
            return endsWithThrow(body.getStatements()) ? Outcome.TERMINATES : Outcome.RETAINS;
        }
        return combine(outcomes);
    }

    private Outcome classifySwitch(SwitchExpr switchExpr, TrackedVariable variable, ResolutionContext context) {
        List<Outcome> outcomes = new ArrayList<>();
        for (SwitchEntry entry : switchExpr.getEntries()) {
            outcomes.add(classifyArm(entry, switchExpr, variable, context));
        }
        return outcomes.isEmpty() ? Outcome.RETAINS : combine(outcomes);
    }

    /**
     * An arm is an expression, a throw, or statements that yield.
     */
    private Outcome classifyArm(SwitchEntry entry, SwitchExpr owner, TrackedVariable variable,
                                ResolutionContext context) {
        List<Statement> statements = entry.getStatements();
        if (entry.getType() == SwitchEntry.Type.EXPRESSION && statements.size() == 1
                && statements.get(0) instanceof ExpressionStmt arm) {
            return classify(arm.getExpression(), variable, context);
        }
        if (entry.getType() == SwitchEntry.Type.THROWS_STATEMENT) {
            return Outcome.TERMINATES;
        }
        List<Outcome> outcomes = new ArrayList<>();
        for (Statement statement : statements) {
            for (YieldStmt yield : ASTUtility.findOutsideClosures(statement, YieldStmt.class)) {
                if (ASTUtility.nearestAncestor(yield, SwitchExpr.class).orElse(null) == owner) {
                    outcomes.add(classify(yield.getExpression(), variable, context));
                }
            }
        }
        if (outcomes.isEmpty()) {
            return endsWithThrow(statements) ? Outcome.TERMINATES : Outcome.RETAINS;
        }
        return combine(outcomes);
    }

    private static boolean endsWithThrow(List<Statement> statements) {
        if (statements.isEmpty()) {
            return false;
        }
        Statement last = statements.get(statements.size() - 1);
        if (last instanceof BlockStmt block) {
            return endsWithThrow(block.getStatements());
        }
        return last instanceof ThrowStmt;
    }

    private static Outcome combine(List<Outcome> outcomes) {
        if (outcomes.contains(Outcome.RETAINS)) {
            return Outcome.RETAINS;
        }
        return outcomes.contains(Outcome.TRANSFERS) ? Outcome.TRANSFERS : Outcome.TERMINATES;
    }
}
