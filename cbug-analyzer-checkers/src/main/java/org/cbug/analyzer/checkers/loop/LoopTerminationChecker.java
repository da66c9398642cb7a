package org.cbug.analyzer.checkers.loop;

import org.cbug.analyzer.checkers.Checker;
import org.cbug.analyzer.common.Category;
import org.cbug.analyzer.common.Issue;
import org.cbug.analyzer.common.Severity;
import org.cbug.analyzer.common.Suggestion;
import org.cbug.analyzer.prepwork.AnalysisContext;
import org.cbug.analyzer.prepwork.cfg.*;
import org.cbug.analyzer.syntax.ConstantFolder;
import org.cbug.analyzer.syntax.Symbol;
import org.cbug.analyzer.syntax.expression.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Flags loops that cannot terminate, one issue per loop region at most. The rules are tried in order and
 * the first one that matches decides:
 * <ol>
 *     <li>no condition, or a constant true one, and no way out of the body (definite);</li>
 *     <li>none of the condition's variables is written in the body (definite);</li>
 *     <li>an integral {@code var OP bound} whose constant steps move away from the bound, or never land on it;</li>
 *     <li>a floating {@code var != bound} advanced by steps that cannot hit the bound exactly;</li>
 *     <li>a {@code continue} that returns to the header before any write to the condition's variables.</li>
 * </ol>
 * Rules 2 to 5 are only tried when the condition is side-effect free, reads only locals and parameters,
 * and its false edge is the only way out of the loop.
 */
public class LoopTerminationChecker implements Checker {
    private static final Logger LOGGER = LoggerFactory.getLogger(LoopTerminationChecker.class);

    @Override
    public String name() {
        return "loop-termination";
    }

    @Override
    public List<Issue> run(AnalysisContext context) {
        List<Issue> issues = new ArrayList<>();
        for (ControlFlowGraph cfg : context.cfgs()) {
            for (LoopRegion region : cfg.loopRegions()) {
                if (!region.isCyclic() || !cfg.isReachable(region.header())) continue;
                Finding finding = check(cfg, region);
                if (finding != null) {
                    LOGGER.debug("Loop at line {} of {}: {}", region.statement().location().line(),
                            cfg.function().name(), finding.reason);
                    issues.add(finding.toIssue(region));
                }
            }
        }
        return issues;
    }

    private record Finding(boolean definite, String reason, Suggestion suggestion) {
        Issue toIssue(LoopRegion region) {
            String message = (definite ? "Infinite loop: " : "Possible infinite loop: ") + reason;
            return new Issue(Category.INFINITE_LOOP, Severity.WARNING, message, region.statement().location(),
                    suggestion);
        }
    }

    private static final Suggestion ADD_EXIT = new Suggestion("Add an exit",
            "Make sure the loop body contains a reachable break, return or exit call.");
    private static final Suggestion UPDATE_VARIABLE = new Suggestion("Update the loop variable",
            "Change the variables of the loop condition inside the body so that the condition becomes false.");
    private static final Suggestion CHECK_DIRECTION = new Suggestion("Check the loop direction",
            "Make the step of the loop variable move towards the bound of the condition.");
    private static final Suggestion USE_ORDERING = new Suggestion("Compare with an ordering",
            "Use '<' or '>' instead of an exact comparison, so that the loop cannot step past its bound.");
    private static final Suggestion ADVANCE_BEFORE_CONTINUE = new Suggestion("Advance before continue",
            "Update the loop variable before the continue statement.");

    Finding check(ControlFlowGraph cfg, LoopRegion region) {
        Expression condition = region.condition();
        Map<Symbol, Number> start = startValues(cfg, region);

        Boolean constant = condition == null ? Boolean.TRUE : ConstantFolder.truthValue(condition);
        if (Boolean.TRUE.equals(constant)) {
            return alwaysTrue(cfg, region, start);
        }
        if (constant != null || !isSimple(condition) || !onlyExitIsCondition(region)) return null;

        // rule 2
        if (region.writes().isEmpty()) {
            return new Finding(true, "none of the variables of '" + condition + "' changes inside the loop",
                    UPDATE_VARIABLE);
        }
        Comparison comparison = Comparison.of(condition);
        if (comparison != null) {
            Finding finding = comparison.variable().type().isFloating()
                    ? floatingStep(region, comparison, start)
                    : integralStep(region, comparison, start);
            if (finding != null) return finding;
        }
        return continueBeforeUpdate(region);
    }

    // rule 1
    private Finding alwaysTrue(ControlFlowGraph cfg, LoopRegion region, Map<Symbol, Number> start) {
        if (region.body().stream().anyMatch(n -> n.isProgramExit() && cfg.isReachable(n))) return null;
        List<CFGEdge> exits = region.exitEdges().stream().filter(e -> cfg.isReachable(e.source())).toList();
        if (exits.isEmpty()) {
            return new Finding(true, "the condition is always true and the body has no exit", ADD_EXIT);
        }
        for (CFGEdge exit : exits) {
            Expression guard = exit.source().branchCondition();
            if (guard == null || !isSimple(guard) || !usesOnlyLocals(guard)) return null;
            Comparison comparison = Comparison.of(guard);
            if (comparison == null) return null;
            if (exit.kind() == EdgeKind.FALSE_BRANCH) comparison = comparison.negate();
            else if (exit.kind() != EdgeKind.TRUE_BRANCH) return null;
            if (!neverHolds(region, comparison, start)) return null;
        }
        return new Finding(false, "the condition is always true and no exit condition can become true",
                ADD_EXIT);
    }

    /*
    the comparison is false on entry, and every step moves the variable further away from making it true
     */
    private static boolean neverHolds(LoopRegion region, Comparison comparison, Map<Symbol, Number> start) {
        Number initial = start.get(comparison.variable());
        Number bound = boundValue(region, comparison, start);
        List<Number> steps = steps(region, comparison.variable());
        if (initial == null || bound == null || steps == null || steps.isEmpty()) return false;
        if (Comparison.holds(comparison.operator(), initial, bound)) return false;
        int direction = direction(steps);
        return switch (comparison.operator()) {
            case LESS, LESS_EQUALS -> direction > 0;
            case GREATER, GREATER_EQUALS -> direction < 0;
            default -> false;
        };
    }

    // rule 3
    private static Finding integralStep(LoopRegion region, Comparison comparison, Map<Symbol, Number> start) {
        Symbol variable = comparison.variable();
        Number bound = boundValue(region, comparison, start);
        if (variable.type().isUnsigned() && comparison.operator() == BinaryOperator.GREATER_EQUALS
            && bound != null && ConstantFolder.isZero(bound)) {
            return new Finding(false, "unsigned '" + variable.name() + "' is always >= 0", CHECK_DIRECTION);
        }
        List<Number> steps = steps(region, variable);
        if (steps == null || steps.isEmpty() || bound == null) return null;
        Number initial = start.get(variable);
        if (initial != null && !Comparison.holds(comparison.operator(), initial, bound)) {
            return null;
        }
        int direction = direction(steps);
        switch (comparison.operator()) {
            case LESS, LESS_EQUALS:
                if (direction < 0) return movesAway(comparison);
                return null;
            case GREATER, GREATER_EQUALS:
                if (direction > 0) return movesAway(comparison);
                return null;
            case NOT_EQUALS:
                Long step = singleStep(steps);
                if (initial == null || step == null || initial.longValue() == bound.longValue()) return null;
                long gap = bound.longValue() - initial.longValue();
                if (gap % step != 0 || gap / step < 0) {
                    return new Finding(false, "'" + variable.name() + "' starts at " + initial + " and moves by "
                                              + step + ", so it never equals " + bound, USE_ORDERING);
                }
                return null;
            default:
                return null;
        }
    }

    private static Finding movesAway(Comparison comparison) {
        return new Finding(false, "'" + comparison.variable().name() + "' moves away from the bound of '"
                                  + comparison + "'", CHECK_DIRECTION);
    }

    // rule 4
    private static Finding floatingStep(LoopRegion region, Comparison comparison, Map<Symbol, Number> start) {
        if (comparison.operator() != BinaryOperator.NOT_EQUALS) return null;
        List<Number> steps = steps(region, comparison.variable());
        if (steps == null || steps.isEmpty()) return null;
        double step = steps.get(0).doubleValue();
        if (steps.stream().anyMatch(s -> s.doubleValue() != step) || step == 0.0) return null;
        String name = comparison.variable().name();
        if (!isExact(step)) {
            return new Finding(false, "floating point '" + name + "' is compared exactly after steps of " + step
                                      + ", which are not exactly representable", USE_ORDERING);
        }
        Number initial = start.get(comparison.variable());
        Number bound = boundValue(region, comparison, start);
        if (initial == null || bound == null) return null;
        double count = (bound.doubleValue() - initial.doubleValue()) / step;
        if (count < 0 || count != Math.rint(count)) {
            return new Finding(false, "floating point '" + name + "' never equals " + bound + " when stepping by "
                                      + step + " from " + initial, USE_ORDERING);
        }
        return null;
    }

    private static boolean isExact(double d) {
        double scaled = Math.scalb(d, 30);
        return scaled == Math.rint(scaled);
    }

    /*
    rule 5: a path from the body entry back to the header that takes a continue edge and passes no write to the
    condition's variables. Conditions along the path may only read those variables, so the same path is taken again.
     */
    private static Finding continueBeforeUpdate(LoopRegion region) {
        CFGNode bodyEntry = region.bodyEntry();
        if (bodyEntry == null || bodyEntry == region.header()) return null;
        Set<CFGNode> writing = new HashSet<>();
        region.writes().forEach(w -> writing.add(w.node()));
        record State(CFGNode node, boolean viaContinue) {
        }
        Set<State> seen = new HashSet<>();
        Deque<State> stack = new ArrayDeque<>();
        stack.push(new State(bodyEntry, false));
        while (!stack.isEmpty()) {
            State state = stack.pop();
            CFGNode node = state.node();
            if (writing.contains(node) || !seen.add(state)) continue;
            if (node.kind() == CFGNode.Kind.SWITCH || node.kind() == CFGNode.Kind.UNKNOWN_EFFECT) continue;
            Expression guard = node.branchCondition();
            if (guard != null && (!isSimple(guard) || !readsOnly(guard, region.conditionVariables()))) continue;
            for (CFGEdge edge : node.successors()) {
                boolean viaContinue = state.viaContinue() || edge.kind() == EdgeKind.CONTINUE;
                if (edge.target() == region.header()) {
                    if (viaContinue) {
                        return new Finding(false, "a continue returns to the loop condition before '"
                                                  + region.condition() + "' can change", ADVANCE_BEFORE_CONTINUE);
                    }
                } else if (region.contains(edge.target())) {
                    stack.push(new State(edge.target(), viaContinue));
                }
            }
        }
        return null;
    }

    // ---------------------------------------------------------------------------------------------------------

    /*
    the constant step of every write to the variable inside the body, or null when one of the writes is not
    a constant step
     */
    private static List<Number> steps(LoopRegion region, Symbol variable) {
        List<Number> steps = new ArrayList<>();
        boolean[] other = new boolean[1];
        for (CFGNode node : region.body()) {
            for (CFGElement element : node.elements()) {
                if (element instanceof DeclarationElement de && de.symbol().equals(variable)) return null;
                for (Expression expression : element.expressions()) {
                    expression.visit(e -> {
                        if (variable.equals(ComputeLoopRegions.writtenVariable(e))) {
                            Number step = step(e, variable);
                            if (step == null) other[0] = true;
                            else steps.add(step);
                        }
                        return true;
                    });
                }
            }
        }
        return other[0] ? null : steps;
    }

    static Number step(Expression write, Symbol variable) {
        if (write instanceof UnaryExpression ue && ue.operator().isIncrementOrDecrement()) {
            return ue.operator().isIncrement() ? 1L : -1L;
        }
        if (write instanceof AssignmentExpression ae) {
            if (ae.compoundOperator() == BinaryOperator.ADD) return ConstantFolder.fold(ae.value());
            if (ae.compoundOperator() == BinaryOperator.SUBTRACT) return negate(ConstantFolder.fold(ae.value()));
            if (ae.isPlain() && ae.value().withoutCasts() instanceof BinaryExpression be) {
                boolean lhsIsVariable = isVariable(be.lhs(), variable);
                if (be.operator() == BinaryOperator.ADD) {
                    if (lhsIsVariable) return ConstantFolder.fold(be.rhs());
                    if (isVariable(be.rhs(), variable)) return ConstantFolder.fold(be.lhs());
                }
                if (be.operator() == BinaryOperator.SUBTRACT && lhsIsVariable) {
                    return negate(ConstantFolder.fold(be.rhs()));
                }
            }
        }
        return null;
    }

    // variables written inside the loop have no known value in the bound
    private static Number boundValue(LoopRegion region, Comparison comparison, Map<Symbol, Number> start) {
        return comparison.boundValue(s -> {
            List<Number> steps = steps(region, s);
            return steps != null && steps.isEmpty() ? start.get(s) : null;
        });
    }

    private static boolean isVariable(Expression expression, Symbol variable) {
        return expression.withoutCasts() instanceof VariableExpression ve && ve.symbol().equals(variable);
    }

    private static Number negate(Number n) {
        if (n == null) return null;
        return n instanceof Double d ? (Number) (-d) : (Number) (-n.longValue());
    }

    // 1 when all steps increase, -1 when all decrease, 0 otherwise
    private static int direction(List<Number> steps) {
        boolean up = steps.stream().allMatch(s -> s.doubleValue() > 0);
        boolean down = steps.stream().allMatch(s -> s.doubleValue() < 0);
        return up ? 1 : down ? -1 : 0;
    }

    private static Long singleStep(List<Number> steps) {
        if (steps.stream().anyMatch(s -> s instanceof Double)) return null;
        long first = steps.get(0).longValue();
        if (first == 0 || steps.stream().anyMatch(s -> s.longValue() != first)) return null;
        return first;
    }

    /*
    constant values of variables, as left by the node that enters the loop
     */
    static Map<Symbol, Number> startValues(ControlFlowGraph cfg, LoopRegion region) {
        List<CFGEdge> entering = region.header().predecessors().stream()
                .filter(e -> !region.contains(e.source()) && cfg.isReachable(e.source()))
                .toList();
        Map<Symbol, Number> values = new HashMap<>();
        if (entering.size() != 1) return values;
        Set<Symbol> decided = new HashSet<>();
        List<CFGElement> elements = entering.get(0).source().elements();
        for (int i = elements.size() - 1; i >= 0; i--) {
            CFGElement element = elements.get(i);
            if (element instanceof DeclarationElement de && decided.add(de.symbol())) {
                Number n = de.initializer() == null ? null : ConstantFolder.fold(de.initializer());
                if (n != null) values.put(de.symbol(), n);
            } else if (element instanceof ExpressionElement ee) {
                ee.expression().visit(e -> {
                    Symbol written = ComputeLoopRegions.writtenVariable(e);
                    if (written != null && decided.add(written) && e instanceof AssignmentExpression ae
                        && ae.isPlain()) {
                        Number n = ConstantFolder.fold(ae.value());
                        if (n != null) values.put(written, n);
                    }
                    return true;
                });
            }
        }
        return values;
    }

    private static boolean onlyExitIsCondition(LoopRegion region) {
        if (region.containsProgramExit() || region.exitEdges().size() != 1) return false;
        CFGEdge exit = region.exitEdges().get(0);
        return exit.source() == region.conditionNode() && exit.kind() == EdgeKind.FALSE_BRANCH;
    }

    /*
    variables, literals, arithmetic, comparisons and casts only
     */
    static boolean isSimple(Expression expression) {
        return expression.stream().allMatch(e -> e instanceof VariableExpression
                                                 || e instanceof IntegerLiteral
                                                 || e instanceof FloatingLiteral
                                                 || e instanceof NullLiteral
                                                 || e instanceof SizeofExpression
                                                 || e instanceof CastExpression
                                                 || e instanceof BinaryExpression
                                                 || e instanceof UnaryExpression ue
                                                    && !ue.operator().isIncrementOrDecrement()
                                                    && ue.operator() != UnaryOperator.DEREFERENCE
                                                    && ue.operator() != UnaryOperator.ADDRESS_OF)
               && usesOnlyLocals(expression);
    }

    private static boolean usesOnlyLocals(Expression expression) {
        return expression.stream().noneMatch(e -> e instanceof VariableExpression ve
                                                  && ve.symbol().storage().outlivesFunction());
    }

    private static boolean readsOnly(Expression expression, Set<Symbol> variables) {
        return expression.stream().allMatch(e -> !(e instanceof VariableExpression ve)
                                                 || variables.contains(ve.symbol()));
    }
}
