package org.cbug.analyzer.checkers.syntactic;

import org.cbug.analyzer.checkers.Checker;
import org.cbug.analyzer.common.Category;
import org.cbug.analyzer.common.Issue;
import org.cbug.analyzer.common.Severity;
import org.cbug.analyzer.common.Suggestion;
import org.cbug.analyzer.prepwork.AnalysisContext;
import org.cbug.analyzer.prepwork.cfg.*;
import org.cbug.analyzer.prepwork.lattice.DataflowResult;
import org.cbug.analyzer.prepwork.lattice.Lattice;
import org.cbug.analyzer.prepwork.lattice.TransferFunction;
import org.cbug.analyzer.prepwork.lattice.WorklistSolver;
import org.cbug.analyzer.syntax.ConstantFolder;
import org.cbug.analyzer.syntax.StorageKind;
import org.cbug.analyzer.syntax.Symbol;
import org.cbug.analyzer.syntax.expression.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.Function;

/*
'/', '%', '/=' and '%=' whose divisor is zero on every path. Literals fold directly; integral locals and
parameters whose address is never taken are followed with a constant propagation over the control flow graph.
 */
public class DivisionByZeroChecker implements Checker {
    private static final Logger LOGGER = LoggerFactory.getLogger(DivisionByZeroChecker.class);

    @Override
    public String name() {
        return "division-by-zero";
    }

    @Override
    public List<Issue> run(AnalysisContext context) {
        List<Issue> issues = new ArrayList<>();
        for (ControlFlowGraph cfg : context.cfgs()) {
            issues.addAll(doFunction(context, cfg));
        }
        return issues;
    }

    private static class ConstantLattice implements Lattice<ConstantFact> {
        @Override
        public ConstantFact top() {
            return ConstantFact.EMPTY;
        }

        @Override
        public ConstantFact join(ConstantFact f1, ConstantFact f2) {
            return f1.join(f2);
        }
    }

    List<Issue> doFunction(AnalysisContext context, ControlFlowGraph cfg) {
        ConstantTransfer transfer = new ConstantTransfer(addressTaken(cfg));
        WorklistSolver<ConstantFact> solver = new WorklistSolver<>(new ConstantLattice(), transfer,
                context.maxIterationsPerNode());
        ConstantFact entry = ConstantFact.EMPTY;
        for (Symbol parameter : cfg.function().parameters()) {
            if (transfer.tracked(parameter)) entry = entry.with(parameter, null);
        }
        DataflowResult<ConstantFact> result = solver.solve(cfg, entry);
        List<Issue> issues = new ArrayList<>();
        for (CFGNode node : cfg.nodes()) {
            if (result.isReached(node)) transfer.replay(node, result.entryFact(node), issues);
        }
        LOGGER.debug("Division by zero in {}: {} issue(s)", cfg.function().name(), issues.size());
        return issues;
    }

    private static Set<Symbol> addressTaken(ControlFlowGraph cfg) {
        Set<Symbol> set = new HashSet<>();
        cfg.elements().forEach(element -> element.expressions().forEach(expression -> expression.visit(e -> {
            if (e instanceof UnaryExpression ue && ue.operator() == UnaryOperator.ADDRESS_OF
                && ue.operand().withoutCasts() instanceof VariableExpression ve) {
                set.add(ve.symbol());
            }
            return true;
        })));
        return set;
    }

    private static class ConstantTransfer implements TransferFunction<ConstantFact> {
        private final Set<Symbol> addressTaken;

        ConstantTransfer(Set<Symbol> addressTaken) {
            this.addressTaken = addressTaken;
        }

        boolean tracked(Symbol symbol) {
            return symbol.type().isIntegral()
                   && (symbol.storage() == StorageKind.LOCAL || symbol.storage() == StorageKind.PARAMETER)
                   && !addressTaken.contains(symbol);
        }

        @Override
        public ConstantFact apply(CFGNode node, ConstantFact entry) {
            Walker walker = new Walker(entry, null);
            node.elements().forEach(walker::element);
            return walker.fact;
        }

        void replay(CFGNode node, ConstantFact entry, List<Issue> issues) {
            Walker walker = new Walker(entry, issues);
            node.elements().forEach(walker::element);
        }

        private class Walker {
            private ConstantFact fact;
            // null while solving
            private final List<Issue> issues;
            private final Function<Symbol, Number> environment = s -> tracked(s) ? fact.get(s) : null;

            Walker(ConstantFact fact, List<Issue> issues) {
                this.fact = fact;
                this.issues = issues;
            }

            void element(CFGElement element) {
                if (element instanceof DeclarationElement de) {
                    if (de.initializer() != null) eval(de.initializer());
                    if (tracked(de.symbol())) {
                        fact = fact.with(de.symbol(), de.initializer() == null ? null : constant(de.initializer()));
                    }
                } else if (element instanceof UnknownEffectElement ue) {
                    if (ue.touchesEverything()) {
                        fact = fact.forgetAll();
                    } else {
                        ue.expressions().forEach(e -> e.visit(sub -> {
                            if (sub instanceof VariableExpression ve && tracked(ve.symbol())) {
                                fact = fact.with(ve.symbol(), null);
                            }
                            return true;
                        }));
                    }
                } else {
                    element.expressions().forEach(this::eval);
                }
            }

            private Long constant(Expression expression) {
                return ConstantFolder.fold(expression, environment) instanceof Long l ? l : null;
            }

            private void eval(Expression expression) {
                if (expression instanceof SizeofExpression) return;
                if (expression instanceof AssignmentExpression ae) {
                    if (!(ae.target().withoutCasts() instanceof VariableExpression)) eval(ae.target());
                    eval(ae.value());
                    if (!ae.isPlain() && ae.compoundOperator().isDivision()) checkDivisor(ae.value(), ae);
                    if (ae.target().withoutCasts() instanceof VariableExpression ve && tracked(ve.symbol())) {
                        Long value = ae.isPlain() ? constant(ae.value())
                                : constant(new BinaryExpression(ae.compoundOperator(), ae.target(), ae.value(),
                                ae.type(), ae.location()));
                        fact = fact.with(ve.symbol(), value);
                    }
                } else if (expression instanceof UnaryExpression ue && ue.operator().isIncrementOrDecrement()) {
                    eval(ue.operand());
                    if (ue.operand().withoutCasts() instanceof VariableExpression ve && tracked(ve.symbol())) {
                        Long value = fact.get(ve.symbol());
                        fact = fact.with(ve.symbol(), value == null ? null
                                : ue.operator().isIncrement() ? value + 1 : value - 1);
                    }
                } else if (expression instanceof BinaryExpression be && be.operator().isLogical()) {
                    eval(be.lhs());
                    ConstantFact afterLhs = fact;
                    eval(be.rhs());
                    fact = afterLhs.join(fact);
                } else if (expression instanceof ConditionalExpression ce) {
                    eval(ce.condition());
                    ConstantFact afterCondition = fact;
                    eval(ce.ifTrue());
                    ConstantFact afterTrue = fact;
                    fact = afterCondition;
                    eval(ce.ifFalse());
                    fact = afterTrue.join(fact);
                } else {
                    expression.subExpressions().forEach(this::eval);
                    if (expression instanceof BinaryExpression be && be.operator().isDivision()) {
                        checkDivisor(be.rhs(), be);
                    }
                }
            }

            private void checkDivisor(Expression divisor, Expression division) {
                Number n = ConstantFolder.fold(divisor, environment);
                if (n == null || !ConstantFolder.isZero(n) || issues == null) return;
                boolean literal = ConstantFolder.fold(divisor) != null;
                String message = literal
                        ? "Division by zero in '" + division + "'"
                        : "Division by zero in '" + division + "': '" + divisor + "' is always 0 here";
                issues.add(new Issue(Category.DIVISION_BY_ZERO, Severity.ERROR, message, division.location(),
                        new Suggestion("Check the divisor", "Test the divisor against 0 before dividing.")));
            }
        }
    }
}
