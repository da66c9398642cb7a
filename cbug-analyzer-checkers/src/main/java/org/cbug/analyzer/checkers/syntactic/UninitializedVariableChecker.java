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
import org.cbug.analyzer.syntax.StorageKind;
import org.cbug.analyzer.syntax.Symbol;
import org.cbug.analyzer.syntax.expression.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/*
reads of integral and floating locals that no path has assigned yet; pointers are left to the memory lifecycle
checker. Variables whose address is taken are not followed. One issue per variable, at its first read.
 */
public class UninitializedVariableChecker implements Checker {
    private static final Logger LOGGER = LoggerFactory.getLogger(UninitializedVariableChecker.class);

    @Override
    public String name() {
        return "uninitialized-variable";
    }

    @Override
    public List<Issue> run(AnalysisContext context) {
        List<Issue> issues = new ArrayList<>();
        for (ControlFlowGraph cfg : context.cfgs()) {
            issues.addAll(doFunction(context, cfg));
        }
        return issues;
    }

    private static class InitializationLattice implements Lattice<InitializationFact> {
        @Override
        public InitializationFact top() {
            return InitializationFact.EMPTY;
        }

        @Override
        public InitializationFact join(InitializationFact f1, InitializationFact f2) {
            return f1.join(f2);
        }
    }

    List<Issue> doFunction(AnalysisContext context, ControlFlowGraph cfg) {
        InitializationTransfer transfer = new InitializationTransfer(addressTaken(cfg));
        WorklistSolver<InitializationFact> solver = new WorklistSolver<>(new InitializationLattice(), transfer,
                context.maxIterationsPerNode());
        DataflowResult<InitializationFact> result = solver.solve(cfg, InitializationFact.EMPTY);
        Map<Symbol, Issue> firstRead = new HashMap<>();
        for (CFGNode node : cfg.nodes()) {
            if (!result.isReached(node)) continue;
            transfer.replay(node, result.entryFact(node), (symbol, issue) -> firstRead.merge(symbol, issue,
                    (i1, i2) -> i1.location().compareTo(i2.location()) <= 0 ? i1 : i2));
        }
        List<Issue> issues = firstRead.values().stream().sorted(Comparator.comparing(Issue::location)).toList();
        LOGGER.debug("Uninitialized variables in {}: {} issue(s)", cfg.function().name(), issues.size());
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

    private interface ReadSink {
        void accept(Symbol symbol, Issue issue);
    }

    private static class InitializationTransfer implements TransferFunction<InitializationFact> {
        private final Set<Symbol> addressTaken;

        InitializationTransfer(Set<Symbol> addressTaken) {
            this.addressTaken = addressTaken;
        }

        boolean tracked(Symbol symbol) {
            return symbol.storage() == StorageKind.LOCAL && symbol.type().isArithmetic()
                   && !symbol.isPointer() && !addressTaken.contains(symbol);
        }

        @Override
        public InitializationFact apply(CFGNode node, InitializationFact entry) {
            Walker walker = new Walker(entry, null);
            node.elements().forEach(walker::element);
            return walker.fact;
        }

        void replay(CFGNode node, InitializationFact entry, ReadSink sink) {
            Walker walker = new Walker(entry, sink);
            node.elements().forEach(walker::element);
        }

        private class Walker {
            private InitializationFact fact;
            // null while solving
            private final ReadSink sink;

            Walker(InitializationFact fact, ReadSink sink) {
                this.fact = fact;
                this.sink = sink;
            }

            void element(CFGElement element) {
                if (element instanceof DeclarationElement de) {
                    if (de.initializer() != null) eval(de.initializer());
                    if (tracked(de.symbol())) {
                        fact = fact.with(de.symbol(), de.initializer() == null
                                ? InitializationFact.State.UNASSIGNED : InitializationFact.State.ASSIGNED);
                    }
                } else if (element instanceof UnknownEffectElement ue) {
                    if (ue.touchesEverything()) {
                        fact = fact.assignAll();
                    } else {
                        ue.expressions().forEach(e -> e.visit(sub -> {
                            if (sub instanceof VariableExpression ve && tracked(ve.symbol())) {
                                fact = fact.with(ve.symbol(), InitializationFact.State.ASSIGNED);
                            }
                            return true;
                        }));
                    }
                } else {
                    element.expressions().forEach(this::eval);
                }
            }

            private void eval(Expression expression) {
                if (expression instanceof SizeofExpression) return;
                if (expression instanceof AssignmentExpression ae) {
                    if (ae.target().withoutCasts() instanceof VariableExpression ve) {
                        if (!ae.isPlain()) read(ve);
                        eval(ae.value());
                        if (tracked(ve.symbol())) fact = fact.with(ve.symbol(), InitializationFact.State.ASSIGNED);
                    } else {
                        eval(ae.target());
                        eval(ae.value());
                    }
                } else if (expression instanceof VariableExpression ve) {
                    read(ve);
                } else if (expression instanceof BinaryExpression be && be.operator().isLogical()) {
                    eval(be.lhs());
                    InitializationFact afterLhs = fact;
                    eval(be.rhs());
                    fact = afterLhs.join(fact);
                } else if (expression instanceof ConditionalExpression ce) {
                    eval(ce.condition());
                    InitializationFact afterCondition = fact;
                    eval(ce.ifTrue());
                    InitializationFact afterTrue = fact;
                    fact = afterCondition;
                    eval(ce.ifFalse());
                    fact = afterTrue.join(fact);
                } else {
                    expression.subExpressions().forEach(this::eval);
                }
            }

            private void read(VariableExpression ve) {
                Symbol symbol = ve.symbol();
                if (sink == null || !tracked(symbol) || fact.get(symbol) != InitializationFact.State.UNASSIGNED) {
                    return;
                }
                sink.accept(symbol, new Issue(Category.UNINITIALIZED_VARIABLE, Severity.WARNING,
                        "Variable '" + symbol.name() + "' is read before it is assigned", ve.location(),
                        new Suggestion("Initialize the variable", "Give '" + symbol.name()
                                                                  + "' a value when it is declared, or assign it on every path before reading it.")));
            }
        }
    }
}
