package org.cbug.analyzer.checkers.syntactic;

import org.cbug.analyzer.checkers.Checker;
import org.cbug.analyzer.common.Category;
import org.cbug.analyzer.common.Issue;
import org.cbug.analyzer.common.Severity;
import org.cbug.analyzer.common.Suggestion;
import org.cbug.analyzer.prepwork.AnalysisContext;
import org.cbug.analyzer.prepwork.cfg.CFGNode;
import org.cbug.analyzer.prepwork.cfg.ControlFlowGraph;
import org.cbug.analyzer.syntax.CType;
import org.cbug.analyzer.syntax.ConstantFolder;
import org.cbug.analyzer.syntax.expression.*;

import java.util.*;

/*
a constant index outside [0, length) of an array variable with a fixed length; &a[length] is allowed
 */
public class ArrayBoundsChecker implements Checker {

    @Override
    public String name() {
        return "array-bounds";
    }

    @Override
    public List<Issue> run(AnalysisContext context) {
        List<Issue> issues = new ArrayList<>();
        for (ControlFlowGraph cfg : context.cfgs()) {
            for (CFGNode node : cfg.nodes()) {
                if (!cfg.isReachable(node)) continue;
                node.elements().forEach(element -> element.expressions().forEach(e -> check(e, issues)));
            }
        }
        return issues;
    }

    private static void check(Expression expression, List<Issue> issues) {
        Set<Expression> addressed = Collections.newSetFromMap(new IdentityHashMap<>());
        expression.visit(e -> {
            if (e instanceof UnaryExpression ue && ue.operator() == UnaryOperator.ADDRESS_OF
                && ue.operand() instanceof IndexExpression ie) {
                addressed.add(ie);
            }
            if (e instanceof IndexExpression ie && ie.base().withoutCasts() instanceof VariableExpression ve) {
                CType type = ve.symbol().type();
                Number index = ConstantFolder.fold(ie.index());
                if (type.isArray() && type.arrayLength() > 0 && index instanceof Long l) {
                    long limit = addressed.contains(ie) ? type.arrayLength() : type.arrayLength() - 1L;
                    if (l < 0 || l > limit) {
                        issues.add(new Issue(Category.ARRAY_INDEX_OUT_OF_BOUNDS, Severity.ERROR, "Index " + l
                                                                                                  + " is out of bounds for array '" + ve.symbol().name()
                                                                                                  + "' of length " + type.arrayLength(),
                                ie.location(), new Suggestion("Stay within the array",
                                "Valid indexes of '" + ve.symbol().name() + "' are 0 to "
                                + (type.arrayLength() - 1) + ".")));
                    }
                }
            }
            return true;
        });
    }
}
