package org.cbug.analyzer.prepwork.callgraph;

import org.cbug.analyzer.prepwork.StandardLibrary;
import org.cbug.analyzer.prepwork.escape.ComputeEscapes;
import org.cbug.analyzer.syntax.FunctionDefinition;
import org.cbug.analyzer.syntax.Symbol;
import org.cbug.analyzer.syntax.TranslationUnit;
import org.cbug.analyzer.syntax.expression.AssignmentExpression;
import org.cbug.analyzer.syntax.expression.CallExpression;
import org.cbug.analyzer.syntax.expression.Expression;
import org.cbug.analyzer.syntax.expression.VariableExpression;
import org.cbug.analyzer.syntax.statement.DeclarationStatement;
import org.cbug.analyzer.syntax.statement.ReturnStatement;
import org.cbug.analyzer.syntax.statement.VariableDeclaration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/*
Recognizes allocation and release wrappers, one level deep: only direct calls to the standard library
allocators and to free count, a wrapper of a wrapper is not a wrapper.

direction of the call graph arrow: caller -> callee
 */
public class ComputeCallSummaries {
    private static final Logger LOGGER = LoggerFactory.getLogger(ComputeCallSummaries.class);

    private ComputeCallSummaries() {
    }

    public static CallSummaries go(TranslationUnit translationUnit) {
        Map<String, CallSummary> summaries = new LinkedHashMap<>();
        Map<String, Set<String>> callees = new LinkedHashMap<>();
        for (FunctionDefinition function : translationUnit.functions()) {
            callees.put(function.name(), directCallees(function));
            boolean allocator = isAllocationWrapper(function);
            int freed = freedParameter(function);
            if (allocator || freed >= 0) {
                CallSummary summary = new CallSummary(function.name(), allocator, freed);
                LOGGER.debug("Wrapper: {}", summary);
                summaries.put(function.name(), summary);
            }
        }
        return new CallSummaries(summaries, callees);
    }

    private static Set<String> directCallees(FunctionDefinition function) {
        Set<String> set = new TreeSet<>();
        function.body().expressionStream()
                .filter(e -> e instanceof CallExpression ce && ce.callee() != null)
                .forEach(e -> set.add(((CallExpression) e).callee()));
        return set;
    }

    private static boolean isAllocationCall(Expression expression) {
        return expression != null && expression.withoutCasts() instanceof CallExpression ce && ce.callee() != null
               && StandardLibrary.isAllocator(ce.callee());
    }

    /*
    returns an allocation call directly, or a local that received one
     */
    static boolean isAllocationWrapper(FunctionDefinition function) {
        if (!function.returnType().isPointer()) return false;
        Set<Symbol> allocated = new HashSet<>();
        function.body().stream().forEach(s -> {
            if (s instanceof DeclarationStatement ds) {
                for (VariableDeclaration vd : ds.declarations()) {
                    if (isAllocationCall(vd.initializer())) allocated.add(vd.symbol());
                }
            }
        });
        function.body().expressionStream().forEach(e -> {
            if (e instanceof AssignmentExpression ae && ae.isPlain() && isAllocationCall(ae.value())
                && ae.target().withoutCasts() instanceof VariableExpression ve) {
                allocated.add(ve.symbol());
            }
        });
        return function.body().stream()
                .filter(s -> s instanceof ReturnStatement rs && rs.value() != null)
                .map(s -> ((ReturnStatement) s).value())
                .anyMatch(value -> isAllocationCall(value)
                                   || ComputeEscapes.pointersCarriedBy(value).stream().anyMatch(allocated::contains));
    }

    static int freedParameter(FunctionDefinition function) {
        List<Symbol> parameters = function.parameters();
        Optional<Integer> freed = function.body().expressionStream()
                .filter(e -> e instanceof CallExpression ce && StandardLibrary.isDeallocator(ce.callee())
                             && ce.arguments().size() == 1)
                .map(e -> ((CallExpression) e).argument(0).withoutCasts())
                .filter(a -> a instanceof VariableExpression)
                .map(a -> parameters.indexOf(((VariableExpression) a).symbol()))
                .filter(i -> i >= 0 && parameters.get(i).isPointer())
                .findFirst();
        return freed.orElse(-1);
    }
}
