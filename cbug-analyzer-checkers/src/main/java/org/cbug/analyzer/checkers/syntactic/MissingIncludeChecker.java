package org.cbug.analyzer.checkers.syntactic;

import org.cbug.analyzer.checkers.Checker;
import org.cbug.analyzer.common.Category;
import org.cbug.analyzer.common.Issue;
import org.cbug.analyzer.common.Severity;
import org.cbug.analyzer.common.Suggestion;
import org.cbug.analyzer.prepwork.AnalysisContext;
import org.cbug.analyzer.prepwork.StandardLibrary;
import org.cbug.analyzer.prepwork.cfg.ControlFlowGraph;
import org.cbug.analyzer.syntax.TranslationUnit;
import org.cbug.analyzer.syntax.expression.CallExpression;

import java.util.*;

/*
a call to a stdio, stdlib or string function whose header is not included, and which the file does not declare
itself; reported once per function, at its first call
 */
public class MissingIncludeChecker implements Checker {

    @Override
    public String name() {
        return "missing-include";
    }

    @Override
    public List<Issue> run(AnalysisContext context) {
        TranslationUnit translationUnit = context.translationUnit();
        Map<String, CallExpression> firstCalls = new LinkedHashMap<>();
        for (ControlFlowGraph cfg : context.cfgs()) {
            cfg.elements().forEach(element -> element.expressions().forEach(expression -> expression.visit(e -> {
                if (e instanceof CallExpression call && call.callee() != null) {
                    firstCalls.merge(call.callee(), call,
                            (c1, c2) -> c1.location().compareTo(c2.location()) <= 0 ? c1 : c2);
                }
                return true;
            })));
        }
        List<Issue> issues = new ArrayList<>();
        firstCalls.forEach((function, call) -> {
            String header = StandardLibrary.header(function);
            if (header != null && !translationUnit.includes(header) && !translationUnit.declares(function)) {
                issues.add(new Issue(Category.MISSING_INCLUDE, Severity.WARNING, "'" + function
                                                                                 + "' is used without including <" + header + ">",
                        call.location(), new Suggestion("Add #include <" + header + ">",
                        "'" + function + "' is declared in <" + header + ">.")));
            }
        });
        return issues;
    }
}
