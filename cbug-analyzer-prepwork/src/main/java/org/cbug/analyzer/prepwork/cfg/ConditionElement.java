package org.cbug.analyzer.prepwork.cfg;

import org.cbug.analyzer.common.SourceLocation;
import org.cbug.analyzer.syntax.expression.Expression;
import org.cbug.analyzer.syntax.statement.Statement;

import java.util.List;

/*
the condition of an if or a loop, or the selector of a switch; statement is the owning statement
 */
public record ConditionElement(Expression condition, Statement statement) implements CFGElement {

    @Override
    public SourceLocation location() {
        return condition.location();
    }

    @Override
    public List<Expression> expressions() {
        return List.of(condition);
    }

    @Override
    public String toString() {
        return "cond " + condition;
    }
}
