package org.cbug.analyzer.prepwork.cfg;

import org.cbug.analyzer.common.SourceLocation;
import org.cbug.analyzer.syntax.expression.Expression;

import java.util.List;

public record ExpressionElement(Expression expression) implements CFGElement {

    @Override
    public SourceLocation location() {
        return expression.location();
    }

    @Override
    public List<Expression> expressions() {
        return List.of(expression);
    }

    @Override
    public String toString() {
        return expression.toString();
    }
}
