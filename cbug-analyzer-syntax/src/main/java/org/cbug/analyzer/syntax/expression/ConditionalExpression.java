package org.cbug.analyzer.syntax.expression;

import org.cbug.analyzer.common.SourceLocation;
import org.cbug.analyzer.syntax.CType;

import java.util.List;

public record ConditionalExpression(Expression condition, Expression ifTrue, Expression ifFalse, CType type, SourceLocation location) implements Expression {

    @Override
    public List<Expression> subExpressions() {
        return List.of(condition, ifTrue, ifFalse);
    }

    @Override
    public String toString() {
        return condition + " ? " + ifTrue + " : " + ifFalse;
    }
}
