package org.cbug.analyzer.syntax.expression;

import org.cbug.analyzer.common.SourceLocation;
import org.cbug.analyzer.syntax.CType;

import java.util.List;

public record BinaryExpression(BinaryOperator operator, Expression lhs, Expression rhs, CType type, SourceLocation location) implements Expression {

    @Override
    public List<Expression> subExpressions() {
        return List.of(lhs, rhs);
    }

    @Override
    public String toString() {
        return "(" + lhs + " " + operator.symbol + " " + rhs + ")";
    }
}
