package org.cbug.analyzer.syntax.expression;

import org.cbug.analyzer.common.SourceLocation;
import org.cbug.analyzer.syntax.CType;

import java.util.List;

public record CastExpression(CType type, Expression operand, SourceLocation location) implements Expression {

    @Override
    public List<Expression> subExpressions() {
        return List.of(operand);
    }

    @Override
    public Expression withoutCasts() {
        return operand.withoutCasts();
    }

    @Override
    public boolean isNullConstant() {
        return operand.isNullConstant();
    }

    @Override
    public String toString() {
        return "(" + type + ") " + operand;
    }
}
