package org.cbug.analyzer.syntax.expression;

import org.cbug.analyzer.common.SourceLocation;
import org.cbug.analyzer.syntax.CType;

import java.util.List;

public record UnaryExpression(UnaryOperator operator, Expression operand, CType type, SourceLocation location) implements Expression {

    @Override
    public List<Expression> subExpressions() {
        return List.of(operand);
    }

    public boolean isDereference() {
        return operator == UnaryOperator.DEREFERENCE;
    }

    @Override
    public String toString() {
        return switch (operator) {
            case POST_INCREMENT, POST_DECREMENT -> operand + operator.symbol;
            default -> operator.symbol + operand;
        };
    }
}
