package org.cbug.analyzer.syntax.expression;

import org.cbug.analyzer.common.SourceLocation;
import org.cbug.analyzer.syntax.CType;

import java.util.List;

public record SizeofExpression(CType operandType, Expression operand, SourceLocation location) implements Expression {

    @Override
    public CType type() {
        return CType.UNSIGNED_LONG;
    }

    // unevaluated operand
    @Override
    public List<Expression> subExpressions() {
        return List.of();
    }

    @Override
    public String toString() {
        return "sizeof(" + (operand == null ? operandType : operand) + ")";
    }
}
