package org.cbug.analyzer.syntax.expression;

import org.cbug.analyzer.common.SourceLocation;
import org.cbug.analyzer.syntax.CType;

import java.util.List;

public record IndexExpression(Expression base, Expression index, CType type, SourceLocation location) implements Expression {

    @Override
    public List<Expression> subExpressions() {
        return List.of(base, index);
    }

    @Override
    public String toString() {
        return base + "[" + index + "]";
    }
}
