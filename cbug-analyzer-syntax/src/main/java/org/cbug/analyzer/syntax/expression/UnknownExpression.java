package org.cbug.analyzer.syntax.expression;

import org.cbug.analyzer.common.SourceLocation;
import org.cbug.analyzer.syntax.CType;

import java.util.List;

public record UnknownExpression(String text, SourceLocation location) implements Expression {

    @Override
    public CType type() {
        return CType.UNKNOWN;
    }

    @Override
    public List<Expression> subExpressions() {
        return List.of();
    }

    @Override
    public String toString() {
        return "<" + text + ">";
    }
}
