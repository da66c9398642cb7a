package org.cbug.analyzer.syntax.expression;

import org.cbug.analyzer.common.SourceLocation;
import org.cbug.analyzer.syntax.CType;

import java.util.List;

public record FloatingLiteral(double value, String text, CType type, SourceLocation location) implements Expression {

    @Override
    public List<Expression> subExpressions() {
        return List.of();
    }

    @Override
    public String toString() {
        return text;
    }
}
