package org.cbug.analyzer.syntax.expression;

import org.cbug.analyzer.common.SourceLocation;
import org.cbug.analyzer.syntax.CType;
import org.cbug.analyzer.syntax.Symbol;

import java.util.List;

public record VariableExpression(Symbol symbol, SourceLocation location) implements Expression {

    @Override
    public CType type() {
        return symbol.type();
    }

    @Override
    public List<Expression> subExpressions() {
        return List.of();
    }

    @Override
    public String toString() {
        return symbol.name();
    }
}
