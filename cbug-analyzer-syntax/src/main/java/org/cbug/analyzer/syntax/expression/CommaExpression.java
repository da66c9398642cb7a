package org.cbug.analyzer.syntax.expression;

import org.cbug.analyzer.common.SourceLocation;
import org.cbug.analyzer.syntax.CType;

import java.util.List;
import java.util.stream.Collectors;

public record CommaExpression(List<Expression> expressions, SourceLocation location) implements Expression {

    public CommaExpression {
        expressions = List.copyOf(expressions);
    }

    @Override
    public CType type() {
        return expressions.get(expressions.size() - 1).type();
    }

    @Override
    public List<Expression> subExpressions() {
        return expressions;
    }

    @Override
    public String toString() {
        return expressions.stream().map(Object::toString).collect(Collectors.joining(", "));
    }
}
