package org.cbug.analyzer.syntax.expression;

import org.cbug.analyzer.common.SourceLocation;
import org.cbug.analyzer.syntax.CType;

import java.util.List;
import java.util.stream.Collectors;

public record InitializerList(List<Expression> elements, SourceLocation location) implements Expression {

    public InitializerList {
        elements = List.copyOf(elements);
    }

    @Override
    public CType type() {
        return CType.UNKNOWN;
    }

    @Override
    public List<Expression> subExpressions() {
        return elements;
    }

    @Override
    public String toString() {
        return elements.stream().map(Object::toString).collect(Collectors.joining(", ", "{", "}"));
    }
}
