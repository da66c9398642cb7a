package org.cbug.analyzer.prepwork.cfg;

import org.cbug.analyzer.common.SourceLocation;
import org.cbug.analyzer.syntax.expression.Expression;

import java.util.List;

// value is null for a plain 'return;'
public record ReturnElement(Expression value, SourceLocation location) implements CFGElement {

    @Override
    public List<Expression> expressions() {
        return value == null ? List.of() : List.of(value);
    }

    @Override
    public String toString() {
        return value == null ? "return" : "return " + value;
    }
}
