package org.cbug.analyzer.syntax.statement;

import org.cbug.analyzer.common.SourceLocation;
import org.cbug.analyzer.syntax.expression.Expression;

import java.util.List;

// value may be null
public record ReturnStatement(Expression value, SourceLocation location) implements Statement {

    @Override
    public List<Expression> expressions() {
        return value == null ? List.of() : List.of(value);
    }
}
