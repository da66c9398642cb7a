package org.cbug.analyzer.syntax.statement;

import org.cbug.analyzer.common.SourceLocation;
import org.cbug.analyzer.syntax.expression.Expression;

import java.util.List;

public record ExpressionStatement(Expression expression, SourceLocation location) implements Statement {

    @Override
    public List<Expression> expressions() {
        return List.of(expression);
    }
}
