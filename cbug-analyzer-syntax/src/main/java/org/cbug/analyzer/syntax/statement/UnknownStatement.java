package org.cbug.analyzer.syntax.statement;

import org.cbug.analyzer.common.SourceLocation;
import org.cbug.analyzer.syntax.expression.Expression;

import java.util.List;

/**
 * A construct the front-end recognizes but does not model, such as inline assembly.
 * {@code expressions} lists the expressions it is known to touch; an empty list means "anything".
 */
public record UnknownStatement(String description, List<Expression> expressions, SourceLocation location)
        implements Statement {

    public UnknownStatement {
        expressions = List.copyOf(expressions);
    }
}
