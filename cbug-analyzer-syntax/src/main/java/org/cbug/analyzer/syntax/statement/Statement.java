package org.cbug.analyzer.syntax.statement;

import org.cbug.analyzer.common.SourceLocation;
import org.cbug.analyzer.syntax.expression.Expression;

import java.util.List;
import java.util.stream.Stream;

public interface Statement {

    SourceLocation location();

    /*
    directly nested statements, in source order
     */
    default List<Statement> subStatements() {
        return List.of();
    }

    /*
    expressions that belong to this statement itself, not to its sub-statements
     */
    default List<Expression> expressions() {
        return List.of();
    }

    default Stream<Statement> stream() {
        return Stream.concat(Stream.of(this), subStatements().stream().flatMap(Statement::stream));
    }

    default Stream<Expression> expressionStream() {
        return stream().flatMap(s -> s.expressions().stream()).flatMap(Expression::stream);
    }
}
