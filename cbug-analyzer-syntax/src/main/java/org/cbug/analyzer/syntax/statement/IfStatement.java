package org.cbug.analyzer.syntax.statement;

import org.cbug.analyzer.common.SourceLocation;
import org.cbug.analyzer.syntax.expression.Expression;

import java.util.List;

// elseStatement may be null
public record IfStatement(Expression condition, Statement thenStatement, Statement elseStatement,
                          SourceLocation location) implements Statement {

    @Override
    public List<Statement> subStatements() {
        return elseStatement == null ? List.of(thenStatement) : List.of(thenStatement, elseStatement);
    }

    @Override
    public List<Expression> expressions() {
        return List.of(condition);
    }
}
