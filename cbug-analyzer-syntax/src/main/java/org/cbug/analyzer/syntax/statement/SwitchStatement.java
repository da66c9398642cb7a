package org.cbug.analyzer.syntax.statement;

import org.cbug.analyzer.common.SourceLocation;
import org.cbug.analyzer.syntax.expression.Expression;

import java.util.List;

public record SwitchStatement(Expression selector, Statement body, SourceLocation location) implements Statement {

    @Override
    public List<Statement> subStatements() {
        return List.of(body);
    }

    @Override
    public List<Expression> expressions() {
        return List.of(selector);
    }
}
