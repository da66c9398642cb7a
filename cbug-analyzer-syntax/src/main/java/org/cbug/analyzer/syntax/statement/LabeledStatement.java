package org.cbug.analyzer.syntax.statement;

import org.cbug.analyzer.common.SourceLocation;

import java.util.List;

public record LabeledStatement(String label, Statement statement, SourceLocation location) implements Statement {

    @Override
    public List<Statement> subStatements() {
        return List.of(statement);
    }
}
