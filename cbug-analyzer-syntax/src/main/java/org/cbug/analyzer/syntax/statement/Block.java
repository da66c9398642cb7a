package org.cbug.analyzer.syntax.statement;

import org.cbug.analyzer.common.SourceLocation;

import java.util.List;

public record Block(List<Statement> statements, SourceLocation location) implements Statement {

    public Block {
        statements = List.copyOf(statements);
    }

    @Override
    public List<Statement> subStatements() {
        return statements;
    }

    public boolean isEmpty() {
        return statements.isEmpty();
    }
}
