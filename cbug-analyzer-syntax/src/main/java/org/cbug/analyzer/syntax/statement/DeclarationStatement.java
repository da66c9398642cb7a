package org.cbug.analyzer.syntax.statement;

import org.cbug.analyzer.common.SourceLocation;
import org.cbug.analyzer.syntax.expression.Expression;

import java.util.List;
import java.util.Objects;

public record DeclarationStatement(List<VariableDeclaration> declarations, SourceLocation location) implements Statement {

    public DeclarationStatement {
        declarations = List.copyOf(declarations);
    }

    @Override
    public List<Expression> expressions() {
        return declarations.stream().map(VariableDeclaration::initializer).filter(Objects::nonNull).toList();
    }
}
