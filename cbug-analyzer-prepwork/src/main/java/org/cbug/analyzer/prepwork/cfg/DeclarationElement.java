package org.cbug.analyzer.prepwork.cfg;

import org.cbug.analyzer.common.SourceLocation;
import org.cbug.analyzer.syntax.Symbol;
import org.cbug.analyzer.syntax.expression.Expression;
import org.cbug.analyzer.syntax.statement.VariableDeclaration;

import java.util.List;

public record DeclarationElement(VariableDeclaration declaration) implements CFGElement {

    public Symbol symbol() {
        return declaration.symbol();
    }

    public Expression initializer() {
        return declaration.initializer();
    }

    @Override
    public SourceLocation location() {
        return declaration.location();
    }

    @Override
    public List<Expression> expressions() {
        return declaration.hasInitializer() ? List.of(declaration.initializer()) : List.of();
    }

    @Override
    public String toString() {
        return "decl " + symbol().name() + (declaration.hasInitializer() ? " = " + initializer() : "");
    }
}
