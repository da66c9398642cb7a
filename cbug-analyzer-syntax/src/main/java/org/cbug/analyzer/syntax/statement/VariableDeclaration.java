package org.cbug.analyzer.syntax.statement;

import org.cbug.analyzer.common.SourceLocation;
import org.cbug.analyzer.syntax.Symbol;
import org.cbug.analyzer.syntax.expression.Expression;

// initializer may be null
public record VariableDeclaration(Symbol symbol, Expression initializer) {

    public SourceLocation location() {
        return symbol.location();
    }

    public boolean hasInitializer() {
        return initializer != null;
    }
}
