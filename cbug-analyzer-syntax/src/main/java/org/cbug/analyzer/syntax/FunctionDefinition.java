package org.cbug.analyzer.syntax;

import org.cbug.analyzer.common.SourceLocation;
import org.cbug.analyzer.syntax.statement.Block;

import java.util.List;

/*
nested functions (a GCC extension) are hoisted to the translation unit, with a reference to the enclosing one
 */
public record FunctionDefinition(String name, CType returnType, List<Symbol> parameters, boolean variadic,
                                 Block body, SourceLocation location, String enclosingFunction) {

    public FunctionDefinition {
        parameters = List.copyOf(parameters);
    }

    public boolean isNested() {
        return enclosingFunction != null;
    }

    @Override
    public String toString() {
        return name + "@" + location.line();
    }
}
