package org.cbug.analyzer.syntax.expression;

import org.cbug.analyzer.common.SourceLocation;
import org.cbug.analyzer.syntax.CType;

import java.util.List;

public record StringLiteral(String value, SourceLocation location) implements Expression {

    @Override
    public CType type() {
        return CType.arrayOf(CType.CHAR, value.length() + 1);
    }

    @Override
    public List<Expression> subExpressions() {
        return List.of();
    }

    @Override
    public String toString() {
        return "\"" + value.replace("\n", "\\n") + "\"";
    }
}
