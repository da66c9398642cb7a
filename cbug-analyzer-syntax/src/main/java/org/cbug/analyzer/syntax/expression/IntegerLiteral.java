package org.cbug.analyzer.syntax.expression;

import org.cbug.analyzer.common.SourceLocation;
import org.cbug.analyzer.syntax.CType;

import java.util.List;

public record IntegerLiteral(long value, String text, CType type, SourceLocation location) implements Expression {

    @Override
    public List<Expression> subExpressions() {
        return List.of();
    }

    @Override
    public boolean isNullConstant() {
        return value == 0 && !type.isCharacter();
    }

    @Override
    public String toString() {
        return text;
    }
}
