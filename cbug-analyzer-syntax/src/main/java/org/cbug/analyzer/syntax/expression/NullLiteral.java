package org.cbug.analyzer.syntax.expression;

import org.cbug.analyzer.common.SourceLocation;
import org.cbug.analyzer.syntax.CType;

import java.util.List;

public record NullLiteral(SourceLocation location) implements Expression {

    @Override
    public CType type() {
        return CType.VOID_POINTER;
    }

    @Override
    public List<Expression> subExpressions() {
        return List.of();
    }

    @Override
    public boolean isNullConstant() {
        return true;
    }

    @Override
    public String toString() {
        return "NULL";
    }
}
