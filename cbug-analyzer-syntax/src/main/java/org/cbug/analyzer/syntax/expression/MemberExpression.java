package org.cbug.analyzer.syntax.expression;

import org.cbug.analyzer.common.SourceLocation;
import org.cbug.analyzer.syntax.CType;

import java.util.List;

public record MemberExpression(Expression base, String member, boolean arrow, CType type, SourceLocation location) implements Expression {

    @Override
    public List<Expression> subExpressions() {
        return List.of(base);
    }

    @Override
    public String toString() {
        return base + (arrow ? "->" : ".") + member;
    }
}
