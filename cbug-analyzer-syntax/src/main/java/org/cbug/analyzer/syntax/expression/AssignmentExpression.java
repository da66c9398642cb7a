package org.cbug.analyzer.syntax.expression;

import org.cbug.analyzer.common.SourceLocation;
import org.cbug.analyzer.syntax.CType;

import java.util.List;

/*
compoundOperator is null for a plain assignment; a += b has compoundOperator ADD
 */
public record AssignmentExpression(BinaryOperator compoundOperator, Expression target, Expression value,
                                   SourceLocation location) implements Expression {

    @Override
    public CType type() {
        return target.type();
    }

    @Override
    public List<Expression> subExpressions() {
        return List.of(value, target);
    }

    public boolean isPlain() {
        return compoundOperator == null;
    }

    @Override
    public String toString() {
        return target + " " + (compoundOperator == null ? "" : compoundOperator.symbol) + "= " + value;
    }
}
