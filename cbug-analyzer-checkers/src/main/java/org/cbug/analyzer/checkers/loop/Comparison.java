package org.cbug.analyzer.checkers.loop;

import org.cbug.analyzer.syntax.ConstantFolder;
import org.cbug.analyzer.syntax.Symbol;
import org.cbug.analyzer.syntax.expression.BinaryExpression;
import org.cbug.analyzer.syntax.expression.BinaryOperator;
import org.cbug.analyzer.syntax.expression.Expression;
import org.cbug.analyzer.syntax.expression.VariableExpression;

import java.util.function.Function;

/*
a condition of the form 'variable OP bound', with the variable moved to the left
 */
record Comparison(Symbol variable, BinaryOperator operator, Expression bound) {

    static Comparison of(Expression condition) {
        if (!(condition.withoutCasts() instanceof BinaryExpression be) || !be.operator().isComparison()) return null;
        if (be.lhs().withoutCasts() instanceof VariableExpression ve && !mentions(be.rhs(), ve.symbol())) {
            return new Comparison(ve.symbol(), be.operator(), be.rhs());
        }
        if (be.rhs().withoutCasts() instanceof VariableExpression ve && !mentions(be.lhs(), ve.symbol())) {
            return new Comparison(ve.symbol(), be.operator().mirror(), be.lhs());
        }
        return null;
    }

    private static boolean mentions(Expression expression, Symbol symbol) {
        return expression.stream().anyMatch(e -> e instanceof VariableExpression ve && ve.symbol().equals(symbol));
    }

    Comparison negate() {
        BinaryOperator negated = switch (operator) {
            case LESS -> BinaryOperator.GREATER_EQUALS;
            case GREATER -> BinaryOperator.LESS_EQUALS;
            case LESS_EQUALS -> BinaryOperator.GREATER;
            case GREATER_EQUALS -> BinaryOperator.LESS;
            case EQUALS -> BinaryOperator.NOT_EQUALS;
            case NOT_EQUALS -> BinaryOperator.EQUALS;
            default -> throw new UnsupportedOperationException("Not a comparison: " + operator);
        };
        return new Comparison(variable, negated, bound);
    }

    Number boundValue(Function<Symbol, Number> environment) {
        return ConstantFolder.fold(bound, environment);
    }

    static boolean holds(BinaryOperator operator, Number value, Number bound) {
        int c = value instanceof Double || bound instanceof Double
                ? Double.compare(value.doubleValue(), bound.doubleValue())
                : Long.compare(value.longValue(), bound.longValue());
        return switch (operator) {
            case LESS -> c < 0;
            case GREATER -> c > 0;
            case LESS_EQUALS -> c <= 0;
            case GREATER_EQUALS -> c >= 0;
            case EQUALS -> c == 0;
            case NOT_EQUALS -> c != 0;
            default -> throw new UnsupportedOperationException("Not a comparison: " + operator);
        };
    }

    @Override
    public String toString() {
        return variable.name() + " " + operator.symbol + " " + bound;
    }
}
