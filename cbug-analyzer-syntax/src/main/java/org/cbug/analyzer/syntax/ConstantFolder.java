package org.cbug.analyzer.syntax;

import org.cbug.analyzer.syntax.expression.*;

import java.util.function.Function;

/**
 * Evaluates constant expressions. Integral results are {@link Long}, floating results {@link Double};
 * {@code null} means "not a constant". Division by zero is never folded.
 * The optional environment supplies the constant value of a variable, or null.
 */
public class ConstantFolder {

    private static final Function<Symbol, Number> NO_ENVIRONMENT = s -> null;

    private ConstantFolder() {
    }

    public static Number fold(Expression expression) {
        return fold(expression, NO_ENVIRONMENT);
    }

    public static Number fold(Expression expression, Function<Symbol, Number> environment) {
        if (expression instanceof IntegerLiteral il) return il.value();
        if (expression instanceof FloatingLiteral fl) return fl.value();
        if (expression instanceof NullLiteral) return 0L;
        if (expression instanceof VariableExpression ve) return environment.apply(ve.symbol());
        if (expression instanceof CastExpression ce) {
            Number n = fold(ce.operand(), environment);
            if (n == null) return null;
            if (ce.type().isIntegral()) return n.longValue();
            if (ce.type().isFloating()) return n.doubleValue();
            if (ce.type().isPointer() && isZero(n)) return 0L;
            return null;
        }
        if (expression instanceof UnaryExpression ue) {
            Number n = fold(ue.operand(), environment);
            if (n == null) return null;
            return switch (ue.operator()) {
                case PLUS -> n;
                case MINUS -> n instanceof Double d ? (Number) (-d) : (Number) (-n.longValue());
                case NOT -> isZero(n) ? 1L : 0L;
                case BIT_NOT -> n instanceof Long l ? ~l : null;
                default -> null;
            };
        }
        if (expression instanceof BinaryExpression be) {
            return foldBinary(be, environment);
        }
        if (expression instanceof ConditionalExpression ce) {
            Number c = fold(ce.condition(), environment);
            if (c == null) return null;
            return fold(isZero(c) ? ce.ifFalse() : ce.ifTrue(), environment);
        }
        return null;
    }

    private static Number foldBinary(BinaryExpression be, Function<Symbol, Number> environment) {
        Number l = fold(be.lhs(), environment);
        if (l == null) return null;
        if (be.operator() == BinaryOperator.AND && isZero(l)) return 0L;
        if (be.operator() == BinaryOperator.OR && !isZero(l)) return 1L;
        Number r = fold(be.rhs(), environment);
        if (r == null) return null;
        if (be.operator().isLogical()) return isZero(r) ? 0L : 1L;
        if (l instanceof Double || r instanceof Double) {
            double a = l.doubleValue();
            double b = r.doubleValue();
            return switch (be.operator()) {
                case ADD -> a + b;
                case SUBTRACT -> a - b;
                case MULTIPLY -> a * b;
                case DIVIDE -> b == 0.0 ? null : a / b;
                case LESS -> a < b ? 1L : 0L;
                case GREATER -> a > b ? 1L : 0L;
                case LESS_EQUALS -> a <= b ? 1L : 0L;
                case GREATER_EQUALS -> a >= b ? 1L : 0L;
                case EQUALS -> a == b ? 1L : 0L;
                case NOT_EQUALS -> a != b ? 1L : 0L;
                default -> null;
            };
        }
        long a = l.longValue();
        long b = r.longValue();
        return switch (be.operator()) {
            case ADD -> a + b;
            case SUBTRACT -> a - b;
            case MULTIPLY -> a * b;
            case DIVIDE -> b == 0 ? null : a / b;
            case REMAINDER -> b == 0 ? null : a % b;
            case SHIFT_LEFT -> a << b;
            case SHIFT_RIGHT -> a >> b;
            case BIT_AND -> a & b;
            case BIT_OR -> a | b;
            case BIT_XOR -> a ^ b;
            case LESS -> a < b ? 1L : 0L;
            case GREATER -> a > b ? 1L : 0L;
            case LESS_EQUALS -> a <= b ? 1L : 0L;
            case GREATER_EQUALS -> a >= b ? 1L : 0L;
            case EQUALS -> a == b ? 1L : 0L;
            case NOT_EQUALS -> a != b ? 1L : 0L;
            default -> null;
        };
    }

    public static boolean isZero(Number n) {
        return n instanceof Double d ? d == 0.0 : n.longValue() == 0L;
    }

    /*
    TRUE or FALSE when the condition is a constant, null otherwise
     */
    public static Boolean truthValue(Expression condition) {
        Number n = fold(condition);
        return n == null ? null : !isZero(n);
    }
}
