package org.cbug.analyzer.syntax.expression;

import java.util.Arrays;
import java.util.Optional;

public enum BinaryOperator {
    MULTIPLY("*", 10), DIVIDE("/", 10), REMAINDER("%", 10),
    ADD("+", 9), SUBTRACT("-", 9),
    SHIFT_LEFT("<<", 8), SHIFT_RIGHT(">>", 8),
    LESS("<", 7), GREATER(">", 7), LESS_EQUALS("<=", 7), GREATER_EQUALS(">=", 7),
    EQUALS("==", 6), NOT_EQUALS("!=", 6),
    BIT_AND("&", 5), BIT_XOR("^", 4), BIT_OR("|", 3),
    AND("&&", 2), OR("||", 1);

    public final String symbol;
    public final int precedence;

    BinaryOperator(String symbol, int precedence) {
        this.symbol = symbol;
        this.precedence = precedence;
    }

    public static Optional<BinaryOperator> fromSymbol(String symbol) {
        return Arrays.stream(values()).filter(o -> o.symbol.equals(symbol)).findFirst();
    }

    public boolean isComparison() {
        return precedence == 7 || precedence == 6;
    }

    public boolean isLogical() {
        return this == AND || this == OR;
    }

    public boolean isDivision() {
        return this == DIVIDE || this == REMAINDER;
    }

    /*
    a < b equals b > a
     */
    public BinaryOperator mirror() {
        return switch (this) {
            case LESS -> GREATER;
            case GREATER -> LESS;
            case LESS_EQUALS -> GREATER_EQUALS;
            case GREATER_EQUALS -> LESS_EQUALS;
            default -> this;
        };
    }
}
