package org.cbug.analyzer.syntax.expression;

public enum UnaryOperator {
    DEREFERENCE("*"), ADDRESS_OF("&"), PLUS("+"), MINUS("-"), NOT("!"), BIT_NOT("~"),
    PRE_INCREMENT("++"), PRE_DECREMENT("--"), POST_INCREMENT("++"), POST_DECREMENT("--");

    public final String symbol;

    UnaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public boolean isIncrementOrDecrement() {
        return this == PRE_INCREMENT || this == PRE_DECREMENT || this == POST_INCREMENT || this == POST_DECREMENT;
    }

    public boolean isIncrement() {
        return this == PRE_INCREMENT || this == POST_INCREMENT;
    }
}
