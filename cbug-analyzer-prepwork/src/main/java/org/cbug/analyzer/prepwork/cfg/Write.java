package org.cbug.analyzer.prepwork.cfg;

import org.cbug.analyzer.syntax.Symbol;
import org.cbug.analyzer.syntax.expression.Expression;

/*
a write to a condition variable inside a loop: an assignment, an increment or decrement, or taking its address
 */
public record Write(Symbol variable, Expression expression, CFGNode node) {
}
