package org.cbug.analyzer.prepwork.cfg;

import org.cbug.analyzer.common.SourceLocation;
import org.cbug.analyzer.syntax.expression.Expression;

import java.util.List;

/**
 * One primitive step inside a basic block: a declaration, an expression evaluated for its effect,
 * a branch condition, a return, or a statement whose effect is not modelled.
 */
public interface CFGElement {

    SourceLocation location();

    // the expressions evaluated by this element, in evaluation order
    List<Expression> expressions();
}
