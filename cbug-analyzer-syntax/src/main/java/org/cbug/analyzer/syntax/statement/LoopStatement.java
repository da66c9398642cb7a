package org.cbug.analyzer.syntax.statement;

import org.cbug.analyzer.syntax.expression.Expression;

public interface LoopStatement extends Statement {

    // null when absent, as in for(;;)
    Expression condition();

    Statement body();
}
