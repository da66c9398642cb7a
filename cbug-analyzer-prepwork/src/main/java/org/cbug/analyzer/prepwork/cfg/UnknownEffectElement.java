package org.cbug.analyzer.prepwork.cfg;

import org.cbug.analyzer.common.SourceLocation;
import org.cbug.analyzer.syntax.expression.Expression;
import org.cbug.analyzer.syntax.statement.UnknownStatement;

import java.util.List;

public record UnknownEffectElement(UnknownStatement statement) implements CFGElement {

    @Override
    public SourceLocation location() {
        return statement.location();
    }

    @Override
    public List<Expression> expressions() {
        return statement.expressions();
    }

    // no expressions known: the statement may touch any variable
    public boolean touchesEverything() {
        return statement.expressions().isEmpty();
    }

    @Override
    public String toString() {
        return "unknown " + statement.description();
    }
}
