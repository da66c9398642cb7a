package org.cbug.analyzer.syntax.statement;

import org.cbug.analyzer.common.SourceLocation;
import org.cbug.analyzer.syntax.expression.Expression;

import java.util.List;

/*
a case or default label; the labeled statement follows as the next statement of the enclosing block.
value is null for default.
 */
public record CaseStatement(Expression value, SourceLocation location) implements Statement {

    public boolean isDefault() {
        return value == null;
    }

    @Override
    public List<Expression> expressions() {
        return value == null ? List.of() : List.of(value);
    }
}
