package org.cbug.analyzer.syntax.statement;

import org.cbug.analyzer.common.SourceLocation;
import org.cbug.analyzer.syntax.expression.Expression;

import java.util.ArrayList;
import java.util.List;

/*
initializer is a DeclarationStatement or an ExpressionStatement; initializer, condition and update may be null
 */
public record ForStatement(Statement initializer, Expression condition, Expression update, Statement body,
                           SourceLocation location) implements LoopStatement {

    @Override
    public List<Statement> subStatements() {
        return initializer == null ? List.of(body) : List.of(initializer, body);
    }

    @Override
    public List<Expression> expressions() {
        List<Expression> list = new ArrayList<>(2);
        if (condition != null) list.add(condition);
        if (update != null) list.add(update);
        return list;
    }
}
