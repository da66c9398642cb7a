package org.cbug.analyzer.syntax.expression;

import org.cbug.analyzer.common.SourceLocation;
import org.cbug.analyzer.syntax.CType;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A function call. {@code callee} is the name of the called function or function pointer variable;
 * it is null when the callee is computed, in which case {@code calleeExpression} holds it.
 */
public record CallExpression(String callee, Expression calleeExpression, List<Expression> arguments, CType type,
                             SourceLocation location) implements Expression {

    public CallExpression {
        arguments = List.copyOf(arguments);
    }

    public CallExpression(String callee, List<Expression> arguments, CType type, SourceLocation location) {
        this(callee, null, arguments, type, location);
    }

    @Override
    public List<Expression> subExpressions() {
        if (calleeExpression == null) return arguments;
        List<Expression> list = new ArrayList<>(arguments.size() + 1);
        list.add(calleeExpression);
        list.addAll(arguments);
        return list;
    }

    public boolean calls(String name) {
        return name.equals(callee);
    }

    public Expression argument(int index) {
        return index < arguments.size() ? arguments.get(index) : null;
    }

    @Override
    public String toString() {
        return (callee == null ? "(" + calleeExpression + ")" : callee)
               + arguments.stream().map(Object::toString).collect(Collectors.joining(", ", "(", ")"));
    }
}
