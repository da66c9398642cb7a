package org.cbug.analyzer.syntax.expression;

import org.cbug.analyzer.common.SourceLocation;
import org.cbug.analyzer.syntax.CType;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Stream;

public interface Expression {

    SourceLocation location();

    /*
    static type, CType.UNKNOWN when the front-end could not determine it
     */
    CType type();

    /*
    evaluated sub-expressions, in evaluation order; the operand of sizeof is not evaluated and not included
     */
    List<Expression> subExpressions();

    /*
    pre-order traversal; the predicate returns false to stop descending into the current expression
     */
    default void visit(Predicate<Expression> predicate) {
        if (predicate.test(this)) {
            subExpressions().forEach(e -> e.visit(predicate));
        }
    }

    default Stream<Expression> stream() {
        List<Expression> list = new ArrayList<>();
        visit(e -> {
            list.add(e);
            return true;
        });
        return list.stream();
    }

    default Expression withoutCasts() {
        return this;
    }

    default boolean isNullConstant() {
        return false;
    }
}
