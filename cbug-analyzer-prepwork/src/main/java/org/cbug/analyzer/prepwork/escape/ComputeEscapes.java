package org.cbug.analyzer.prepwork.escape;

import org.cbug.analyzer.syntax.FunctionDefinition;
import org.cbug.analyzer.syntax.StorageKind;
import org.cbug.analyzer.syntax.Symbol;
import org.cbug.analyzer.syntax.expression.*;
import org.cbug.analyzer.syntax.statement.*;

import java.util.LinkedHashSet;
import java.util.Set;

/*
Structural escape analysis of pointer variables.

A pointer escapes the function when its value is returned, stored into a struct member, an array slot,
the target of a dereference, a global or a static local, or placed in an initializer list.
Ownership of an escaping pointer is assumed to be transferred; no leak is reported for it.
Flow-insensitive: one escape anywhere in the body is enough.
 */
public class ComputeEscapes {

    private ComputeEscapes() {
    }

    public static Set<Symbol> go(FunctionDefinition function) {
        Set<Symbol> escapes = new LinkedHashSet<>();
        go(function.body(), escapes);
        return escapes;
    }

    private static void go(Statement statement, Set<Symbol> escapes) {
        if (statement instanceof ReturnStatement rs) {
            if (rs.value() != null) escapes.addAll(pointersCarriedBy(rs.value()));
        } else if (statement instanceof DeclarationStatement ds) {
            for (VariableDeclaration vd : ds.declarations()) {
                if (vd.hasInitializer() && vd.symbol().storage().outlivesFunction()) {
                    escapes.addAll(pointersCarriedBy(vd.initializer()));
                }
            }
        } else if (statement instanceof UnknownStatement us) {
            us.expressions().forEach(e -> escapes.addAll(pointersCarriedBy(e)));
        }
        for (Expression expression : statement.expressions()) {
            expression.visit(e -> {
                if (e instanceof AssignmentExpression ae && ae.isPlain() && storesOutsideFunction(ae.target())) {
                    escapes.addAll(pointersCarriedBy(ae.value()));
                } else if (e instanceof InitializerList il) {
                    il.elements().forEach(element -> escapes.addAll(pointersCarriedBy(element)));
                }
                return !(e instanceof SizeofExpression);
            });
        }
        statement.subStatements().forEach(s -> go(s, escapes));
    }

    /*
    a local or parameter variable is the only target that keeps a value inside the function
     */
    private static boolean storesOutsideFunction(Expression target) {
        Expression t = target.withoutCasts();
        if (t instanceof VariableExpression ve) {
            StorageKind storage = ve.symbol().storage();
            return storage.outlivesFunction();
        }
        return t instanceof MemberExpression || t instanceof IndexExpression
               || t instanceof UnaryExpression ue && ue.isDereference();
    }

    /**
     * The pointer variables whose value the expression may evaluate to: {@code p}, {@code (T *) p},
     * {@code p + 1}, either branch of a conditional, the last element of a comma expression, the value of
     * a chained assignment.
     */
    public static Set<Symbol> pointersCarriedBy(Expression expression) {
        Set<Symbol> set = new LinkedHashSet<>();
        collect(expression, set);
        return set;
    }

    private static void collect(Expression expression, Set<Symbol> set) {
        Expression e = expression.withoutCasts();
        if (e instanceof VariableExpression ve) {
            if (ve.symbol().type().isPointerLike()) set.add(ve.symbol());
        } else if (e instanceof BinaryExpression be
                   && (be.operator() == BinaryOperator.ADD || be.operator() == BinaryOperator.SUBTRACT)) {
            if (be.lhs().type().isPointerLike()) collect(be.lhs(), set);
            if (be.rhs().type().isPointerLike() && be.operator() == BinaryOperator.ADD) collect(be.rhs(), set);
        } else if (e instanceof ConditionalExpression ce) {
            collect(ce.ifTrue(), set);
            collect(ce.ifFalse(), set);
        } else if (e instanceof CommaExpression ce) {
            collect(ce.expressions().get(ce.expressions().size() - 1), set);
        } else if (e instanceof AssignmentExpression ae && ae.isPlain()) {
            collect(ae.value(), set);
        }
    }
}
