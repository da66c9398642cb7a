package org.cbug.analyzer.checkers.memory;

import org.cbug.analyzer.common.Category;
import org.cbug.analyzer.common.Issue;
import org.cbug.analyzer.common.Severity;
import org.cbug.analyzer.common.SourceLocation;
import org.cbug.analyzer.common.Suggestion;
import org.cbug.analyzer.prepwork.StandardLibrary;
import org.cbug.analyzer.prepwork.callgraph.CallSummaries;
import org.cbug.analyzer.prepwork.cfg.*;
import org.cbug.analyzer.prepwork.lattice.TransferFunction;
import org.cbug.analyzer.syntax.StorageKind;
import org.cbug.analyzer.syntax.Symbol;
import org.cbug.analyzer.syntax.TypeCategory;
import org.cbug.analyzer.syntax.expression.*;

import java.util.ArrayList;
import java.util.List;

/**
 * Transfer function of the memory-lifecycle analysis. The same walk over a node's elements is used while
 * solving, where it only computes facts, and afterwards to replay each reached node on its stable entry fact,
 * where it also reports the dereferences, frees and calls that find a pointer in a bad state.
 * <p>
 * Branch conditions on pointers refine the facts along the outgoing edges: the side on which the pointer
 * is known to be null sees NULL, the other side loses a contradicting NULL.
 */
public class MemoryTransfer implements TransferFunction<PointerFact> {

    private final CallSummaries callSummaries;

    public MemoryTransfer(CallSummaries callSummaries) {
        this.callSummaries = callSummaries;
    }

    @Override
    public PointerFact apply(CFGNode node, PointerFact entry) {
        Walker walker = new Walker(entry, null);
        node.elements().forEach(walker::element);
        return walker.fact;
    }

    @Override
    public PointerFact applyEdge(CFGEdge edge, PointerFact exitOfSource) {
        Expression condition = edge.source().branchCondition();
        if (condition == null) return exitOfSource;
        return switch (edge.kind()) {
            case TRUE_BRANCH, LOOP_BACK -> refine(condition, true, exitOfSource);
            case FALSE_BRANCH -> refine(condition, false, exitOfSource);
            default -> exitOfSource;
        };
    }

    public List<Issue> replay(CFGNode node, PointerFact entry) {
        List<Issue> issues = new ArrayList<>();
        Walker walker = new Walker(entry, issues);
        node.elements().forEach(walker::element);
        return issues;
    }

    // ---------------------------------------------------------------------------------------------------------

    static PointerFact refine(Expression condition, boolean outcome, PointerFact fact) {
        Expression c = condition.withoutCasts();
        if (c instanceof UnaryExpression ue && ue.operator() == UnaryOperator.NOT) {
            return refine(ue.operand(), !outcome, fact);
        }
        if (c instanceof BinaryExpression be) {
            switch (be.operator()) {
                case AND:
                    return outcome ? refine(be.rhs(), true, refine(be.lhs(), true, fact)) : fact;
                case OR:
                    return outcome ? fact : refine(be.rhs(), false, refine(be.lhs(), false, fact));
                case EQUALS:
                case NOT_EQUALS: {
                    boolean nullSide = (be.operator() == BinaryOperator.EQUALS) == outcome;
                    if (be.rhs().isNullConstant()) return refinePointer(be.lhs(), nullSide, fact);
                    if (be.lhs().isNullConstant()) return refinePointer(be.rhs(), nullSide, fact);
                    return fact;
                }
                default:
                    return fact;
            }
        }
        return refinePointer(c, !outcome, fact);
    }

    private static PointerFact refinePointer(Expression expression, boolean isNull, PointerFact fact) {
        Symbol symbol = assignedVariable(expression);
        if (symbol == null) return fact;
        PointerValue value = fact.get(symbol);
        if (value.is(PointerState.TOP) || value.is(PointerState.UNINITIALIZED)) return fact;
        if (isNull) return fact.with(symbol, PointerValue.NULL);
        return value.is(PointerState.NULL) ? fact.with(symbol, PointerValue.UNKNOWN) : fact;
    }

    /*
    the pointer variable an expression denotes, looking through casts and through plain assignments
     */
    private static Symbol assignedVariable(Expression expression) {
        Expression e = expression.withoutCasts();
        if (e instanceof AssignmentExpression ae && ae.isPlain()) return assignedVariable(ae.target());
        return pointerVariable(e);
    }

    private static Symbol pointerVariable(Expression expression) {
        if (expression.withoutCasts() instanceof VariableExpression ve && ve.symbol().isPointer()) {
            return ve.symbol();
        }
        return null;
    }

    /*
    the variable a dereferenced expression is based on: p in *p, *(p + 1), p[i], p->f
     */
    private static Symbol dereferencedVariable(Expression expression) {
        Expression e = expression.withoutCasts();
        if (e instanceof BinaryExpression be
            && (be.operator() == BinaryOperator.ADD || be.operator() == BinaryOperator.SUBTRACT)
            && be.lhs().type().isPointerLike()) {
            return dereferencedVariable(be.lhs());
        }
        return pointerVariable(e);
    }

    private class Walker {
        private PointerFact fact;
        // null while solving
        private final List<Issue> issues;

        Walker(PointerFact fact, List<Issue> issues) {
            this.fact = fact;
            this.issues = issues;
        }

        void element(CFGElement element) {
            if (element instanceof DeclarationElement de) {
                declaration(de);
            } else if (element instanceof ExpressionElement ee) {
                eval(ee.expression());
            } else if (element instanceof ConditionElement ce) {
                eval(ce.condition());
            } else if (element instanceof ReturnElement re) {
                if (re.value() != null) {
                    eval(re.value());
                    Symbol returned = pointerVariable(re.value());
                    if (returned != null && fact.get(returned).is(PointerState.UNINITIALIZED)) {
                        report(Category.WILD_POINTER, Severity.WARNING, "Pointer '" + returned.name()
                                                                        + "' is returned before it is initialized",
                                re.location(), initializeSuggestion(returned));
                    }
                }
            } else if (element instanceof UnknownEffectElement ue) {
                if (ue.touchesEverything()) {
                    fact = fact.map((s, v) -> PointerValue.UNKNOWN);
                } else {
                    ue.expressions().forEach(e -> e.visit(sub -> {
                        if (sub instanceof VariableExpression ve && ve.symbol().isPointer()) {
                            fact = fact.with(ve.symbol(), PointerValue.UNKNOWN);
                        }
                        return true;
                    }));
                }
            } else {
                throw new UnsupportedOperationException("Unknown element " + element.getClass());
            }
        }

        private void declaration(DeclarationElement de) {
            Symbol symbol = de.symbol();
            Expression initializer = de.initializer();
            if (initializer != null) eval(initializer);
            if (!symbol.isPointer()) return;
            if (initializer == null) {
                fact = fact.with(symbol, symbol.storage() == StorageKind.STATIC_LOCAL
                        ? PointerValue.NULL : PointerValue.UNINITIALIZED);
            } else {
                assign(symbol, initializer);
            }
        }

        /*
        a copy of an allocated pointer shares its allocation sites; freeing either alias settles them
         */
        private void assign(Symbol target, Expression value) {
            fact = fact.with(target, valueOf(value));
        }

        private PointerValue valueOf(Expression expression) {
            Expression e = expression.withoutCasts();
            if (e.isNullConstant()) return PointerValue.NULL;
            if (e instanceof StringLiteral) return PointerValue.VALID;
            if (e instanceof UnaryExpression ue && ue.operator() == UnaryOperator.ADDRESS_OF) {
                return PointerValue.VALID;
            }
            if (e instanceof VariableExpression ve) {
                Symbol symbol = ve.symbol();
                if (symbol.type().isArray() || symbol.type().category() == TypeCategory.FUNCTION) {
                    return PointerValue.VALID;
                }
                if (symbol.isPointer()) {
                    PointerValue value = fact.get(symbol);
                    return value.is(PointerState.TOP) ? PointerValue.UNKNOWN : value;
                }
                return PointerValue.UNKNOWN;
            }
            if (e instanceof CallExpression ce && callSummaries.isAllocator(ce.callee())) {
                return PointerValue.allocated(ce.location());
            }
            if (e instanceof AssignmentExpression ae && ae.isPlain()) return valueOf(ae.target());
            if (e instanceof ConditionalExpression ce) return valueOf(ce.ifTrue()).join(valueOf(ce.ifFalse()));
            if (e instanceof CommaExpression ce) return valueOf(ce.expressions().get(ce.expressions().size() - 1));
            return PointerValue.UNKNOWN;
        }

        /*
        evaluates the expression for its effects, in evaluation order
         */
        private void eval(Expression expression) {
            if (expression instanceof SizeofExpression) return;
            if (expression instanceof AssignmentExpression ae) {
                evalTarget(ae.target());
                eval(ae.value());
                Symbol target = pointerVariable(ae.target());
                if (target != null && ae.isPlain()) {
                    assign(target, ae.value());
                }
            } else if (expression instanceof UnaryExpression ue) {
                if (ue.operator() == UnaryOperator.ADDRESS_OF) {
                    addressOf(ue.operand());
                } else {
                    eval(ue.operand());
                    if (ue.isDereference()) checkDereference(ue.operand(), ue.location());
                }
            } else if (expression instanceof IndexExpression ie) {
                eval(ie.base());
                eval(ie.index());
                checkDereference(ie.base(), ie.location());
            } else if (expression instanceof MemberExpression me) {
                eval(me.base());
                if (me.arrow()) checkDereference(me.base(), me.location());
            } else if (expression instanceof BinaryExpression be && be.operator().isLogical()) {
                eval(be.lhs());
                PointerFact afterLhs = fact;
                boolean and = be.operator() == BinaryOperator.AND;
                fact = refine(be.lhs(), and, afterLhs);
                eval(be.rhs());
                fact = fact.join(refine(be.lhs(), !and, afterLhs));
            } else if (expression instanceof ConditionalExpression ce) {
                eval(ce.condition());
                PointerFact afterCondition = fact;
                fact = refine(ce.condition(), true, afterCondition);
                eval(ce.ifTrue());
                PointerFact afterTrue = fact;
                fact = refine(ce.condition(), false, afterCondition);
                eval(ce.ifFalse());
                fact = afterTrue.join(fact);
            } else if (expression instanceof CallExpression ce) {
                call(ce);
            } else {
                expression.subExpressions().forEach(this::eval);
            }
        }

        private void evalTarget(Expression target) {
            if (!(target.withoutCasts() instanceof VariableExpression)) eval(target);
        }

        /*
        &p gives the pointer away; &p[i], &p->f and &*p compute an address without accessing memory
         */
        private void addressOf(Expression operand) {
            Expression e = operand.withoutCasts();
            if (e instanceof VariableExpression ve) {
                if (ve.symbol().isPointer()) fact = fact.with(ve.symbol(), PointerValue.UNKNOWN);
            } else if (e instanceof IndexExpression ie) {
                eval(ie.base());
                eval(ie.index());
            } else if (e instanceof MemberExpression me) {
                if (me.arrow()) eval(me.base());
                else addressOf(me.base());
            } else if (e instanceof UnaryExpression ue && ue.isDereference()) {
                eval(ue.operand());
            } else {
                eval(e);
            }
        }

        private void checkDereference(Expression pointer, SourceLocation location) {
            Symbol symbol = dereferencedVariable(pointer);
            if (symbol != null) checkState(symbol, location, null);
        }

        private void checkState(Symbol symbol, SourceLocation location, String function) {
            String name = symbol.name();
            String by = function == null ? "" : " by '" + function + "'";
            switch (fact.get(symbol).state()) {
                case UNINITIALIZED -> report(Category.WILD_POINTER, Severity.ERROR,
                        "Pointer '" + name + "' is dereferenced" + by + " before it is initialized", location,
                        initializeSuggestion(symbol));
                case NULL -> report(Category.NULL_POINTER_DEREFERENCE, Severity.ERROR,
                        "Pointer '" + name + "' is NULL when it is dereferenced" + by, location,
                        new Suggestion("Check for NULL", "Test '" + name + "' against NULL before using it."));
                case FREED -> report(Category.USE_AFTER_FREE, Severity.ERROR,
                        "Pointer '" + name + "' is used" + by + " after it was freed", location,
                        new Suggestion("Reset after free", "Set '" + name
                                                           + "' to NULL after freeing it, and do not use it afterwards."));
                default -> {
                }
            }
        }

        private void call(CallExpression ce) {
            if (ce.calleeExpression() != null) eval(ce.calleeExpression());
            ce.arguments().forEach(this::eval);
            String function = ce.callee();
            String calleeName = function == null ? String.valueOf(ce.calleeExpression()) : function;
            int freed = callSummaries.freedArgument(function);
            boolean recognized = function != null && (StandardLibrary.isReadOnly(function)
                                                      || callSummaries.isAllocator(function)
                                                      || StandardLibrary.isDeallocator(function)
                                                      || StandardLibrary.isNoReturn(function));
            List<Expression> arguments = ce.arguments();
            for (int i = 0; i < arguments.size(); i++) {
                Symbol symbol = pointerVariable(arguments.get(i));
                if (symbol == null) continue;
                if (i == freed) {
                    free(symbol, ce);
                } else if (function != null && StandardLibrary.dereferencesArgument(function, i)) {
                    checkState(symbol, ce.location(), function);
                } else if (!recognized) {
                    if (fact.get(symbol).is(PointerState.UNINITIALIZED)) {
                        report(Category.WILD_POINTER, Severity.WARNING, "Pointer '" + symbol.name()
                                                                        + "' is passed to '" + calleeName
                                                                        + "' before it is initialized",
                                ce.location(), initializeSuggestion(symbol));
                    } else if (fact.get(symbol).is(PointerState.NULL)) {
                        report(Category.NULL_POINTER_DEREFERENCE, Severity.WARNING, "Pointer '" + symbol.name()
                                                                                    + "' is NULL when it is passed to '"
                                                                                    + calleeName + "'",
                                ce.location(), new Suggestion("Check for NULL", "Make sure '" + symbol.name()
                                                                                + "' holds a valid address before the call."));
                    }
                    fact = fact.with(symbol, PointerValue.UNKNOWN);
                }
            }
            if (!recognized) {
                // the callee may assign any pointer that outlives it
                fact = fact.map((s, v) -> s.storage().outlivesFunction() ? PointerValue.UNKNOWN : v);
            }
        }

        private void free(Symbol symbol, CallExpression ce) {
            String name = symbol.name();
            switch (fact.get(symbol).state()) {
                case FREED -> report(Category.DOUBLE_FREE, Severity.ERROR, "Pointer '" + name + "' is freed twice",
                        ce.location(), new Suggestion("Free once", "Set '" + name
                                                                   + "' to NULL after the first free."));
                case UNINITIALIZED -> report(Category.WILD_POINTER, Severity.ERROR, "Pointer '" + name
                                                                                     + "' is freed before it is initialized",
                        ce.location(), initializeSuggestion(symbol));
                case NULL, TOP -> {
                }
                case ALLOCATED -> {
                    PointerValue freed = fact.get(symbol);
                    fact = fact.map((s, v) -> !s.equals(symbol) && v.is(PointerState.ALLOCATED)
                                              && v.sharesSiteWith(freed) ? PointerValue.UNKNOWN : v);
                    fact = fact.with(symbol, PointerValue.FREED);
                }
                default -> fact = fact.with(symbol, PointerValue.FREED);
            }
        }

        private void report(Category category, Severity severity, String message, SourceLocation location,
                            Suggestion suggestion) {
            if (issues != null) issues.add(new Issue(category, severity, message, location, suggestion));
        }
    }

    private static Suggestion initializeSuggestion(Symbol symbol) {
        return new Suggestion("Initialize the pointer", "Initialize '" + symbol.name()
                                                        + "' with NULL or a valid address when it is declared.");
    }
}
