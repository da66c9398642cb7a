package org.cbug.analyzer.prepwork.cfg;

import org.cbug.analyzer.syntax.ConstantFolder;
import org.cbug.analyzer.syntax.Symbol;
import org.cbug.analyzer.syntax.expression.*;
import org.cbug.analyzer.syntax.statement.LoopStatement;

import java.util.*;

/*
natural loops: the nodes that reach a closing edge of the header backwards, and that the header reaches forwards
 */
public class ComputeLoopRegions {

    record LoopStart(LoopStatement statement, CFGNode header, CFGNode conditionNode, CFGNode bodyEntry) {
    }

    private ComputeLoopRegions() {
    }

    static LoopRegion go(LoopStart start) {
        CFGNode header = start.header();
        Set<CFGNode> forward = forwardFrom(header);
        Set<CFGNode> body = new TreeSet<>(Comparator.comparingInt(CFGNode::id));
        body.add(header);
        Deque<CFGNode> stack = new ArrayDeque<>();
        header.predecessors().stream()
                .filter(e -> e.kind().closesLoop() && forward.contains(e.source()))
                .forEach(e -> stack.push(e.source()));
        while (!stack.isEmpty()) {
            CFGNode node = stack.pop();
            if (body.add(node)) {
                for (CFGEdge edge : node.predecessors()) {
                    if (forward.contains(edge.source()) && !body.contains(edge.source())) stack.push(edge.source());
                }
            }
        }
        List<CFGEdge> exitEdges = new ArrayList<>();
        for (CFGNode node : body) {
            node.successors().stream().filter(e -> !body.contains(e.target())).forEach(exitEdges::add);
        }
        Expression condition = start.statement().condition();
        Set<Symbol> conditionVariables = new LinkedHashSet<>();
        if (condition != null) {
            condition.visit(e -> {
                if (e instanceof VariableExpression ve) conditionVariables.add(ve.symbol());
                return !(e instanceof SizeofExpression);
            });
        }
        List<Write> writes = new ArrayList<>();
        for (CFGNode node : body) {
            for (CFGElement element : node.elements()) {
                for (Expression expression : element.expressions()) {
                    expression.visit(e -> {
                        Symbol written = writtenVariable(e);
                        if (written != null && conditionVariables.contains(written)) {
                            writes.add(new Write(written, e, node));
                        }
                        return true;
                    });
                }
            }
        }
        return new LoopRegion(start.statement(), header, start.conditionNode(), start.bodyEntry(), condition, body,
                exitEdges, conditionVariables, writes);
    }

    private static Set<CFGNode> forwardFrom(CFGNode header) {
        Set<CFGNode> seen = new HashSet<>();
        Deque<CFGNode> stack = new ArrayDeque<>();
        stack.push(header);
        while (!stack.isEmpty()) {
            CFGNode node = stack.pop();
            if (seen.add(node)) {
                node.successors().forEach(e -> stack.push(e.target()));
            }
        }
        return seen;
    }

    /**
     * The variable that the expression itself writes, or null. Self-assignments and adding or
     * subtracting zero do not count; taking the address of a variable does.
     */
    public static Symbol writtenVariable(Expression e) {
        if (e instanceof AssignmentExpression ae && ae.target().withoutCasts() instanceof VariableExpression ve) {
            Expression value = ae.value().withoutCasts();
            if (ae.isPlain() && value instanceof VariableExpression source && source.symbol().equals(ve.symbol())) {
                return null;
            }
            if ((ae.compoundOperator() == BinaryOperator.ADD || ae.compoundOperator() == BinaryOperator.SUBTRACT)) {
                Number n = ConstantFolder.fold(ae.value());
                if (n != null && ConstantFolder.isZero(n)) return null;
            }
            return ve.symbol();
        }
        if (e instanceof UnaryExpression ue && ue.operand().withoutCasts() instanceof VariableExpression ve
            && (ue.operator().isIncrementOrDecrement() || ue.operator() == UnaryOperator.ADDRESS_OF)) {
            return ve.symbol();
        }
        return null;
    }
}
