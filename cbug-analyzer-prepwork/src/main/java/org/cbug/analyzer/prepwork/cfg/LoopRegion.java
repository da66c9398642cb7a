package org.cbug.analyzer.prepwork.cfg;

import org.cbug.analyzer.syntax.Symbol;
import org.cbug.analyzer.syntax.expression.Expression;
import org.cbug.analyzer.syntax.statement.LoopStatement;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * One loop of a control flow graph.
 * <p>
 * The header is the target of the loop-back edges: the condition node for {@code while} and {@code for},
 * the first node of the body for {@code do ... while}. The body holds every node on a path from the
 * header back to itself, header included. Exit edges leave the body. The condition is null for
 * {@code for(;;)}; the body entry is null when the body can never be entered.
 */
public record LoopRegion(LoopStatement statement,
                         CFGNode header,
                         CFGNode conditionNode,
                         CFGNode bodyEntry,
                         Expression condition,
                         Set<CFGNode> body,
                         List<CFGEdge> exitEdges,
                         Set<Symbol> conditionVariables,
                         List<Write> writes) {

    public LoopRegion {
        body = Collections.unmodifiableSet(new LinkedHashSet<>(body));
        exitEdges = List.copyOf(exitEdges);
        conditionVariables = Collections.unmodifiableSet(new LinkedHashSet<>(conditionVariables));
        writes = List.copyOf(writes);
    }

    // a region without an edge back to the header executes its body at most once
    public boolean isCyclic() {
        return header.predecessors().stream().anyMatch(e -> e.kind().closesLoop() && body.contains(e.source()));
    }

    public boolean containsProgramExit() {
        return body.stream().anyMatch(CFGNode::isProgramExit);
    }

    public boolean contains(CFGNode node) {
        return body.contains(node);
    }

    public List<Write> writesTo(Symbol variable) {
        return writes.stream().filter(w -> w.variable().equals(variable)).toList();
    }

    @Override
    public String toString() {
        return "loop@" + statement.location().line() + " header " + header.id() + " body "
               + body.stream().map(n -> Integer.toString(n.id())).toList();
    }
}
