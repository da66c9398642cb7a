package org.cbug.analyzer.prepwork.cfg;

import org.cbug.analyzer.syntax.FunctionDefinition;

import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * The control flow graph of one function: one ENTRY node, one synthetic EXIT node, and the loop regions
 * found while building. Immutable once built.
 */
public interface ControlFlowGraph {

    FunctionDefinition function();

    CFGNode entry();

    CFGNode exit();

    // ordered by id
    List<CFGNode> nodes();

    CFGNode node(int id);

    List<LoopRegion> loopRegions();

    Set<CFGNode> reachable();

    default boolean isReachable(CFGNode node) {
        return reachable().contains(node);
    }

    default Stream<CFGEdge> edges() {
        return nodes().stream().flatMap(n -> n.successors().stream());
    }

    default Stream<CFGElement> elements() {
        return nodes().stream().flatMap(n -> n.elements().stream());
    }

    default int size() {
        return nodes().size();
    }
}
