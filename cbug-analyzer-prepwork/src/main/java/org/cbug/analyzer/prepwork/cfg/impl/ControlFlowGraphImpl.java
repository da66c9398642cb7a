package org.cbug.analyzer.prepwork.cfg.impl;

import org.cbug.analyzer.prepwork.cfg.CFGEdge;
import org.cbug.analyzer.prepwork.cfg.CFGNode;
import org.cbug.analyzer.prepwork.cfg.ControlFlowGraph;
import org.cbug.analyzer.prepwork.cfg.LoopRegion;
import org.cbug.analyzer.syntax.FunctionDefinition;

import java.util.*;
import java.util.stream.Collectors;

public class ControlFlowGraphImpl implements ControlFlowGraph {
    private final FunctionDefinition function;
    private final CFGNode entry;
    private final CFGNode exit;
    private final List<CFGNode> nodes;
    private final List<LoopRegion> loopRegions;
    private final Set<CFGNode> reachable;

    public ControlFlowGraphImpl(FunctionDefinition function, CFGNode entry, CFGNode exit, List<CFGNode> nodes,
                                List<LoopRegion> loopRegions) {
        this.function = function;
        this.entry = entry;
        this.exit = exit;
        this.nodes = List.copyOf(nodes);
        this.loopRegions = List.copyOf(loopRegions);
        this.reachable = Collections.unmodifiableSet(computeReachable(entry));
        assert this.nodes.get(entry.id()) == entry;
    }

    private static Set<CFGNode> computeReachable(CFGNode entry) {
        Set<CFGNode> set = new LinkedHashSet<>();
        Deque<CFGNode> stack = new ArrayDeque<>();
        stack.push(entry);
        while (!stack.isEmpty()) {
            CFGNode node = stack.pop();
            if (set.add(node)) {
                for (CFGEdge edge : node.successors()) {
                    stack.push(edge.target());
                }
            }
        }
        return set;
    }

    @Override
    public FunctionDefinition function() {
        return function;
    }

    @Override
    public CFGNode entry() {
        return entry;
    }

    @Override
    public CFGNode exit() {
        return exit;
    }

    @Override
    public List<CFGNode> nodes() {
        return nodes;
    }

    @Override
    public CFGNode node(int id) {
        return nodes.get(id);
    }

    @Override
    public List<LoopRegion> loopRegions() {
        return loopRegions;
    }

    @Override
    public Set<CFGNode> reachable() {
        return reachable;
    }

    @Override
    public String toString() {
        return function.name() + ":\n" + nodes.stream().map(CFGNode::toString).collect(Collectors.joining("\n"));
    }
}
