package org.cbug.analyzer.prepwork.lattice;

import org.cbug.analyzer.common.AnalyzerException;
import org.cbug.analyzer.prepwork.cfg.CFGEdge;
import org.cbug.analyzer.prepwork.cfg.CFGNode;
import org.cbug.analyzer.prepwork.cfg.ControlFlowGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Forward worklist solver. The entry node is seeded with the given fact; every other node's entry fact is
 * the join of the (edge-refined) exit facts of its reached predecessors. Nodes are taken from the worklist
 * in ascending id order, so results do not depend on hashing. Successors are re-queued only when a
 * node's exit fact changed.
 */
public class WorklistSolver<F> {
    private static final Logger LOGGER = LoggerFactory.getLogger(WorklistSolver.class);

    public static final int DEFAULT_MAX_ITERATIONS_PER_NODE = 10_000;

    private final Lattice<F> lattice;
    private final TransferFunction<F> transferFunction;
    private final int maxIterationsPerNode;

    public WorklistSolver(Lattice<F> lattice, TransferFunction<F> transferFunction) {
        this(lattice, transferFunction, DEFAULT_MAX_ITERATIONS_PER_NODE);
    }

    public WorklistSolver(Lattice<F> lattice, TransferFunction<F> transferFunction, int maxIterationsPerNode) {
        if (maxIterationsPerNode <= 0) throw new IllegalArgumentException("Iteration ceiling must be positive");
        this.lattice = lattice;
        this.transferFunction = transferFunction;
        this.maxIterationsPerNode = maxIterationsPerNode;
    }

    public DataflowResult<F> solve(ControlFlowGraph cfg, F entryFact) {
        int n = cfg.size();
        List<F> entryFacts = new ArrayList<>(n);
        List<F> exitFacts = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            entryFacts.add(lattice.top());
            exitFacts.add(lattice.top());
        }
        boolean[] reached = new boolean[n];
        long ceiling = (long) maxIterationsPerNode * n;
        int iterations = 0;

        TreeSet<Integer> worklist = new TreeSet<>();
        worklist.add(cfg.entry().id());
        while (!worklist.isEmpty()) {
            if (++iterations > ceiling) {
                throw new AnalyzerException(cfg.function().name(), "No fixpoint after " + ceiling
                                                                   + " iterations; transfer function not monotone?");
            }
            CFGNode node = cfg.node(worklist.pollFirst());
            F entry;
            if (node == cfg.entry()) {
                entry = entryFact;
            } else {
                entry = lattice.top();
                for (CFGEdge edge : node.predecessors()) {
                    int source = edge.source().id();
                    if (reached[source]) {
                        entry = lattice.join(entry, transferFunction.applyEdge(edge, exitFacts.get(source)));
                    }
                }
            }
            entryFacts.set(node.id(), entry);
            F exit = transferFunction.apply(node, entry);
            if (!reached[node.id()] || !Objects.equals(exit, exitFacts.get(node.id()))) {
                reached[node.id()] = true;
                exitFacts.set(node.id(), exit);
                for (CFGEdge edge : node.successors()) {
                    worklist.add(edge.target().id());
                }
            }
        }
        LOGGER.debug("Solved {} in {} iterations over {} nodes", cfg.function().name(), iterations, n);
        return new DataflowResult<>(cfg, entryFacts, exitFacts, reached, iterations);
    }
}
