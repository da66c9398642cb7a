package org.cbug.analyzer.prepwork.lattice;

import org.cbug.analyzer.prepwork.cfg.CFGNode;
import org.cbug.analyzer.prepwork.cfg.ControlFlowGraph;

import java.util.List;

/*
stable facts per node; unreached nodes keep the lattice's top as entry and exit fact
 */
public class DataflowResult<F> {
    private final ControlFlowGraph cfg;
    private final List<F> entryFacts;
    private final List<F> exitFacts;
    private final boolean[] reached;
    private final int iterations;

    DataflowResult(ControlFlowGraph cfg, List<F> entryFacts, List<F> exitFacts, boolean[] reached, int iterations) {
        this.cfg = cfg;
        this.entryFacts = entryFacts;
        this.exitFacts = exitFacts;
        this.reached = reached;
        this.iterations = iterations;
    }

    public ControlFlowGraph cfg() {
        return cfg;
    }

    public F entryFact(CFGNode node) {
        return entryFacts.get(node.id());
    }

    public F exitFact(CFGNode node) {
        return exitFacts.get(node.id());
    }

    public boolean isReached(CFGNode node) {
        return reached[node.id()];
    }

    public int iterations() {
        return iterations;
    }
}
