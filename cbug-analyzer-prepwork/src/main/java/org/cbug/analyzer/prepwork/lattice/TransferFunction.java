package org.cbug.analyzer.prepwork.lattice;

import org.cbug.analyzer.prepwork.cfg.CFGEdge;
import org.cbug.analyzer.prepwork.cfg.CFGNode;

public interface TransferFunction<F> {

    // the exit fact of the node, given its entry fact
    F apply(CFGNode node, F entry);

    /*
    refines the exit fact of the edge's source along the edge, e.g. with the outcome of a branch condition
     */
    default F applyEdge(CFGEdge edge, F exitOfSource) {
        return exitOfSource;
    }
}
