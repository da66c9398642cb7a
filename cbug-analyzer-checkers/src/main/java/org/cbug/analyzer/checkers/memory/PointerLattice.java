package org.cbug.analyzer.checkers.memory;

import org.cbug.analyzer.prepwork.lattice.Lattice;

/*
equal states join to themselves, different states to UNKNOWN, TOP is the identity
 */
public class PointerLattice implements Lattice<PointerFact> {

    @Override
    public PointerFact top() {
        return PointerFact.EMPTY;
    }

    @Override
    public PointerFact join(PointerFact f1, PointerFact f2) {
        return f1.join(f2);
    }
}
