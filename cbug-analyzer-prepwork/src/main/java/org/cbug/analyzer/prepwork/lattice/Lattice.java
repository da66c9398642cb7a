package org.cbug.analyzer.prepwork.lattice;

/**
 * A join semi-lattice of facts. {@link #top()} is the fact of a program point that has not been reached
 * yet; it is the identity of {@link #join}. Facts must implement {@code equals}.
 */
public interface Lattice<F> {

    F top();

    F join(F f1, F f2);
}
