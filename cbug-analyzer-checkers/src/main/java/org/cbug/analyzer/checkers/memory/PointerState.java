package org.cbug.analyzer.checkers.memory;

public enum PointerState {
    UNINITIALIZED("uninitialized"),
    NULL("null"),
    ALLOCATED("allocated"),
    VALID("valid"),
    FREED("freed"),
    UNKNOWN("unknown"),
    // not reached yet; never stored in a fact
    TOP("top");

    public final String label;

    PointerState(String label) {
        this.label = label;
    }
}
