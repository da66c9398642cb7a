package org.cbug.analyzer.prepwork.cfg;

public enum EdgeKind {
    UNCONDITIONAL, TRUE_BRANCH, FALSE_BRANCH, LOOP_BACK, BREAK, CONTINUE;

    public boolean closesLoop() {
        return this == LOOP_BACK || this == CONTINUE;
    }
}
