package org.cbug.analyzer.prepwork.cfg;

public record CFGEdge(CFGNode source, CFGNode target, EdgeKind kind) {

    @Override
    public String toString() {
        return source.id() + "-" + kind.name().toLowerCase() + "->" + target.id();
    }
}
