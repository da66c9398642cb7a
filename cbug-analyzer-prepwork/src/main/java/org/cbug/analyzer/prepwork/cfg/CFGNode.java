package org.cbug.analyzer.prepwork.cfg;

import org.cbug.analyzer.common.SourceLocation;
import org.cbug.analyzer.syntax.expression.Expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A basic block. Nodes are created and connected by the {@link ControlFlowBuilder}; afterwards they are
 * only read. Identity is the id, which is unique within one graph and reflects creation order.
 */
public class CFGNode {

    public enum Kind {
        ENTRY, EXIT, BASIC, BRANCH, LOOP_HEADER, SWITCH, UNKNOWN_EFFECT
    }

    private final int id;
    private final Kind kind;
    private final List<CFGElement> elements = new ArrayList<>();
    private final List<CFGEdge> successors = new ArrayList<>();
    private final List<CFGEdge> predecessors = new ArrayList<>();
    private boolean programExit;

    CFGNode(int id, Kind kind) {
        this.id = id;
        this.kind = kind;
    }

    void add(CFGElement element) {
        elements.add(element);
    }

    void setProgramExit() {
        programExit = true;
    }

    static CFGEdge connect(CFGNode source, CFGNode target, EdgeKind kind) {
        CFGEdge edge = new CFGEdge(source, target, kind);
        source.successors.add(edge);
        target.predecessors.add(edge);
        return edge;
    }

    public int id() {
        return id;
    }

    public Kind kind() {
        return kind;
    }

    public List<CFGElement> elements() {
        return Collections.unmodifiableList(elements);
    }

    public List<CFGEdge> successors() {
        return Collections.unmodifiableList(successors);
    }

    public List<CFGEdge> predecessors() {
        return Collections.unmodifiableList(predecessors);
    }

    /*
    true when the node ends with a call that terminates the program, such as exit or abort
     */
    public boolean isProgramExit() {
        return programExit;
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    public SourceLocation location() {
        return elements.isEmpty() ? null : elements.get(0).location();
    }

    /*
    the boolean condition decided by this node: only branch and loop header nodes have one,
    the selector of a switch is not a condition
     */
    public Expression branchCondition() {
        if ((kind == Kind.BRANCH || kind == Kind.LOOP_HEADER) && !elements.isEmpty()
            && elements.get(elements.size() - 1) instanceof ConditionElement ce) {
            return ce.condition();
        }
        return null;
    }

    @Override
    public String toString() {
        return id + ":" + kind + elements.stream().map(Object::toString).collect(Collectors.joining("; ", "[", "]"))
               + successors.stream().map(e -> e.kind().name().toLowerCase() + "->" + e.target().id())
                       .collect(Collectors.joining(", ", "{", "}"));
    }
}
