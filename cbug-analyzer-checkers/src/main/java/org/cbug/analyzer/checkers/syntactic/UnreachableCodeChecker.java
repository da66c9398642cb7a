package org.cbug.analyzer.checkers.syntactic;

import org.cbug.analyzer.checkers.Checker;
import org.cbug.analyzer.common.Category;
import org.cbug.analyzer.common.Issue;
import org.cbug.analyzer.common.Severity;
import org.cbug.analyzer.common.SourceLocation;
import org.cbug.analyzer.common.Suggestion;
import org.cbug.analyzer.prepwork.AnalysisContext;
import org.cbug.analyzer.prepwork.cfg.CFGEdge;
import org.cbug.analyzer.prepwork.cfg.CFGElement;
import org.cbug.analyzer.prepwork.cfg.CFGNode;
import org.cbug.analyzer.prepwork.cfg.ControlFlowGraph;

import java.util.*;

/*
nodes that cannot be reached from the entry; dead nodes connected by edges form one region,
reported once at its earliest element
 */
public class UnreachableCodeChecker implements Checker {

    @Override
    public String name() {
        return "unreachable-code";
    }

    @Override
    public List<Issue> run(AnalysisContext context) {
        List<Issue> issues = new ArrayList<>();
        for (ControlFlowGraph cfg : context.cfgs()) {
            for (Set<CFGNode> region : deadRegions(cfg)) {
                region.stream()
                        .flatMap(n -> n.elements().stream())
                        .map(CFGElement::location)
                        .min(Comparator.naturalOrder())
                        .ifPresent(location -> issues.add(issue(location)));
            }
        }
        return issues;
    }

    static List<Set<CFGNode>> deadRegions(ControlFlowGraph cfg) {
        Set<CFGNode> dead = new LinkedHashSet<>();
        for (CFGNode node : cfg.nodes()) {
            if (node != cfg.exit() && !cfg.isReachable(node)) dead.add(node);
        }
        List<Set<CFGNode>> regions = new ArrayList<>();
        Set<CFGNode> assigned = new HashSet<>();
        for (CFGNode start : dead) {
            if (assigned.contains(start)) continue;
            Set<CFGNode> region = new TreeSet<>(Comparator.comparingInt(CFGNode::id));
            Deque<CFGNode> stack = new ArrayDeque<>();
            stack.push(start);
            while (!stack.isEmpty()) {
                CFGNode node = stack.pop();
                if (!dead.contains(node) || !assigned.add(node)) continue;
                region.add(node);
                node.successors().stream().map(CFGEdge::target).forEach(stack::push);
                node.predecessors().stream().map(CFGEdge::source).forEach(stack::push);
            }
            regions.add(region);
        }
        return regions;
    }

    private static Issue issue(SourceLocation location) {
        return new Issue(Category.UNREACHABLE_CODE, Severity.WARNING, "Unreachable code", location,
                new Suggestion("Remove or restructure", "Delete the code, or change the control flow before it "
                                                        + "so that it can be executed."));
    }
}
