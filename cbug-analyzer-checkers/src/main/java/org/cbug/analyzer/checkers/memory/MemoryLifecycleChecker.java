package org.cbug.analyzer.checkers.memory;

import org.cbug.analyzer.checkers.Checker;
import org.cbug.analyzer.common.*;
import org.cbug.analyzer.prepwork.AnalysisContext;
import org.cbug.analyzer.prepwork.cfg.CFGEdge;
import org.cbug.analyzer.prepwork.cfg.CFGNode;
import org.cbug.analyzer.prepwork.cfg.ControlFlowGraph;
import org.cbug.analyzer.prepwork.lattice.DataflowResult;
import org.cbug.analyzer.prepwork.lattice.WorklistSolver;
import org.cbug.analyzer.syntax.FunctionDefinition;
import org.cbug.analyzer.syntax.StorageKind;
import org.cbug.analyzer.syntax.Symbol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/*
wild pointers, null dereferences, use after free, double free and memory leaks, one function at a time

parameters and global pointers enter as UNKNOWN; leaks are read from the facts flowing into EXIT
 */
public class MemoryLifecycleChecker implements Checker {
    private static final Logger LOGGER = LoggerFactory.getLogger(MemoryLifecycleChecker.class);

    @Override
    public String name() {
        return "memory-lifecycle";
    }

    @Override
    public List<Issue> run(AnalysisContext context) {
        List<Issue> issues = new ArrayList<>();
        for (ControlFlowGraph cfg : context.cfgs()) {
            issues.addAll(doFunction(context, cfg));
        }
        return issues;
    }

    List<Issue> doFunction(AnalysisContext context, ControlFlowGraph cfg) {
        MemoryTransfer transfer = new MemoryTransfer(context.callSummaries());
        WorklistSolver<PointerFact> solver = new WorklistSolver<>(new PointerLattice(), transfer,
                context.maxIterationsPerNode());
        DataflowResult<PointerFact> result = solver.solve(cfg, entryFact(context, cfg.function()));

        List<Issue> issues = new ArrayList<>();
        for (CFGNode node : cfg.nodes()) {
            if (result.isReached(node)) {
                issues.addAll(transfer.replay(node, result.entryFact(node)));
            }
        }
        issues.addAll(leaks(context, cfg, transfer, result));
        LOGGER.debug("Memory lifecycle of {}: {} issue(s)", cfg.function().name(), issues.size());
        return issues;
    }

    private static PointerFact entryFact(AnalysisContext context, FunctionDefinition function) {
        PointerFact fact = PointerFact.EMPTY;
        for (Symbol parameter : function.parameters()) {
            if (parameter.isPointer()) fact = fact.with(parameter, PointerValue.UNKNOWN);
        }
        for (Symbol global : context.symbolTable().globals().filter(Symbol::isPointer).toList()) {
            fact = fact.with(global, PointerValue.UNKNOWN);
        }
        return fact;
    }

    /*
    an allocation site leaks when, on some path to EXIT, local pointers still hold it and none of the pointers
    holding it escapes; aliases share sites, so each site is reported once, on the first pointer declared
     */
    private static List<Issue> leaks(AnalysisContext context, ControlFlowGraph cfg, MemoryTransfer transfer,
                                     DataflowResult<PointerFact> result) {
        Set<Symbol> escapes = context.escapes(cfg.function());
        Map<SourceLocation, Symbol> leaked = new LinkedHashMap<>();
        for (CFGEdge edge : cfg.exit().predecessors()) {
            if (!result.isReached(edge.source())) continue;
            PointerFact fact = transfer.applyEdge(edge, result.exitFact(edge.source()));
            Set<SourceLocation> kept = new HashSet<>();
            Map<SourceLocation, Symbol> candidates = new LinkedHashMap<>();
            for (Symbol symbol : fact.symbols()) {
                PointerValue value = fact.get(symbol);
                if (!value.is(PointerState.ALLOCATED)) continue;
                if ((symbol.storage() == StorageKind.LOCAL || symbol.storage() == StorageKind.PARAMETER)
                    && !escapes.contains(symbol)) {
                    value.allocationSites().forEach(site -> candidates.putIfAbsent(site, symbol));
                } else {
                    kept.addAll(value.allocationSites());
                }
            }
            candidates.forEach((site, symbol) -> {
                if (!kept.contains(site)) leaked.putIfAbsent(site, symbol);
            });
        }
        return leaked.entrySet().stream().map(e -> leak(e.getValue(), e.getKey())).toList();
    }

    private static Issue leak(Symbol symbol, SourceLocation site) {
        return new Issue(Category.MEMORY_LEAK, Severity.WARNING, "Memory allocated at line " + site.line()
                                                                 + " and assigned to '" + symbol.name()
                                                                 + "' is never freed", symbol.location(),
                new Suggestion("Free the memory", "Call free(" + symbol.name()
                                                  + ") on every path that leaves the function."));
    }
}
