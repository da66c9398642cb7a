package org.cbug.analyzer.prepwork;

import org.cbug.analyzer.common.IssueSink;
import org.cbug.analyzer.prepwork.callgraph.CallSummaries;
import org.cbug.analyzer.prepwork.cfg.ControlFlowGraph;
import org.cbug.analyzer.syntax.FunctionDefinition;
import org.cbug.analyzer.syntax.Symbol;
import org.cbug.analyzer.syntax.SymbolTable;
import org.cbug.analyzer.syntax.TranslationUnit;

import java.util.*;

/**
 * Everything known about one translation unit while it is being analyzed: the syntax view, one control
 * flow graph per function in source order, the escaping pointers per function, the call summaries, and
 * the issue sink. The graphs and summaries are not modified after construction; only the sink grows.
 */
public class AnalysisContext {
    private final TranslationUnit translationUnit;
    private final List<ControlFlowGraph> cfgs;
    private final Map<String, Set<Symbol>> escapes;
    private final CallSummaries callSummaries;
    private final IssueSink issueSink = new IssueSink();
    private final int maxIterationsPerNode;

    public AnalysisContext(TranslationUnit translationUnit,
                           List<ControlFlowGraph> cfgs,
                           Map<String, Set<Symbol>> escapes,
                           CallSummaries callSummaries,
                           int maxIterationsPerNode) {
        this.translationUnit = Objects.requireNonNull(translationUnit);
        this.cfgs = List.copyOf(cfgs);
        this.escapes = Collections.unmodifiableMap(new HashMap<>(escapes));
        this.callSummaries = Objects.requireNonNull(callSummaries);
        this.maxIterationsPerNode = maxIterationsPerNode;
    }

    public TranslationUnit translationUnit() {
        return translationUnit;
    }

    public String file() {
        return translationUnit.file();
    }

    public SymbolTable symbolTable() {
        return translationUnit.symbolTable();
    }

    public List<ControlFlowGraph> cfgs() {
        return cfgs;
    }

    public ControlFlowGraph cfg(String functionName) {
        return cfgs.stream().filter(cfg -> cfg.function().name().equals(functionName)).findFirst()
                .orElseThrow(() -> new NoSuchElementException("No CFG for " + functionName));
    }

    public Set<Symbol> escapes(FunctionDefinition function) {
        return escapes.getOrDefault(function.name(), Set.of());
    }

    public CallSummaries callSummaries() {
        return callSummaries;
    }

    public IssueSink issueSink() {
        return issueSink;
    }

    public int maxIterationsPerNode() {
        return maxIterationsPerNode;
    }
}
