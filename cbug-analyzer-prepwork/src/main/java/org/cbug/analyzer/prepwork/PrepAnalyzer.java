package org.cbug.analyzer.prepwork;

import org.cbug.analyzer.common.AnalyzerException;
import org.cbug.analyzer.prepwork.callgraph.CallSummaries;
import org.cbug.analyzer.prepwork.callgraph.ComputeCallSummaries;
import org.cbug.analyzer.prepwork.cfg.ControlFlowBuilder;
import org.cbug.analyzer.prepwork.cfg.ControlFlowGraph;
import org.cbug.analyzer.prepwork.escape.ComputeEscapes;
import org.cbug.analyzer.prepwork.lattice.WorklistSolver;
import org.cbug.analyzer.syntax.FunctionDefinition;
import org.cbug.analyzer.syntax.Symbol;
import org.cbug.analyzer.syntax.TranslationUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/*
everything the checkers share, computed once per translation unit

at the level of the translation unit
- call summaries: allocation and release wrappers, direct call graph

at the level of the function
- control flow graph, loop regions
- escaping pointers
 */
public class PrepAnalyzer {
    private static final Logger LOGGER = LoggerFactory.getLogger(PrepAnalyzer.class);

    private final int maxIterationsPerNode;

    public PrepAnalyzer() {
        this(WorklistSolver.DEFAULT_MAX_ITERATIONS_PER_NODE);
    }

    public PrepAnalyzer(int maxIterationsPerNode) {
        this.maxIterationsPerNode = maxIterationsPerNode;
    }

    public AnalysisContext doTranslationUnit(TranslationUnit translationUnit) {
        LOGGER.debug("Prep work for {}", translationUnit.file());
        CallSummaries callSummaries = ComputeCallSummaries.go(translationUnit);
        List<ControlFlowGraph> cfgs = new ArrayList<>();
        Map<String, Set<Symbol>> escapes = new HashMap<>();
        for (FunctionDefinition function : translationUnit.functions()) {
            cfgs.add(doFunction(function));
            escapes.put(function.name(), ComputeEscapes.go(function));
        }
        return new AnalysisContext(translationUnit, cfgs, escapes, callSummaries, maxIterationsPerNode);
    }

    public ControlFlowGraph doFunction(FunctionDefinition function) {
        try {
            return ControlFlowBuilder.build(function);
        } catch (RuntimeException re) {
            LOGGER.error("Caught exception building the CFG of {}", function.name());
            throw new AnalyzerException(function.name(), re);
        }
    }
}
