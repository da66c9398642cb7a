package org.cbug.analyzer.prepwork;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.cbug.analyzer.prepwork.cfg.CFGEdge;
import org.cbug.analyzer.prepwork.cfg.CFGNode;
import org.cbug.analyzer.prepwork.cfg.ControlFlowGraph;
import org.cbug.analyzer.prepwork.cfg.EdgeKind;
import org.cbug.analyzer.syntax.FrontEnd;
import org.cbug.analyzer.syntax.TranslationUnit;
import org.cbug.analyzer.syntax.parser.CFrontEnd;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.slf4j.LoggerFactory;

import java.util.List;

public class CommonTest {
    protected FrontEnd frontEnd;
    protected PrepAnalyzer prepAnalyzer;

    @BeforeAll
    public static void beforeAll() {
        ((Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME)).setLevel(Level.INFO);
        ((Logger) LoggerFactory.getLogger("org.cbug.analyzer.prepwork.cfg")).setLevel(Level.DEBUG);
    }

    @BeforeEach
    public void beforeEach() {
        frontEnd = new CFrontEnd();
        prepAnalyzer = new PrepAnalyzer();
    }

    protected TranslationUnit parse(String input) {
        return frontEnd.parse("test.c", input);
    }

    protected AnalysisContext prepWork(String input) {
        return prepAnalyzer.doTranslationUnit(parse(input));
    }

    protected ControlFlowGraph cfg(String input, String function) {
        return prepWork(input).cfg(function);
    }

    protected static List<String> successors(CFGNode node) {
        return node.successors().stream().map(CFGEdge::toString).toList();
    }

    protected static CFGEdge edge(CFGNode source, CFGNode target, EdgeKind kind) {
        return new CFGEdge(source, target, kind);
    }
}
