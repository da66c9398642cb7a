package org.cbug.analyzer.prepwork;

import org.cbug.analyzer.common.AnalyzerException;
import org.cbug.analyzer.common.SourceLocation;
import org.cbug.analyzer.syntax.CType;
import org.cbug.analyzer.syntax.FunctionDefinition;
import org.cbug.analyzer.syntax.Symbol;
import org.cbug.analyzer.syntax.TranslationUnit;
import org.cbug.analyzer.syntax.statement.Block;
import org.cbug.analyzer.syntax.statement.Statement;
import org.intellij.lang.annotations.Language;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.NoSuchElementException;

import static org.junit.jupiter.api.Assertions.*;

public class TestPrepAnalyzer extends CommonTest {

    @Language("c")
    private static final String INPUT1 = """
            #include <stdlib.h>
            int *make(void) {
                int *p = malloc(4);
                return p;
            }
            void use(void) {
                int *q = make();
                free(q);
            }
            """;

    @DisplayName("one graph per function, escapes, summaries")
    @Test
    public void test1() {
        TranslationUnit tu = parse(INPUT1);
        AnalysisContext context = new PrepAnalyzer(50).doTranslationUnit(tu);
        assertEquals("test.c", context.file());
        assertEquals(List.of("make", "use"), context.cfgs().stream().map(cfg -> cfg.function().name()).toList());
        assertEquals(List.of("p"), context.escapes(tu.function("make")).stream().map(Symbol::name).toList());
        assertTrue(context.escapes(tu.function("use")).isEmpty());
        assertTrue(context.callSummaries().isAllocator("make"));
        assertEquals(50, context.maxIterationsPerNode());
        assertEquals(0, context.issueSink().size());
        assertThrows(NoSuchElementException.class, () -> context.cfg("main"));
    }

    @DisplayName("a failure while building a graph names the function")
    @Test
    public void test2() {
        SourceLocation loc = new SourceLocation("test.c", 1, 1);
        Statement unsupported = () -> loc;
        FunctionDefinition broken = new FunctionDefinition("broken", CType.VOID, List.of(), false,
                new Block(List.of(unsupported), loc), loc, null);
        AnalyzerException ae = assertThrows(AnalyzerException.class, () -> prepAnalyzer.doFunction(broken));
        assertEquals("broken", ae.getSubject());
        assertInstanceOf(UnsupportedOperationException.class, ae.getCause());
    }
}
