package org.cbug.analyzer.prepwork.cfg;

import org.cbug.analyzer.prepwork.CommonTest;
import org.cbug.analyzer.syntax.Symbol;
import org.intellij.lang.annotations.Language;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TestLoopRegions extends CommonTest {

    @Language("c")
    private static final String INPUT1 = """
            void scan(int *p);
            void w(int n) {
                int i = 0;
                while (i < n) {
                    i = i;
                    i += 0;
                    n -= 0;
                    scan(&n);
                    i++;
                }
            }
            """;

    @DisplayName("condition variables and the writes to them")
    @Test
    public void test1() {
        ControlFlowGraph cfg = cfg(INPUT1, "w");
        LoopRegion loop = cfg.loopRegions().get(0);
        assertTrue(loop.isCyclic());
        assertEquals("(i < n)", loop.condition().toString());
        assertEquals(List.of("i", "n"), loop.conditionVariables().stream().map(Symbol::name).toList());
        assertEquals(List.of(3, 4), loop.body().stream().map(CFGNode::id).toList());
        assertEquals(List.of("3-false_branch->5"), loop.exitEdges().stream().map(CFGEdge::toString).toList());

        assertEquals(2, loop.writes().size());
        Symbol i = loop.conditionVariables().iterator().next();
        List<Write> writesToI = loop.writesTo(i);
        assertEquals(1, writesToI.size());
        assertEquals("i++", writesToI.get(0).expression().toString());
        assertSame(cfg.node(4), writesToI.get(0).node());
        Write writeToN = loop.writes().stream().filter(w -> !w.variable().equals(i)).findFirst().orElseThrow();
        assertEquals("&n", writeToN.expression().toString());
    }

    @Language("c")
    private static final String INPUT2 = """
            #include <stdlib.h>
            int search(int *a, int n) {
                for (;;) {
                    if (a[n] == 0) return n;
                    if (n < 0) exit(2);
                    n--;
                }
            }
            """;

    @DisplayName("for(;;) left by return and exit")
    @Test
    public void test2() {
        ControlFlowGraph cfg = cfg(INPUT2, "search");
        LoopRegion loop = cfg.loopRegions().get(0);
        assertNull(loop.condition());
        assertTrue(loop.conditionVariables().isEmpty());
        assertTrue(loop.writes().isEmpty());
        assertEquals(List.of(2, 3, 5, 6, 8), loop.body().stream().map(CFGNode::id).toList());
        assertEquals(List.of("3-true_branch->4", "6-true_branch->7"),
                loop.exitEdges().stream().map(CFGEdge::toString).toList());
        assertTrue(cfg.node(7).isProgramExit());
        assertTrue(loop.header().successors().stream().noneMatch(e -> e.kind() == EdgeKind.FALSE_BRANCH));
    }

    @Language("c")
    private static final String INPUT3 = """
            void once(int x) {
                while (x) {
                    x = 0;
                    break;
                }
            }
            """;

    @DisplayName("a loop that always breaks is not cyclic")
    @Test
    public void test3() {
        LoopRegion loop = cfg(INPUT3, "once").loopRegions().get(0);
        assertFalse(loop.isCyclic());
        assertEquals(1, loop.body().size());
        assertEquals(2, loop.exitEdges().size());
    }

    @Language("c")
    private static final String INPUT4 = """
            int nest(int n) {
                int s = 0;
                for (int i = 0; i < n; i++)
                    for (int j = 0; j < i; j++)
                        s++;
                return s;
            }
            """;

    @DisplayName("nested loops: inner region first, contained in the outer one")
    @Test
    public void test4() {
        ControlFlowGraph cfg = cfg(INPUT4, "nest");
        assertEquals(2, cfg.loopRegions().size());
        LoopRegion inner = cfg.loopRegions().get(0);
        LoopRegion outer = cfg.loopRegions().get(1);
        assertEquals(4, inner.statement().location().line());
        assertEquals(List.of(5, 6, 7), inner.body().stream().map(CFGNode::id).toList());
        assertEquals(List.of(3, 4, 5, 6, 7, 8, 9), outer.body().stream().map(CFGNode::id).toList());
        assertTrue(outer.body().containsAll(inner.body()));

        assertEquals(List.of("j", "i"), inner.conditionVariables().stream().map(Symbol::name).toList());
        assertEquals(1, inner.writes().size());
        assertEquals("j", inner.writes().get(0).variable().name());
        assertEquals(1, outer.writes().size());
        assertSame(cfg.node(9), outer.writes().get(0).node());
    }
}
