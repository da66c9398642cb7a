package org.cbug.analyzer.prepwork.callgraph;

import org.cbug.analyzer.prepwork.CommonTest;
import org.intellij.lang.annotations.Language;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class TestCallSummaries extends CommonTest {

    @Language("c")
    private static final String INPUT1 = """
            #include <stdlib.h>
            #include <string.h>
            void *xmalloc(size_t n) {
                void *p = malloc(n);
                if (!p) abort();
                return p;
            }
            char *dup(const char *s) {
                return strdup(s);
            }
            void release(int unused, void *p) {
                free(p);
            }
            int *twice(void) {
                return xmalloc(8);
            }
            int fact(int n) {
                return n <= 1 ? 1 : n * fact(n - 1);
            }
            int *global_ptr;
            int *get(void) {
                return global_ptr;
            }
            """;

    @DisplayName("allocation and release wrappers, one level deep")
    @Test
    public void test1() {
        CallSummaries summaries = ComputeCallSummaries.go(parse(INPUT1));
        assertEquals(Set.of("xmalloc", "dup", "release"), summaries.summaries().keySet());
        {
            CallSummary xmalloc = summaries.summary("xmalloc");
            assertTrue(xmalloc.allocator());
            assertFalse(xmalloc.isDeallocator());
        }
        {
            CallSummary release = summaries.summary("release");
            assertFalse(release.allocator());
            assertEquals(1, release.freedParameter());
        }
        assertTrue(summaries.isAllocator("malloc"));
        assertTrue(summaries.isAllocator("dup"));
        assertFalse(summaries.isAllocator("twice"));
        assertFalse(summaries.isAllocator("get"));
        assertFalse(summaries.isAllocator(null));

        assertEquals(0, summaries.freedArgument("free"));
        assertEquals(1, summaries.freedArgument("release"));
        assertEquals(-1, summaries.freedArgument("xmalloc"));
        assertEquals(-1, summaries.freedArgument(null));
    }

    @DisplayName("direct call graph")
    @Test
    public void test2() {
        CallSummaries summaries = ComputeCallSummaries.go(parse(INPUT1));
        assertEquals(Set.of("abort", "malloc"), summaries.callees("xmalloc"));
        assertEquals(Set.of("xmalloc"), summaries.callees("twice"));
        assertTrue(summaries.isRecursive("fact"));
        assertFalse(summaries.isRecursive("twice"));
        assertEquals(Set.of(), summaries.callees("unknown"));
        assertTrue(CallSummaries.empty().summaries().isEmpty());
    }
}
