package org.cbug.analyzer.checkers.syntactic;

import org.cbug.analyzer.checkers.CommonTest;
import org.cbug.analyzer.common.Category;
import org.cbug.analyzer.common.Issue;
import org.cbug.analyzer.common.Severity;
import org.intellij.lang.annotations.Language;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TestMissingIncludeChecker extends CommonTest {

    @Language("c")
    private static final String INPUT1 = """
            #include <stdio.h>
            char *copy(char *s);
            void f(void) {
                char *p = malloc(10);
                strcpy(p, "x");
                printf("%s\\n", p);
                free(p);
                char *q = malloc(4);
                copy("y");
                puts("z");
            }
            void *calloc(unsigned long n, unsigned long size);
            void g(void) {
                void *c = calloc(1, 2);
                free(c);
            }
            """;

    @DisplayName("library functions without their header, once per function")
    @Test
    public void test1() {
        List<Issue> issues = run(new MissingIncludeChecker(), INPUT1);
        assertEquals(List.of(4, 5, 7), lines(issues));
        assertTrue(issues.stream().allMatch(i -> i.category() == Category.MISSING_INCLUDE
                                                 && i.severity() == Severity.WARNING));
        assertEquals("'malloc' is used without including <stdlib.h>", issues.get(0).message());
        assertEquals("'strcpy' is used without including <string.h>", issues.get(1).message());
        assertEquals("'free' is used without including <stdlib.h>", issues.get(2).message());
        assertEquals("Add #include <stdlib.h>", issues.get(0).suggestion().title());
    }

    @Language("c")
    private static final String INPUT2 = """
            #include <stdio.h>
            #include <stdlib.h>
            #include "string.h"
            void f(void) {
                char *p = malloc(10);
                strcpy(p, "x");
                printf("%s\\n", p);
                free(p);
            }
            """;

    @DisplayName("system and quoted includes")
    @Test
    public void test2() {
        assertTrue(run(new MissingIncludeChecker(), INPUT2).isEmpty());
    }
}
