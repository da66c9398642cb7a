package org.cbug.analyzer.checkers.memory;

import org.cbug.analyzer.checkers.CommonTest;
import org.cbug.analyzer.common.Category;
import org.cbug.analyzer.common.Issue;
import org.cbug.analyzer.common.Severity;
import org.intellij.lang.annotations.Language;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TestMemoryLifecycleChecker extends CommonTest {

    @Language("c")
    private static final String INPUT1 = """
            struct Point { int x; int y; };
            void use(int *param);
            void test_wild_pointer(void) {
                int *ptr1;
                *ptr1 = 42;
                struct Point *p;
                p->x = 10;
                int *arr_ptr;
                arr_ptr[0] = 100;
                int **double_ptr;
                **double_ptr = 999;
                int *cond_ptr;
                if (1) {
                    *cond_ptr = 456;
                }
                int *wild_param;
                use(wild_param);
            }
            """;

    @DisplayName("wild pointers: dereference, member access, indexing, passing to an unknown function")
    @Test
    public void test1() {
        List<Issue> issues = run(new MemoryLifecycleChecker(), INPUT1);
        assertEquals(issues, ofCategory(issues, Category.WILD_POINTER));
        assertEquals(List.of(5, 7, 9, 11, 14, 17), lines(issues));
        assertEquals("Pointer 'ptr1' is dereferenced before it is initialized", issues.get(0).message());
        assertEquals(Severity.ERROR, issues.get(0).severity());
        assertEquals("Pointer 'double_ptr' is dereferenced before it is initialized", issues.get(3).message());
        {
            Issue passed = issues.get(5);
            assertEquals("Pointer 'wild_param' is passed to 'use' before it is initialized", passed.message());
            assertEquals(Severity.WARNING, passed.severity());
            assertNotNull(passed.suggestion());
        }
    }

    @Language("c")
    private static final String INPUT2 = """
            #include <stdio.h>
            #include <stdlib.h>
            void test_null_pointer(void) {
                int *ptr2 = NULL;
                *ptr2 = 100;
                char *str2 = 0;
                str2[0] = 'B';
                int *ptr4 = NULL;
                printf("%d\\n", *ptr4);
                char *str4 = 0;
                scanf("%s", str4);
            }
            void checked(int *p, int *q) {
                if (p == NULL) {
                    *p = 1;
                }
                if (q != NULL && *q > 0) {
                    *q = 2;
                }
                int *r = NULL;
                if (r) {
                    *r = 3;
                }
            }
            """;

    @DisplayName("null pointers, refined by conditions")
    @Test
    public void test2() {
        List<Issue> issues = run(new MemoryLifecycleChecker(), INPUT2);
        assertEquals(issues, ofCategory(issues, Category.NULL_POINTER_DEREFERENCE));
        assertEquals(List.of(5, 7, 9, 11, 15), lines(issues));
        assertEquals("Pointer 'ptr2' is NULL when it is dereferenced", issues.get(0).message());
        assertEquals("Pointer 'str4' is NULL when it is dereferenced by 'scanf'", issues.get(3).message());
        assertTrue(issues.stream().allMatch(Issue::isError));
    }

    @Language("c")
    private static final String INPUT3 = """
            #include <stdio.h>
            #include <stdlib.h>
            void test_correct_pointer(void) {
                int x = 42;
                int *ptr5 = &x;
                printf("%d\\n", *ptr5);
                char str5[10] = "Hello";
                char *ptr6 = str5;
                printf("%s\\n", ptr6);
                int *ptr7 = malloc(sizeof(int));
                if (ptr7) {
                    *ptr7 = 100;
                    printf("%d\\n", *ptr7);
                    free(ptr7);
                }
            }
            """;

    @DisplayName("correct pointer usage")
    @Test
    public void test3() {
        assertTrue(run(new MemoryLifecycleChecker(), INPUT3).isEmpty());
    }

    @Language("c")
    private static final String INPUT4 = """
            #include <stdio.h>
            #include <stdlib.h>
            #include <string.h>
            void test_memory_leak(void) {
                int *ptr1 = malloc(sizeof(int) * 10);
                char *str1 = malloc(100);
                double *arr1 = calloc(20, sizeof(double));
                ptr1[0] = 42;
                strcpy(str1, "Hello World");
                arr1[0] = 3.14;
                printf("ptr1[0] = %d\\n", ptr1[0]);
                printf("str1 = %s\\n", str1);
            }
            int *make(int n) {
                int *p = malloc(n);
                char *q = malloc(n);
                if (!p) return 0;
                free(q);
                return p;
            }
            void test_correct_free(void) {
                int *ptr2 = malloc(sizeof(int) * 5);
                char *str2 = malloc(50);
                if (ptr2 && str2) {
                    ptr2[0] = 100;
                    free(ptr2);
                    free(str2);
                }
            }
            """;

    @DisplayName("memory leaks; returned pointers and merged paths are not reported")
    @Test
    public void test4() {
        List<Issue> issues = run(new MemoryLifecycleChecker(), INPUT4);
        assertEquals(issues, ofCategory(issues, Category.MEMORY_LEAK));
        assertEquals(List.of(5, 6, 7, 16), lines(issues));
        assertEquals("Memory allocated at line 5 and assigned to 'ptr1' is never freed", issues.get(0).message());
        assertEquals("Memory allocated at line 16 and assigned to 'q' is never freed", issues.get(3).message());
        assertEquals(Severity.WARNING, issues.get(3).severity());
        assertEquals("Call free(q) on every path that leaves the function.", issues.get(3).suggestion().detail());
    }

    @Language("c")
    private static final String INPUT5 = """
            #include <stdio.h>
            #include <stdlib.h>
            void test_use_after_free(void) {
                int *ptr1 = malloc(sizeof(int));
                *ptr1 = 42;
                free(ptr1);
                printf("%d\\n", *ptr1);
                int *ptr2 = malloc(sizeof(int) * 10);
                for (int i = 0; i < 10; i++) {
                    ptr2[i] = i;
                }
                free(ptr2);
                for (int i = 0; i < 10; i++) {
                    printf("%d\\n", ptr2[i]);
                }
                int *ptr3 = malloc(sizeof(int));
                free(ptr3);
                *ptr3 = 200;
                int *ptr4 = malloc(sizeof(int));
                free(ptr4);
                if (*ptr4 > 0) {
                    printf("positive\\n");
                }
                int *ptr5 = malloc(sizeof(int));
                free(ptr5);
                free(ptr5);
            }
            """;

    @DisplayName("use after free, in loops and conditions; double free")
    @Test
    public void test5() {
        List<Issue> issues = run(new MemoryLifecycleChecker(), INPUT5);
        assertEquals(5, issues.size());
        List<Issue> useAfterFree = ofCategory(issues, Category.USE_AFTER_FREE);
        assertEquals(List.of(7, 14, 18, 21), lines(useAfterFree));
        assertEquals("Pointer 'ptr1' is used after it was freed", useAfterFree.get(0).message());
        List<Issue> doubleFree = ofCategory(issues, Category.DOUBLE_FREE);
        assertEquals(List.of(26), lines(doubleFree));
        assertEquals("Pointer 'ptr5' is freed twice", doubleFree.get(0).message());
    }

    @Language("c")
    private static final String INPUT6 = """
            #include <stdlib.h>
            void *xmalloc(size_t n) {
                void *p = malloc(n);
                if (!p) abort();
                return p;
            }
            void release(int unused, void *p) {
                free(p);
            }
            void user(void) {
                int *a = xmalloc(8);
                int *b = xmalloc(8);
                release(0, a);
                release(0, a);
            }
            """;

    @DisplayName("allocation and release wrappers defined in the same file")
    @Test
    public void test6() {
        List<Issue> issues = run(new MemoryLifecycleChecker(), INPUT6);
        assertEquals(2, issues.size());
        assertEquals(Category.MEMORY_LEAK, issues.get(0).category());
        assertEquals(12, issues.get(0).location().line());
        assertEquals("Memory allocated at line 12 and assigned to 'b' is never freed", issues.get(0).message());
        assertEquals(Category.DOUBLE_FREE, issues.get(1).category());
        assertEquals(14, issues.get(1).location().line());
    }

    @Language("c")
    private static final String INPUT7 = """
            #include <stdlib.h>
            int *cache;
            void keep(void) {
                int *p = malloc(4);
                cache = p;
                static int *s;
                free(s);
                int *q = malloc(4);
                q = realloc(q, 8);
                free(q);
                free(q);
            }
            """;

    @DisplayName("stored into a global; static locals start as NULL; realloc")
    @Test
    public void test7() {
        List<Issue> issues = run(new MemoryLifecycleChecker(), INPUT7);
        assertEquals(1, issues.size());
        assertEquals(Category.DOUBLE_FREE, issues.get(0).category());
        assertEquals(11, issues.get(0).location().line());
    }

    @Language("c")
    private static final String INPUT8 = """
            #include <stdlib.h>
            void freeOriginal(void) {
                char *buf = malloc(10);
                char *cur = buf;
                *cur = 'a';
                free(buf);
            }
            void freeCopy(void) {
                char *buf = malloc(10);
                char *cur = buf;
                cur[1] = 'b';
                free(cur);
            }
            char *returnCopy(void) {
                char *buf = malloc(10);
                char *cur = buf;
                return cur;
            }
            void neither(void) {
                char *buf = malloc(10);
                char *cur = buf;
                *cur = 'c';
            }
            """;

    @DisplayName("two pointers to the same allocation")
    @Test
    public void test8() {
        List<Issue> issues = run(new MemoryLifecycleChecker(), INPUT8);
        assertEquals(1, issues.size());
        assertEquals(Category.MEMORY_LEAK, issues.get(0).category());
        assertEquals(20, issues.get(0).location().line());
        assertEquals("Memory allocated at line 20 and assigned to 'buf' is never freed", issues.get(0).message());
    }

    @Language("c")
    private static final String INPUT9 = """
            #include <stdlib.h>
            void consume(int *p);
            void caller(int n) {
                int *p = NULL;
                consume(p);
                int *q = NULL;
                if (n > 0) q = malloc(4);
                consume(q);
                int *r = NULL;
                free(r);
            }
            """;

    @DisplayName("NULL passed to a function of unknown behavior")
    @Test
    public void test9() {
        List<Issue> issues = run(new MemoryLifecycleChecker(), INPUT9);
        assertEquals(1, issues.size());
        Issue issue = issues.get(0);
        assertEquals(Category.NULL_POINTER_DEREFERENCE, issue.category());
        assertEquals(Severity.WARNING, issue.severity());
        assertEquals(5, issue.location().line());
        assertEquals("Pointer 'p' is NULL when it is passed to 'consume'", issue.message());
    }
}
