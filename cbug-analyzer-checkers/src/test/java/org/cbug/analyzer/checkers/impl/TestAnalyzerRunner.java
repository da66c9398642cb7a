package org.cbug.analyzer.checkers.impl;

import org.cbug.analyzer.checkers.AnalyzerRunner;
import org.cbug.analyzer.checkers.Checker;
import org.cbug.analyzer.checkers.CommonTest;
import org.cbug.analyzer.checkers.syntactic.UnreachableCodeChecker;
import org.cbug.analyzer.common.*;
import org.cbug.analyzer.prepwork.AnalysisContext;
import org.cbug.analyzer.syntax.parser.CFrontEnd;
import org.intellij.lang.annotations.Language;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TestAnalyzerRunner extends CommonTest {

    @Language("c")
    private static final String INPUT1 = """
            #include <stdio.h>
            #include <stdlib.h>
            int main(void) {
                int *p;
                *p = 1;
                int *q = malloc(4);
                printf("%d %d\\n", 1);
                int zero = 0;
                int r = 10 / zero;
                while (1) {
                }
                return r;
            }
            """;

    @Language("c")
    private static final String CLEAN = """
            #include <stdio.h>
            int main(void) {
                printf("hello\\n");
                return 0;
            }
            """;

    @DisplayName("all checkers on one file; errors come first in the report")
    @Test
    public void test1() {
        AnalyzerRunner runner = new AnalyzerRunnerImpl();
        Report report = runner.analyze("main.c", INPUT1);
        assertEquals("main.c", report.source());
        assertEquals(List.of(Category.WILD_POINTER, Category.FORMAT_STRING, Category.DIVISION_BY_ZERO,
                        Category.INFINITE_LOOP, Category.UNREACHABLE_CODE),
                report.issues().stream().map(Issue::category).toList());
        assertEquals(List.of(5, 7, 9, 10, 12), report.issues().stream().map(i -> i.location().line()).toList());
        assertEquals(1, report.count(Category.DIVISION_BY_ZERO));
        assertEquals(0, report.count(Category.MEMORY_LEAK));
        assertEquals(5, report.summary().size());
        assertEquals(3, report.severitySummary().get(Severity.ERROR));
        assertTrue(report.hasErrors());
        assertTrue(report.issues().stream().allMatch(i -> i.suggestion() != null));

        assertFalse(runner.analyze("clean.c", CLEAN).hasErrors());
        assertTrue(runner.analyze("clean.c", CLEAN).issues().isEmpty());
    }

    @DisplayName("stop after the first checker that reports an error; suggestions switched off")
    @Test
    public void test2() {
        AnalyzerRunner.Configuration configuration = new AnalyzerRunnerImpl.ConfigurationBuilder()
                .setStopOnError(true)
                .setEnableSuggestions(false)
                .build();
        Report report = new AnalyzerRunnerImpl(configuration).analyze("main.c", INPUT1);
        assertEquals(1, report.issues().size());
        Issue issue = report.issues().get(0);
        assertEquals(Category.WILD_POINTER, issue.category());
        assertNull(issue.suggestion());
    }

    @DisplayName("a file that cannot be parsed gives one parse failure")
    @Test
    public void test3() {
        Report report = new AnalyzerRunnerImpl().analyze("broken.c", "int main( {\n");
        assertEquals(1, report.issues().size());
        Issue issue = report.issues().get(0);
        assertEquals(Category.PARSE_FAILURE, issue.category());
        assertEquals(Severity.ERROR, issue.severity());
        assertEquals(SourceLocation.ofFile("broken.c"), issue.location());
        assertTrue(issue.message().startsWith("Cannot parse the file: "), issue.message());

        Report missing = new AnalyzerRunnerImpl().analyze(Path.of("does", "not", "exist.c"));
        assertEquals(Category.PARSE_FAILURE, missing.issues().get(0).category());
    }

    @DisplayName("a failing checker does not stop the others")
    @Test
    public void test4() {
        Checker failing = new Checker() {
            @Override
            public String name() {
                return "failing";
            }

            @Override
            public List<Issue> run(AnalysisContext context) {
                throw new IllegalStateException("boom");
            }
        };
        AnalyzerRunner runner = new AnalyzerRunnerImpl(new AnalyzerRunnerImpl.ConfigurationBuilder().build(),
                new CFrontEnd(), List.of(failing, new UnreachableCodeChecker()));
        Report report = runner.analyze("main.c", INPUT1);
        assertEquals(List.of(Category.INTERNAL_ERROR, Category.UNREACHABLE_CODE),
                report.issues().stream().map(Issue::category).toList());
        Issue internal = report.issues().get(0);
        assertEquals(Severity.WARNING, internal.severity());
        assertEquals("Checker 'failing' failed: java.lang.IllegalStateException: boom", internal.message());
    }

    @DisplayName("macros defined on the command line")
    @Test
    public void test5() {
        AnalyzerRunner.Configuration configuration = new AnalyzerRunnerImpl.ConfigurationBuilder()
                .addCompileArgs("-DLIMIT=0")
                .setMaxIterationsPerNode(500)
                .build();
        Report report = new AnalyzerRunnerImpl(configuration).analyze("limit.c", """
                int ratio(int n) {
                    return n / LIMIT;
                }
                """);
        assertEquals(1, report.count(Category.DIVISION_BY_ZERO));
        assertEquals("Division by zero in '(n / 0)'", report.issues().get(0).message());
        assertEquals(List.of("-DLIMIT=0"), configuration.compileArgs());
        assertEquals(500, configuration.maxIterationsPerNode());
    }

    @DisplayName("directories, several files, stop on error, parallel")
    @Test
    public void test6(@TempDir Path dir) throws IOException {
        Files.writeString(dir.resolve("a.c"), INPUT1);
        Files.writeString(dir.resolve("b.c"), CLEAN);
        Files.createDirectory(dir.resolve("sub"));
        Files.writeString(dir.resolve("sub").resolve("c.c"), CLEAN);
        Files.writeString(dir.resolve("notes.txt"), "not C");

        AnalyzerRunner runner = new AnalyzerRunnerImpl();
        List<Path> sources = runner.collectSources(dir);
        assertEquals(List.of(dir.resolve("a.c"), dir.resolve("b.c"), dir.resolve("sub").resolve("c.c")), sources);
        assertEquals(List.of(dir.resolve("b.c")), runner.collectSources(dir.resolve("b.c")));
        {
            List<Report> reports = runner.analyzeAll(sources);
            assertEquals(3, reports.size());
            assertEquals(dir.resolve("a.c").toString(), reports.get(0).source());
            assertTrue(reports.get(0).hasErrors());
            assertTrue(reports.get(2).issues().isEmpty());
        }
        {
            AnalyzerRunner parallel = new AnalyzerRunnerImpl(new AnalyzerRunnerImpl.ConfigurationBuilder()
                    .setParallel(true).build());
            List<Report> reports = parallel.analyzeAll(sources);
            assertEquals(sources.stream().map(Path::toString).toList(),
                    reports.stream().map(Report::source).toList());
            assertEquals(5, reports.get(0).issues().size());
        }
        for (boolean parallel : new boolean[]{false, true}) {
            AnalyzerRunner stopping = new AnalyzerRunnerImpl(new AnalyzerRunnerImpl.ConfigurationBuilder()
                    .setStopOnError(true).setParallel(parallel).build());
            assertEquals(1, stopping.analyzeAll(sources).size());
            assertEquals(2, stopping.analyzeAll(List.of(dir.resolve("b.c"), dir.resolve("a.c"),
                    dir.resolve("sub").resolve("c.c"))).size());
        }

        Path empty = Files.createDirectory(dir.resolve("empty"));
        AnalyzerException exception = assertThrows(AnalyzerException.class, () -> runner.collectSources(empty));
        assertEquals(empty.toString(), exception.getSubject());
    }

    @DisplayName("the same input gives the same report, sequential or parallel")
    @Test
    public void test7(@TempDir Path dir) throws IOException {
        AnalyzerRunner runner = new AnalyzerRunnerImpl();
        assertEquals(runner.analyze("main.c", INPUT1), runner.analyze("main.c", INPUT1));

        for (int i = 0; i < 6; i++) {
            Files.writeString(dir.resolve("f" + i + ".c"), i % 2 == 0 ? INPUT1 : CLEAN);
        }
        List<Path> sources = runner.collectSources(dir);
        List<Report> sequential = runner.analyzeAll(sources);
        AnalyzerRunner parallel = new AnalyzerRunnerImpl(new AnalyzerRunnerImpl.ConfigurationBuilder()
                .setParallel(true).build());
        assertEquals(sequential, parallel.analyzeAll(sources));
        assertEquals(sequential, parallel.analyzeAll(sources));
    }
}
