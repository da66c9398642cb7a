package org.cbug.analyzer.checkers;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.cbug.analyzer.common.Category;
import org.cbug.analyzer.common.Issue;
import org.cbug.analyzer.prepwork.AnalysisContext;
import org.cbug.analyzer.prepwork.PrepAnalyzer;
import org.cbug.analyzer.syntax.FrontEnd;
import org.cbug.analyzer.syntax.parser.CFrontEnd;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.List;

public class CommonTest {
    protected FrontEnd frontEnd;
    protected PrepAnalyzer prepAnalyzer;

    @BeforeAll
    public static void beforeAll() {
        ((Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME)).setLevel(Level.INFO);
        ((Logger) LoggerFactory.getLogger("org.cbug.analyzer.checkers")).setLevel(Level.DEBUG);
    }

    @BeforeEach
    public void beforeEach() {
        frontEnd = new CFrontEnd();
        prepAnalyzer = new PrepAnalyzer();
    }

    protected AnalysisContext context(String input) {
        return prepAnalyzer.doTranslationUnit(frontEnd.parse("test.c", input));
    }

    /*
    the issues of one checker, in source order
     */
    protected List<Issue> run(Checker checker, String input) {
        return checker.run(context(input)).stream()
                .sorted(Comparator.comparing(Issue::location).thenComparing(Issue::message))
                .toList();
    }

    protected static List<Issue> ofCategory(List<Issue> issues, Category category) {
        return issues.stream().filter(i -> i.category() == category).toList();
    }

    protected static List<Integer> lines(List<Issue> issues) {
        return issues.stream().map(i -> i.location().line()).toList();
    }

    protected static List<String> messages(List<Issue> issues) {
        return issues.stream().map(Issue::message).toList();
    }
}
