package org.cbug.analyzer.checkers.impl;

import org.cbug.analyzer.checkers.AnalyzerRunner;
import org.cbug.analyzer.checkers.Checker;
import org.cbug.analyzer.checkers.Checkers;
import org.cbug.analyzer.common.*;
import org.cbug.analyzer.prepwork.AnalysisContext;
import org.cbug.analyzer.prepwork.PrepAnalyzer;
import org.cbug.analyzer.prepwork.lattice.WorklistSolver;
import org.cbug.analyzer.syntax.FrontEnd;
import org.cbug.analyzer.syntax.ParseException;
import org.cbug.analyzer.syntax.TranslationUnit;
import org.cbug.analyzer.syntax.parser.CFrontEnd;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

public class AnalyzerRunnerImpl implements AnalyzerRunner {
    private static final Logger LOGGER = LoggerFactory.getLogger(AnalyzerRunnerImpl.class);

    private final Configuration configuration;
    private final FrontEnd frontEnd;
    private final List<Checker> checkers;
    private final PrepAnalyzer prepAnalyzer;

    public AnalyzerRunnerImpl() {
        this(new ConfigurationBuilder().build());
    }

    public AnalyzerRunnerImpl(Configuration configuration) {
        this(configuration, new CFrontEnd(), Checkers.DEFAULT);
    }

    public AnalyzerRunnerImpl(Configuration configuration, FrontEnd frontEnd, List<Checker> checkers) {
        this.configuration = configuration;
        this.frontEnd = frontEnd;
        this.checkers = List.copyOf(checkers);
        this.prepAnalyzer = new PrepAnalyzer(configuration.maxIterationsPerNode());
    }

    public record ConfigurationImpl(List<String> compileArgs,
                                    boolean enableSuggestions,
                                    boolean stopOnError,
                                    boolean parallel,
                                    int maxIterationsPerNode) implements Configuration {
        public ConfigurationImpl {
            compileArgs = List.copyOf(compileArgs);
        }
    }

    public static class ConfigurationBuilder {
        private final List<String> compileArgs = new ArrayList<>();
        private boolean enableSuggestions = true;
        private boolean stopOnError;
        private boolean parallel;
        private int maxIterationsPerNode = WorklistSolver.DEFAULT_MAX_ITERATIONS_PER_NODE;

        public ConfigurationBuilder addCompileArgs(String... args) {
            compileArgs.addAll(List.of(args));
            return this;
        }

        public ConfigurationBuilder setEnableSuggestions(boolean enableSuggestions) {
            this.enableSuggestions = enableSuggestions;
            return this;
        }

        public ConfigurationBuilder setStopOnError(boolean stopOnError) {
            this.stopOnError = stopOnError;
            return this;
        }

        public ConfigurationBuilder setParallel(boolean parallel) {
            this.parallel = parallel;
            return this;
        }

        public ConfigurationBuilder setMaxIterationsPerNode(int maxIterationsPerNode) {
            this.maxIterationsPerNode = maxIterationsPerNode;
            return this;
        }

        public Configuration build() {
            return new ConfigurationImpl(compileArgs, enableSuggestions, stopOnError, parallel, maxIterationsPerNode);
        }
    }

    @Override
    public Configuration configuration() {
        return configuration;
    }

    @Override
    public Report analyze(Path source) {
        String file = source.toString();
        TranslationUnit translationUnit;
        try {
            translationUnit = frontEnd.parse(source, configuration.compileArgs());
        } catch (IOException | ParseException e) {
            return parseFailure(file, e);
        }
        return analyze(translationUnit);
    }

    @Override
    public Report analyze(String file, String content) {
        TranslationUnit translationUnit;
        try {
            translationUnit = frontEnd.parse(file, content, configuration.compileArgs());
        } catch (ParseException pe) {
            return parseFailure(file, pe);
        }
        return analyze(translationUnit);
    }

    private Report parseFailure(String file, Exception exception) {
        LOGGER.warn("Cannot parse {}: {}", file, exception.getMessage());
        Issue issue = new Issue(Category.PARSE_FAILURE, Severity.ERROR, "Cannot parse the file: "
                                                                        + exception.getMessage(),
                SourceLocation.ofFile(file), new Suggestion("Check the source and the compile arguments",
                "The file must be valid C; macros it depends on can be passed as -D arguments."));
        return finish(file, List.of(issue));
    }

    Report analyze(TranslationUnit translationUnit) {
        String file = translationUnit.file();
        AnalysisContext context;
        try {
            context = prepAnalyzer.doTranslationUnit(translationUnit);
        } catch (RuntimeException re) {
            LOGGER.error("Caught exception preparing {}", file, re);
            String subject = re instanceof AnalyzerException ae ? ae.getSubject() : file;
            return finish(file, List.of(new Issue(Category.INTERNAL_ERROR, Severity.ERROR,
                    "Analysis of '" + subject + "' failed: " + re, SourceLocation.ofFile(file))));
        }
        for (Checker checker : checkers) {
            if (configuration.stopOnError() && context.issueSink().hasErrors()) {
                LOGGER.debug("Stopping {} before {}: errors found", file, checker.name());
                break;
            }
            try {
                context.issueSink().addAll(checker.run(context));
            } catch (RuntimeException re) {
                LOGGER.error("Caught exception in checker {} on {}", checker.name(), file, re);
                context.issueSink().add(new Issue(Category.INTERNAL_ERROR, Severity.WARNING,
                        "Checker '" + checker.name() + "' failed: " + re, SourceLocation.ofFile(file)));
            }
        }
        return finish(file, context.issueSink().issues());
    }

    private Report finish(String file, List<Issue> issues) {
        List<Issue> list = configuration.enableSuggestions() ? issues
                : issues.stream().map(Issue::withoutSuggestion).toList();
        Report report = IssueAggregator.aggregate(file, list);
        LOGGER.info("{}: {} issue(s)", file, report.issues().size());
        return report;
    }

    @Override
    public List<Report> analyzeAll(List<Path> sources) {
        List<Report> reports;
        if (configuration.parallel()) {
            reports = sources.parallelStream().map(this::analyze).toList();
        } else {
            reports = new ArrayList<>(sources.size());
            for (Path source : sources) {
                Report report = analyze(source);
                reports.add(report);
                if (configuration.stopOnError() && report.hasErrors()) break;
            }
            return List.copyOf(reports);
        }
        if (!configuration.stopOnError()) return reports;
        List<Report> truncated = new ArrayList<>();
        for (Report report : reports) {
            truncated.add(report);
            if (report.hasErrors()) break;
        }
        return List.copyOf(truncated);
    }

    @Override
    public List<Path> collectSources(Path path) throws IOException {
        if (!Files.isDirectory(path)) return List.of(path);
        List<Path> sources;
        try (Stream<Path> stream = Files.walk(path)) {
            sources = stream.filter(p -> Files.isRegularFile(p) && p.getFileName().toString().endsWith(".c"))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
        if (sources.isEmpty()) {
            throw new AnalyzerException(path.toString(), "No C source file in " + path);
        }
        return sources;
    }
}
