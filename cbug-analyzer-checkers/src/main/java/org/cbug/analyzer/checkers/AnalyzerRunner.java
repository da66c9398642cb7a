package org.cbug.analyzer.checkers;

import org.cbug.analyzer.common.AnalyzerException;
import org.cbug.analyzer.common.Report;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Entry point for callers such as a command line or an editor integration: one {@link Report} per
 * translation unit. Parse failures and checker faults end up as issues in the report; only
 * {@link #collectSources} throws.
 */
public interface AnalyzerRunner {

    interface Configuration {
        // passed on to the front-end, e.g. -DDEBUG
        List<String> compileArgs();

        boolean enableSuggestions();

        // stop running checkers, and analyzing further files, after the first error
        boolean stopOnError();

        // analyze several files in parallel
        boolean parallel();

        int maxIterationsPerNode();
    }

    Configuration configuration();

    Report analyze(Path source);

    Report analyze(String file, String content);

    /*
    one report per source, in the order of the sources
     */
    List<Report> analyzeAll(List<Path> sources);

    /**
     * @param path a C source file, or a directory that is searched recursively for {@code .c} files
     * @return the sources, sorted
     * @throws AnalyzerException when the directory holds no C source file
     */
    List<Path> collectSources(Path path) throws IOException;
}
