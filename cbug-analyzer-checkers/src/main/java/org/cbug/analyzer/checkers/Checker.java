package org.cbug.analyzer.checkers;

import org.cbug.analyzer.common.Issue;
import org.cbug.analyzer.prepwork.AnalysisContext;

import java.util.List;

/**
 * One defect detector. Implementations keep no state between runs: facts are local to {@link #run},
 * the context is only read, and the issues are returned to the caller.
 */
public interface Checker {

    // used in log messages and in the internal-error issue when the checker fails
    String name();

    List<Issue> run(AnalysisContext context);
}
