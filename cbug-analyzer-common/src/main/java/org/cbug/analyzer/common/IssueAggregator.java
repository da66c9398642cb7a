package org.cbug.analyzer.common;

import java.util.*;

/**
 * Merges the issues produced by the individual checkers of one file into a {@link Report}.
 * Duplicates (same category, location and message) are dropped; the remaining issues are ordered
 * by severity, file, line and column.
 */
public class IssueAggregator {
    private final String source;
    private final Map<Key, Issue> issues = new LinkedHashMap<>();

    private record Key(Category category, SourceLocation location, String message) {
    }

    public IssueAggregator(String source) {
        this.source = source;
    }

    public IssueAggregator add(Issue issue) {
        issues.putIfAbsent(new Key(issue.category(), issue.location(), issue.message()), issue);
        return this;
    }

    public IssueAggregator addAll(Collection<Issue> collection) {
        collection.forEach(this::add);
        return this;
    }

    public Report build() {
        List<Issue> sorted = issues.values().stream().sorted(Issue.REPORT_ORDER).toList();
        Map<Category, Integer> summary = new EnumMap<>(Category.class);
        sorted.forEach(issue -> summary.merge(issue.category(), 1, Integer::sum));
        return new Report(source, sorted, summary);
    }

    public static Report aggregate(String source, Collection<Issue> collection) {
        return new IssueAggregator(source).addAll(collection).build();
    }
}
