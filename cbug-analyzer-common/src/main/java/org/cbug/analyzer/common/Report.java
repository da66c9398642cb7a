package org.cbug.analyzer.common;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * The outcome of analyzing one source file: issues in report order and a count per category.
 */
public record Report(String source, List<Issue> issues, Map<Category, Integer> summary) {

    public Report {
        issues = List.copyOf(issues);
        Map<Category, Integer> copy = new EnumMap<>(Category.class);
        copy.putAll(summary);
        summary = Collections.unmodifiableMap(copy);
    }

    public boolean hasErrors() {
        return issues.stream().anyMatch(Issue::isError);
    }

    public Map<Severity, Integer> severitySummary() {
        Map<Severity, Integer> map = new EnumMap<>(Severity.class);
        for (Severity severity : Severity.values()) {
            map.put(severity, 0);
        }
        issues.forEach(issue -> map.merge(issue.severity(), 1, Integer::sum));
        return Collections.unmodifiableMap(map);
    }

    public List<Issue> issuesOf(Category category) {
        return issues.stream().filter(issue -> issue.category() == category).toList();
    }

    public int count(Category category) {
        return summary.getOrDefault(category, 0);
    }
}
