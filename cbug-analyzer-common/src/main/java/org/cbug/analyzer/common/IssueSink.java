package org.cbug.analyzer.common;

import java.util.ArrayList;
import java.util.List;

/*
append-only collection of the issues of one analysis context
 */
public class IssueSink {
    private final List<Issue> issues = new ArrayList<>();

    public synchronized void add(Issue issue) {
        issues.add(issue);
    }

    public synchronized void addAll(List<Issue> list) {
        issues.addAll(list);
    }

    public synchronized boolean hasErrors() {
        return issues.stream().anyMatch(Issue::isError);
    }

    public synchronized List<Issue> issues() {
        return List.copyOf(issues);
    }

    public synchronized int size() {
        return issues.size();
    }
}
