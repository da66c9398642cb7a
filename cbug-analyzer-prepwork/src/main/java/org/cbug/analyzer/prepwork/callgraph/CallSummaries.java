package org.cbug.analyzer.prepwork.callgraph;

import org.cbug.analyzer.prepwork.StandardLibrary;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Allocation and release behavior of callees, combining the standard library with the wrappers found
 * in the translation unit. Also holds the direct call graph.
 */
public class CallSummaries {
    private final Map<String, CallSummary> summaries;
    private final Map<String, Set<String>> callees;

    public CallSummaries(Map<String, CallSummary> summaries, Map<String, Set<String>> callees) {
        this.summaries = Collections.unmodifiableMap(new LinkedHashMap<>(summaries));
        this.callees = Collections.unmodifiableMap(new LinkedHashMap<>(callees));
    }

    public static CallSummaries empty() {
        return new CallSummaries(Map.of(), Map.of());
    }

    public boolean isAllocator(String function) {
        if (function == null) return false;
        if (StandardLibrary.isAllocator(function)) return true;
        CallSummary summary = summaries.get(function);
        return summary != null && summary.allocator();
    }

    /*
    index of the argument the call releases, or -1
     */
    public int freedArgument(String function) {
        if (function == null) return -1;
        if (StandardLibrary.isDeallocator(function)) return 0;
        CallSummary summary = summaries.get(function);
        return summary == null ? -1 : summary.freedParameter();
    }

    public CallSummary summary(String function) {
        return summaries.get(function);
    }

    public Map<String, CallSummary> summaries() {
        return summaries;
    }

    public Set<String> callees(String function) {
        return callees.getOrDefault(function, Set.of());
    }

    public boolean isRecursive(String function) {
        return callees(function).contains(function);
    }
}
