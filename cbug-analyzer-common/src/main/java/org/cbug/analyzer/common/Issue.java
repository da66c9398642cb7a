package org.cbug.analyzer.common;

import java.util.Comparator;
import java.util.Objects;

/**
 * One reported defect. Immutable; the suggestion is optional and may be null.
 */
public record Issue(Category category, Severity severity, String message, SourceLocation location,
                    Suggestion suggestion) {

    public static final Comparator<Issue> REPORT_ORDER = Comparator
            .comparingInt((Issue issue) -> issue.severity.rank())
            .thenComparing(Issue::location)
            .thenComparing(Issue::category)
            .thenComparing(Issue::message);

    public Issue {
        Objects.requireNonNull(category);
        Objects.requireNonNull(severity);
        Objects.requireNonNull(message);
        Objects.requireNonNull(location);
    }

    public Issue(Category category, Severity severity, String message, SourceLocation location) {
        this(category, severity, message, location, null);
    }

    public Issue withoutSuggestion() {
        return suggestion == null ? this : new Issue(category, severity, message, location, null);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    @Override
    public String toString() {
        return location + ": " + severity.label + " [" + category.label + "] " + message;
    }
}
