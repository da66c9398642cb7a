package org.cbug.analyzer.io;

import org.cbug.analyzer.common.Issue;
import org.cbug.analyzer.common.Report;
import org.cbug.analyzer.common.Severity;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/*
human-readable form of a report: a header with the file and the count per severity, then one line per issue,
followed by its suggestion when there is one
 */
public class ReportPrinter {
    public static final String NO_ISSUES = "no issues found";

    private final boolean suggestions;

    public ReportPrinter() {
        this(true);
    }

    public ReportPrinter(boolean suggestions) {
        this.suggestions = suggestions;
    }

    public String print(List<Report> reports) {
        return reports.stream().map(this::print).collect(Collectors.joining("\n\n"));
    }

    public String print(Report report) {
        StringBuilder sb = new StringBuilder();
        sb.append("File: ").append(report.source()).append('\n');
        sb.append("Summary: ").append(summary(report.severitySummary()));
        if (report.issues().isEmpty()) {
            sb.append("\n  ").append(NO_ISSUES);
            return sb.toString();
        }
        for (Issue issue : report.issues()) {
            sb.append("\n  ").append(line(issue));
            if (suggestions && issue.suggestion() != null) {
                sb.append("\n    -> ").append(issue.suggestion().title());
                String detail = issue.suggestion().detail().strip();
                if (!detail.isEmpty()) {
                    detail.lines().forEach(l -> sb.append("\n       ").append(l));
                }
            }
        }
        return sb.toString();
    }

    static String line(Issue issue) {
        return "[" + issue.severity().label.toUpperCase() + "][" + issue.category().label + "] "
               + issue.location() + ": " + issue.message();
    }

    // severities without issues are left out; "none" when there are no issues at all
    static String summary(Map<Severity, Integer> counts) {
        String s = counts.entrySet().stream()
                .filter(e -> e.getValue() > 0)
                .map(e -> e.getKey().label + "=" + e.getValue())
                .collect(Collectors.joining(", "));
        return s.isEmpty() ? "none" : s;
    }
}
