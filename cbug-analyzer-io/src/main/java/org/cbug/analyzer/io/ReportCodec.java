package org.cbug.analyzer.io;

import org.cbug.analyzer.common.*;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * JSON form of a {@link Report}. One report is an object
 * <pre>{"source": ..., "issues": [...], "summary": {category: count}, "severity": {severity: count}}</pre>
 * and each issue an object with category, severity, message, file, line, column and an optional suggestion.
 * Categories and severities are written with their labels. The "severity" object is derived data and is
 * ignored when decoding.
 */
public class ReportCodec {
    private static final Logger LOGGER = LoggerFactory.getLogger(ReportCodec.class);

    public static final String SOURCE = "source";
    public static final String ISSUES = "issues";
    public static final String SUMMARY = "summary";
    public static final String SEVERITY_SUMMARY = "severity";

    private static final String CATEGORY = "category";
    private static final String SEVERITY = "severity";
    private static final String MESSAGE = "message";
    private static final String FILE = "file";
    private static final String LINE = "line";
    private static final String COLUMN = "column";
    private static final String SUGGESTION = "suggestion";
    private static final String TITLE = "title";
    private static final String DETAIL = "detail";

    private final int indent;

    public ReportCodec() {
        this(2);
    }

    // 0 writes everything on one line
    public ReportCodec(int indent) {
        this.indent = indent;
    }

    public String encode(Report report) {
        return encodeReport(report).toString(indent);
    }

    public String encode(List<Report> reports) {
        JSONArray array = new JSONArray();
        reports.forEach(report -> array.put(encodeReport(report)));
        LOGGER.debug("Encoded {} report(s)", reports.size());
        return array.toString(indent);
    }

    public JSONObject encodeReport(Report report) {
        JSONObject json = new JSONObject();
        json.put(SOURCE, report.source());
        JSONArray issues = new JSONArray();
        report.issues().forEach(issue -> issues.put(encodeIssue(issue)));
        json.put(ISSUES, issues);
        JSONObject summary = new JSONObject();
        report.summary().forEach((category, count) -> summary.put(category.label, count));
        json.put(SUMMARY, summary);
        JSONObject severities = new JSONObject();
        report.severitySummary().forEach((severity, count) -> severities.put(severity.label, count));
        json.put(SEVERITY_SUMMARY, severities);
        return json;
    }

    public JSONObject encodeIssue(Issue issue) {
        JSONObject json = new JSONObject();
        json.put(CATEGORY, issue.category().label);
        json.put(SEVERITY, issue.severity().label);
        json.put(MESSAGE, issue.message());
        json.put(FILE, issue.location().file());
        json.put(LINE, issue.location().line());
        json.put(COLUMN, issue.location().column());
        if (issue.suggestion() != null) {
            JSONObject suggestion = new JSONObject();
            suggestion.put(TITLE, issue.suggestion().title());
            suggestion.put(DETAIL, issue.suggestion().detail());
            json.put(SUGGESTION, suggestion);
        }
        return json;
    }

    public Report decode(String json) {
        try {
            return decodeReport(new JSONObject(json));
        } catch (JSONException | UnsupportedOperationException | IllegalArgumentException e) {
            throw new AnalyzerException("report", e);
        }
    }

    public List<Report> decodeAll(String json) {
        try {
            JSONArray array = new JSONArray(json);
            List<Report> reports = new ArrayList<>(array.length());
            for (int i = 0; i < array.length(); i++) {
                reports.add(decodeReport(array.getJSONObject(i)));
            }
            return reports;
        } catch (JSONException | UnsupportedOperationException | IllegalArgumentException e) {
            throw new AnalyzerException("reports", e);
        }
    }

    public Report decodeReport(JSONObject json) {
        String source = json.getString(SOURCE);
        JSONArray array = json.getJSONArray(ISSUES);
        List<Issue> issues = new ArrayList<>(array.length());
        for (int i = 0; i < array.length(); i++) {
            issues.add(decodeIssue(array.getJSONObject(i)));
        }
        Map<Category, Integer> summary = new EnumMap<>(Category.class);
        JSONObject summaryJson = json.optJSONObject(SUMMARY);
        if (summaryJson != null) {
            for (String key : summaryJson.keySet()) {
                summary.put(Category.from(key), summaryJson.getInt(key));
            }
        } else {
            issues.forEach(issue -> summary.merge(issue.category(), 1, Integer::sum));
        }
        return new Report(source, issues, summary);
    }

    public Issue decodeIssue(JSONObject json) {
        SourceLocation location = new SourceLocation(json.getString(FILE), json.getInt(LINE),
                json.optInt(COLUMN, 0));
        JSONObject suggestionJson = json.optJSONObject(SUGGESTION);
        Suggestion suggestion = suggestionJson == null ? null
                : new Suggestion(suggestionJson.getString(TITLE), suggestionJson.optString(DETAIL, ""));
        return new Issue(Category.from(json.getString(CATEGORY)), Severity.from(json.getString(SEVERITY)),
                json.getString(MESSAGE), location, suggestion);
    }
}
