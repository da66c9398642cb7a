package org.cbug.analyzer.io;

import org.cbug.analyzer.checkers.AnalyzerRunner;
import org.cbug.analyzer.checkers.impl.AnalyzerRunnerImpl;
import org.cbug.analyzer.common.*;
import org.intellij.lang.annotations.Language;
import org.json.JSONArray;
import org.json.JSONObject;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TestReportCodec extends CommonTest {
    private static final Logger LOGGER = LoggerFactory.getLogger(TestReportCodec.class);

    @Language("c")
    private static final String INPUT1 = """
            int main(void) {
                int a = 5;
                return a / 0;
            }
            """;

    @DisplayName("shape of an encoded report")
    @Test
    public void test1() {
        Report report = makeReport();
        JSONObject json = codec.encodeReport(report);
        assertEquals("a.c", json.getString(ReportCodec.SOURCE));
        JSONArray issues = json.getJSONArray(ReportCodec.ISSUES);
        assertEquals(3, issues.length());

        JSONObject first = issues.getJSONObject(0);
        assertEquals("null-pointer-dereference", first.getString("category"));
        assertEquals("error", first.getString("severity"));
        assertEquals("a.c", first.getString("file"));
        assertEquals(7, first.getInt("line"));
        assertEquals(5, first.getInt("column"));
        assertEquals("Check for NULL", first.getJSONObject("suggestion").getString("title"));

        assertFalse(issues.getJSONObject(1).has("suggestion"));

        JSONObject summary = json.getJSONObject(ReportCodec.SUMMARY);
        assertEquals(3, summary.length());
        assertEquals(1, summary.getInt("unreachable-code"));
        JSONObject severities = json.getJSONObject(ReportCodec.SEVERITY_SUMMARY);
        assertEquals(1, severities.getInt("error"));
        assertEquals(1, severities.getInt("warning"));
        assertEquals(1, severities.getInt("info"));
    }

    @DisplayName("decoding restores the report")
    @Test
    public void test2() {
        Report report = makeReport();
        String json = codec.encode(report);
        LOGGER.debug("Encoded: {}", json);
        Report decoded = codec.decode(json);
        assertEquals(report, decoded);
        assertTrue(decoded.hasErrors());
        assertEquals(1, decoded.count(Category.MISSING_INCLUDE));

        String oneLine = new ReportCodec(0).encode(report);
        assertFalse(oneLine.contains("\n"));
        assertEquals(report, codec.decode(oneLine));
    }

    @DisplayName("report of the analyzer, as a list")
    @Test
    public void test3() {
        Report report = runner.analyze("div.c", INPUT1);
        Report empty = runner.analyze("empty.c", "int main(void) { return 0; }\n");
        String json = codec.encode(List.of(report, empty));

        JSONArray array = new JSONArray(json);
        assertEquals(2, array.length());
        JSONObject issue = array.getJSONObject(0).getJSONArray(ReportCodec.ISSUES).getJSONObject(0);
        assertEquals("division-by-zero", issue.getString("category"));
        assertEquals("Division by zero in '(a / 0)'", issue.getString("message"));
        assertEquals(3, issue.getInt("line"));
        assertTrue(array.getJSONObject(1).getJSONArray(ReportCodec.ISSUES).isEmpty());

        List<Report> decoded = codec.decodeAll(json);
        assertEquals(List.of(report, empty), decoded);
    }

    @DisplayName("summary is recomputed when absent; bad input raises AnalyzerException")
    @Test
    public void test4() {
        @Language("json")
        String json = """
                {"source": "b.c", "issues": [
                 {"category": "double-free", "severity": "error", "message": "Double free of 'p'", "file": "b.c", "line": 9},
                 {"category": "memory-leak", "severity": "warning", "message": "Memory allocated to 'q' is never freed", "file": "b.c", "line": 4, "column": 10}
                ]}
                """;
        Report report = codec.decode(json);
        assertEquals(1, report.count(Category.DOUBLE_FREE));
        assertEquals(1, report.count(Category.MEMORY_LEAK));
        assertEquals(0, report.issues().get(0).location().column());
        assertNull(report.issues().get(0).suggestion());

        AnalyzerException ae = assertThrows(AnalyzerException.class, () -> codec.decode("""
                {"source": "c.c", "issues": [{"category": "no-such-thing", "severity": "error",
                 "message": "?", "file": "c.c", "line": 1}]}
                """));
        assertEquals("report", ae.getSubject());
        assertThrows(AnalyzerException.class, () -> codec.decode("[1, 2"));
        assertThrows(AnalyzerException.class, () -> codec.decodeAll("{}"));
    }

    @DisplayName("the encoded reports do not depend on the run or on parallel analysis")
    @Test
    public void test5(@TempDir Path dir) throws IOException {
        assertEquals(codec.encode(runner.analyze("div.c", INPUT1)), codec.encode(runner.analyze("div.c", INPUT1)));

        for (int i = 0; i < 4; i++) {
            Files.writeString(dir.resolve("f" + i + ".c"), i % 2 == 0 ? INPUT1 : "int main(void) { return 0; }\n");
        }
        List<Path> sources = runner.collectSources(dir);
        AnalyzerRunner parallel = new AnalyzerRunnerImpl(new AnalyzerRunnerImpl.ConfigurationBuilder()
                .setParallel(true).build());
        String sequentialJson = codec.encode(runner.analyzeAll(sources));
        assertEquals(sequentialJson, codec.encode(parallel.analyzeAll(sources)));
        assertEquals(4, new JSONArray(sequentialJson).length());
    }
}
