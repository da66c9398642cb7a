package org.cbug.analyzer.syntax.parser;

import org.cbug.analyzer.syntax.CommonTest;
import org.cbug.analyzer.syntax.ParseException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TestParseErrors extends CommonTest {

    @DisplayName("missing semicolon")
    @Test
    public void test1() {
        ParseException pe = assertThrows(ParseException.class, () -> parse("""
                int main(void) {
                    int x = 1
                    return x;
                }
                """));
        assertEquals("test.c", pe.getFile());
        assertEquals(3, pe.getLine());
        assertEquals(5, pe.getColumn());
        assertTrue(pe.getMessage().contains("expected ';'"), pe.getMessage());
    }

    @DisplayName("unclosed block")
    @Test
    public void test2() {
        ParseException pe = assertThrows(ParseException.class, () -> parse("void f(void) {\n  int y;\n"));
        assertTrue(pe.getMessage().contains("to close the block at line 1"), pe.getMessage());
    }

    @DisplayName("garbage at file scope")
    @Test
    public void test3() {
        assertThrows(ParseException.class, () -> parse("42;"));
        assertThrows(ParseException.class, () -> parse("int f(void) { return (1 + ; }"));
    }

    @DisplayName("parse from a file, with compile arguments")
    @Test
    public void test4() throws IOException {
        Path file = Files.createTempFile("cbug", ".c");
        try {
            Files.writeString(file, "int size = N;\n");
            var tu = frontEnd.parse(file, List.of("-DN=16"));
            assertEquals(file.toString(), tu.file());
            assertEquals(1, tu.globals().size());
            assertEquals("16", tu.globals().get(0).initializer().toString());
        } finally {
            Files.delete(file);
        }
    }
}
