package org.cbug.analyzer.common;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.junit.jupiter.api.BeforeAll;
import org.slf4j.LoggerFactory;

public class CommonTest {

    protected static final String FILE = "test.c";

    @BeforeAll
    public static void beforeAll() {
        ((Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME)).setLevel(Level.INFO);
    }

    protected static SourceLocation at(int line, int column) {
        return new SourceLocation(FILE, line, column);
    }
}
