package org.cbug.analyzer.syntax;

public class ParseException extends RuntimeException {
    private final String file;
    private final int line;
    private final int column;

    public ParseException(String file, int line, int column, String message) {
        super(file + ":" + line + ":" + column + ": " + message);
        this.file = file;
        this.line = line;
        this.column = column;
    }

    public String getFile() {
        return file;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
