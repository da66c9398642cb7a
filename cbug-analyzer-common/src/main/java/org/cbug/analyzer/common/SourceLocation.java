package org.cbug.analyzer.common;

import java.util.Comparator;
import java.util.Objects;

/**
 * A position in a source file. Lines and columns are 1-based; line 0 is used for issues that concern
 * the file as a whole.
 */
public record SourceLocation(String file, int line, int column) implements Comparable<SourceLocation> {

    private static final Comparator<SourceLocation> ORDER = Comparator
            .comparing(SourceLocation::file)
            .thenComparingInt(SourceLocation::line)
            .thenComparingInt(SourceLocation::column);

    public SourceLocation {
        Objects.requireNonNull(file);
        if (line < 0 || column < 0) throw new IllegalArgumentException("Negative position " + line + ":" + column);
    }

    public static SourceLocation ofFile(String file) {
        return new SourceLocation(file, 0, 0);
    }

    public boolean isFileLevel() {
        return line == 0;
    }

    @Override
    public int compareTo(SourceLocation o) {
        return ORDER.compare(this, o);
    }

    @Override
    public String toString() {
        return file + ":" + line + ":" + column;
    }
}
