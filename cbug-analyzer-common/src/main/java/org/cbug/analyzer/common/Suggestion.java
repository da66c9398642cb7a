package org.cbug.analyzer.common;

import java.util.Objects;

public record Suggestion(String title, String detail) {
    public Suggestion {
        Objects.requireNonNull(title);
        Objects.requireNonNull(detail);
    }
}
