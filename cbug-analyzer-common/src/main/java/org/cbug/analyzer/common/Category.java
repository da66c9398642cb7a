package org.cbug.analyzer.common;

import java.util.Arrays;

public enum Category {
    WILD_POINTER("wild-pointer"),
    NULL_POINTER_DEREFERENCE("null-pointer-dereference"),
    MEMORY_LEAK("memory-leak"),
    USE_AFTER_FREE("use-after-free"),
    DOUBLE_FREE("double-free"),
    FORMAT_STRING("format-string"),
    INFINITE_LOOP("infinite-loop"),
    DIVISION_BY_ZERO("division-by-zero"),
    UNREACHABLE_CODE("unreachable-code"),
    ARRAY_INDEX_OUT_OF_BOUNDS("array-index-out-of-bounds"),
    MISSING_INCLUDE("missing-include"),
    UNINITIALIZED_VARIABLE("uninitialized-variable"),

    // infrastructure: the analysis itself could not be carried out completely
    PARSE_FAILURE("parse-failure"),
    INTERNAL_ERROR("internal-error");

    public final String label;

    Category(String label) {
        this.label = label;
    }

    public boolean isInfrastructure() {
        return this == PARSE_FAILURE || this == INTERNAL_ERROR;
    }

    public static Category from(String label) {
        return Arrays.stream(values()).filter(c -> c.label.equals(label)).findFirst()
                .orElseThrow(() -> new UnsupportedOperationException("Unknown category " + label));
    }
}
