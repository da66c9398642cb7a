package org.cbug.analyzer.syntax;

public enum TypeCategory {
    POINTER, INTEGRAL, FLOATING, STRUCT, ARRAY, VOID, FUNCTION, UNKNOWN
}
