package org.cbug.analyzer.syntax;

public enum StorageKind {
    GLOBAL, PARAMETER, LOCAL, STATIC_LOCAL;

    public boolean outlivesFunction() {
        return this == GLOBAL || this == STATIC_LOCAL;
    }
}
