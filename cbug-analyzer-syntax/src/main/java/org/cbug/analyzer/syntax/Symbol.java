package org.cbug.analyzer.syntax;

import org.cbug.analyzer.common.SourceLocation;

import java.util.Objects;

/**
 * A declared variable. Two symbols are the same variable when name, scope and declaration site coincide.
 */
public record Symbol(String name, CType type, int scopeId, StorageKind storage, SourceLocation location) {

    public Symbol {
        Objects.requireNonNull(name);
        Objects.requireNonNull(type);
        Objects.requireNonNull(storage);
        Objects.requireNonNull(location);
    }

    public boolean isPointer() {
        return type.isPointer();
    }

    public Symbol withType(CType newType) {
        return new Symbol(name, newType, scopeId, storage, location);
    }

    @Override
    public String toString() {
        return name + "@" + location.line();
    }
}
