package org.cbug.analyzer.syntax;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

public class SymbolTable {
    private final List<Symbol> symbols;

    public SymbolTable(List<Symbol> symbols) {
        this.symbols = List.copyOf(symbols);
    }

    public List<Symbol> symbols() {
        return symbols;
    }

    public Stream<Symbol> globals() {
        return symbols.stream().filter(s -> s.storage() == StorageKind.GLOBAL);
    }

    public Stream<Symbol> inScope(int scopeId) {
        return symbols.stream().filter(s -> s.scopeId() == scopeId);
    }

    public Optional<Symbol> find(String name, int scopeId) {
        return inScope(scopeId).filter(s -> s.name().equals(name)).reduce((a, b) -> b);
    }

    public int size() {
        return symbols.size();
    }

    public static class Builder {
        private final List<Symbol> symbols = new ArrayList<>();

        public Builder add(Symbol symbol) {
            symbols.add(symbol);
            return this;
        }

        public Builder replace(Symbol previous, Symbol symbol) {
            int index = symbols.lastIndexOf(previous);
            if (index < 0) symbols.add(symbol);
            else symbols.set(index, symbol);
            return this;
        }

        public SymbolTable build() {
            return new SymbolTable(symbols);
        }
    }
}
