package org.cbug.analyzer.checkers.memory;

import org.cbug.analyzer.syntax.Symbol;

import java.util.*;
import java.util.function.BiFunction;
import java.util.stream.Collectors;

/**
 * Immutable map from pointer variable to {@link PointerValue}. A variable without entry is at
 * {@link PointerState#TOP}.
 */
public final class PointerFact {
    public static final PointerFact EMPTY = new PointerFact(Map.of());

    private final Map<Symbol, PointerValue> values;

    private PointerFact(Map<Symbol, PointerValue> values) {
        this.values = values;
    }

    public PointerValue get(Symbol symbol) {
        return values.getOrDefault(symbol, PointerValue.TOP);
    }

    public PointerFact with(Symbol symbol, PointerValue value) {
        if (value.is(PointerState.TOP)) {
            if (!values.containsKey(symbol)) return this;
            Map<Symbol, PointerValue> map = new HashMap<>(values);
            map.remove(symbol);
            return new PointerFact(Collections.unmodifiableMap(map));
        }
        if (value.equals(values.get(symbol))) return this;
        Map<Symbol, PointerValue> map = new HashMap<>(values);
        map.put(symbol, value);
        return new PointerFact(Collections.unmodifiableMap(map));
    }

    /*
    applies the function to every variable that has an entry
     */
    public PointerFact map(BiFunction<Symbol, PointerValue, PointerValue> function) {
        PointerFact result = this;
        for (Map.Entry<Symbol, PointerValue> entry : values.entrySet()) {
            result = result.with(entry.getKey(), function.apply(entry.getKey(), entry.getValue()));
        }
        return result;
    }

    public PointerFact join(PointerFact other) {
        if (this == other || other.values.isEmpty()) return this;
        if (values.isEmpty()) return other;
        Map<Symbol, PointerValue> map = new HashMap<>(values);
        other.values.forEach((symbol, value) -> map.merge(symbol, value, PointerValue::join));
        return new PointerFact(Collections.unmodifiableMap(map));
    }

    // in declaration order
    public List<Symbol> symbols() {
        return values.keySet().stream()
                .sorted(Comparator.comparing(Symbol::location).thenComparing(Symbol::name))
                .toList();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        return this == o || o instanceof PointerFact pf && values.equals(pf.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return symbols().stream().map(s -> s.name() + "=" + values.get(s))
                .collect(Collectors.joining(", ", "{", "}"));
    }
}
