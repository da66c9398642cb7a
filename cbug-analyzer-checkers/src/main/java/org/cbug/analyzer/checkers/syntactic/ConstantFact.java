package org.cbug.analyzer.checkers.syntactic;

import org.cbug.analyzer.syntax.Symbol;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/*
integral variables with a known constant value; not constant (NAC) once two definitions disagree.
A variable without entry has not been defined on any path yet.
 */
final class ConstantFact {
    static final ConstantFact EMPTY = new ConstantFact(Map.of());

    private record Value(Long constant) {
    }

    private static final Value NAC = new Value(null);

    private final Map<Symbol, Value> values;

    private ConstantFact(Map<Symbol, Value> values) {
        this.values = values;
    }

    // the constant value, or null when unknown
    Long get(Symbol symbol) {
        Value value = values.get(symbol);
        return value == null ? null : value.constant;
    }

    ConstantFact with(Symbol symbol, Long constant) {
        Value value = constant == null ? NAC : new Value(constant);
        if (value.equals(values.get(symbol))) return this;
        Map<Symbol, Value> map = new HashMap<>(values);
        map.put(symbol, value);
        return new ConstantFact(Collections.unmodifiableMap(map));
    }

    ConstantFact forgetAll() {
        Map<Symbol, Value> map = new HashMap<>();
        values.keySet().forEach(s -> map.put(s, NAC));
        return new ConstantFact(Collections.unmodifiableMap(map));
    }

    ConstantFact join(ConstantFact other) {
        if (this == other || other.values.isEmpty()) return this;
        if (values.isEmpty()) return other;
        Map<Symbol, Value> map = new HashMap<>(values);
        other.values.forEach((symbol, value) -> map.merge(symbol, value, (v1, v2) -> v1.equals(v2) ? v1 : NAC));
        return new ConstantFact(Collections.unmodifiableMap(map));
    }

    @Override
    public boolean equals(Object o) {
        return this == o || o instanceof ConstantFact cf && values.equals(cf.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
