package org.cbug.analyzer.checkers.syntactic;

import org.cbug.analyzer.syntax.Symbol;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/*
per scalar local: never assigned on any path (UNASSIGNED), assigned on every path (ASSIGNED), or it depends on
the path (MAYBE). A variable without entry has not been declared on any path yet.
 */
final class InitializationFact {
    static final InitializationFact EMPTY = new InitializationFact(Map.of());

    enum State {UNASSIGNED, ASSIGNED, MAYBE}

    private final Map<Symbol, State> states;

    private InitializationFact(Map<Symbol, State> states) {
        this.states = states;
    }

    // null when the variable has not been declared
    State get(Symbol symbol) {
        return states.get(symbol);
    }

    InitializationFact with(Symbol symbol, State state) {
        if (state == states.get(symbol)) return this;
        Map<Symbol, State> map = new HashMap<>(states);
        map.put(symbol, state);
        return new InitializationFact(Collections.unmodifiableMap(map));
    }

    InitializationFact assignAll() {
        Map<Symbol, State> map = new HashMap<>();
        states.keySet().forEach(s -> map.put(s, State.ASSIGNED));
        return new InitializationFact(Collections.unmodifiableMap(map));
    }

    InitializationFact join(InitializationFact other) {
        if (this == other || other.states.isEmpty()) return this;
        if (states.isEmpty()) return other;
        Map<Symbol, State> map = new HashMap<>(states);
        other.states.forEach((symbol, state) -> map.merge(symbol, state, (s1, s2) -> s1 == s2 ? s1 : State.MAYBE));
        return new InitializationFact(Collections.unmodifiableMap(map));
    }

    @Override
    public boolean equals(Object o) {
        return this == o || o instanceof InitializationFact f && states.equals(f.states);
    }

    @Override
    public int hashCode() {
        return states.hashCode();
    }

    @Override
    public String toString() {
        return states.toString();
    }
}
