package org.cbug.analyzer.checkers.memory;

import org.cbug.analyzer.common.SourceLocation;

import java.util.Collections;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * The state of one pointer variable, with the allocation sites that may have produced its value.
 * Sites are only kept for {@link PointerState#ALLOCATED}.
 */
public record PointerValue(PointerState state, SortedSet<SourceLocation> allocationSites) {

    public static final PointerValue TOP = new PointerValue(PointerState.TOP);
    public static final PointerValue UNINITIALIZED = new PointerValue(PointerState.UNINITIALIZED);
    public static final PointerValue NULL = new PointerValue(PointerState.NULL);
    public static final PointerValue VALID = new PointerValue(PointerState.VALID);
    public static final PointerValue FREED = new PointerValue(PointerState.FREED);
    public static final PointerValue UNKNOWN = new PointerValue(PointerState.UNKNOWN);

    public PointerValue {
        Objects.requireNonNull(state);
        allocationSites = state == PointerState.ALLOCATED
                ? Collections.unmodifiableSortedSet(new TreeSet<>(allocationSites))
                : Collections.emptySortedSet();
    }

    private PointerValue(PointerState state) {
        this(state, Collections.emptySortedSet());
    }

    public static PointerValue allocated(SourceLocation site) {
        return new PointerValue(PointerState.ALLOCATED, new TreeSet<>(Set.of(site)));
    }

    public boolean is(PointerState s) {
        return state == s;
    }

    public boolean sharesSiteWith(PointerValue other) {
        return other.allocationSites.stream().anyMatch(allocationSites::contains);
    }

    public PointerValue join(PointerValue other) {
        if (state == PointerState.TOP) return other;
        if (other.state == PointerState.TOP || this.equals(other)) return this;
        if (state == other.state) {
            SortedSet<SourceLocation> sites = new TreeSet<>(allocationSites);
            sites.addAll(other.allocationSites);
            return new PointerValue(state, sites);
        }
        return UNKNOWN;
    }

    @Override
    public String toString() {
        return allocationSites.isEmpty() ? state.label : state.label + allocationSites;
    }
}
