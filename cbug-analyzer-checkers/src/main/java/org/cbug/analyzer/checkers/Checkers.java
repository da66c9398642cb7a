package org.cbug.analyzer.checkers;

import org.cbug.analyzer.checkers.loop.LoopTerminationChecker;
import org.cbug.analyzer.checkers.memory.MemoryLifecycleChecker;
import org.cbug.analyzer.checkers.syntactic.*;

import java.util.List;

/*
the static registry; the runner executes the checkers in this order
 */
public final class Checkers {

    public static final List<Checker> DEFAULT = List.of(
            new MemoryLifecycleChecker(),
            new LoopTerminationChecker(),
            new FormatStringChecker(),
            new DivisionByZeroChecker(),
            new UnreachableCodeChecker(),
            new ArrayBoundsChecker(),
            new MissingIncludeChecker(),
            new UninitializedVariableChecker());

    private Checkers() {
    }
}
