package org.cbug.analyzer.checkers.memory;

import org.cbug.analyzer.checkers.CommonTest;
import org.cbug.analyzer.common.SourceLocation;
import org.cbug.analyzer.syntax.CType;
import org.cbug.analyzer.syntax.StorageKind;
import org.cbug.analyzer.syntax.Symbol;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TestPointerFact extends CommonTest {

    private static final SourceLocation SITE1 = new SourceLocation("test.c", 3, 14);
    private static final SourceLocation SITE2 = new SourceLocation("test.c", 5, 14);

    @Test
    public void test1() {
        PointerValue a1 = PointerValue.allocated(SITE1);
        PointerValue a2 = PointerValue.allocated(SITE2);
        assertSame(a1, PointerValue.TOP.join(a1));
        assertSame(a1, a1.join(PointerValue.TOP));
        {
            PointerValue joined = a1.join(a2);
            assertTrue(joined.is(PointerState.ALLOCATED));
            assertEquals(List.of(SITE1, SITE2), List.copyOf(joined.allocationSites()));
        }
        assertEquals(PointerValue.UNKNOWN, a1.join(PointerValue.FREED));
        assertEquals(PointerValue.UNKNOWN, PointerValue.NULL.join(PointerValue.UNINITIALIZED));
        assertEquals(PointerValue.NULL, PointerValue.NULL.join(PointerValue.NULL));
        assertTrue(PointerValue.FREED.allocationSites().isEmpty());
    }

    @Test
    public void test2() {
        Symbol p = new Symbol("p", CType.pointerTo(CType.INT), 1, StorageKind.LOCAL,
                new SourceLocation("test.c", 2, 10));
        Symbol q = new Symbol("q", CType.pointerTo(CType.INT), 1, StorageKind.LOCAL,
                new SourceLocation("test.c", 3, 10));
        PointerFact f1 = PointerFact.EMPTY.with(p, PointerValue.NULL).with(q, PointerValue.FREED);
        PointerFact f2 = PointerFact.EMPTY.with(p, PointerValue.VALID);
        assertSame(PointerValue.TOP, f2.get(q));

        PointerFact joined = f1.join(f2);
        assertEquals(PointerValue.UNKNOWN, joined.get(p));
        assertEquals(PointerValue.FREED, joined.get(q));
        assertEquals(List.of(p, q), joined.symbols());
        assertEquals(joined, f2.join(f1));

        assertTrue(f1.with(p, PointerValue.TOP).with(q, PointerValue.TOP).isEmpty());
        assertEquals(PointerFact.EMPTY, PointerFact.EMPTY.join(PointerFact.EMPTY));
    }
}
