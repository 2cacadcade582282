package io.github.eutro.ilcore.util;

import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

public class LongSetTest {
    @Test
    void testToString() {
        assertEquals("{}", LongSet.EMPTY.toString());
        assertEquals("5", LongSet.of(5).toString());
        assertEquals("1, 3..7, 10", LongSet.of(1, 3, 4, 5, 6, 7, 10).toString());
        assertEquals("-9223372036854775808..9223372036854775807", LongSet.UNIVERSE.toString());
    }

    @Test
    void testNormalization() {
        LongSet set = LongSet.of(
                new LongInterval(10, 12),
                new LongInterval(1, 3),
                new LongInterval(4, 4),
                new LongInterval(2, 3));
        assertEquals(Arrays.asList(new LongInterval(1, 4), new LongInterval(10, 12)), set.getIntervals());
        assertEquals(LongSet.of(1, 2, 3, 4, 10, 11, 12), set);
        assertEquals(set.hashCode(), LongSet.of(1, 2, 3, 4, 10, 11, 12).hashCode());
    }

    @Test
    void testUnion() {
        LongSet a = LongSet.range(1, 3).union(LongSet.range(5, 7));
        assertEquals("1..3, 5..7", a.toString());
        assertEquals("1..7", a.union(LongSet.of(4)).toString());
        assertSame(a, a.union(LongSet.EMPTY));
        assertSame(a, LongSet.EMPTY.union(a));
    }

    @Test
    void testUnionLaws() {
        LongSet a = LongSet.of(1, 5, 6, 20);
        LongSet b = LongSet.range(4, 10).union(LongSet.of(-2));
        assertEquals(a, a.union(a));
        assertEquals(a.union(b), b.union(a));
        assertEquals(a.overlaps(b), b.overlaps(a));
        assertEquals(LongSet.range(1, 6), LongSet.range(1, 3).union(LongSet.range(4, 6)));
        assertEquals(1, LongSet.range(1, 3).union(LongSet.range(4, 6)).getIntervals().size());
    }

    @Test
    void testOverlaps() {
        LongSet a = LongSet.range(1, 3).union(LongSet.range(10, 20));
        assertTrue(a.overlaps(LongSet.of(15)));
        assertTrue(a.overlaps(LongSet.range(3, 5)));
        assertFalse(a.overlaps(LongSet.range(4, 9)));
        assertFalse(a.overlaps(LongSet.EMPTY));
        assertFalse(LongSet.EMPTY.overlaps(LongSet.UNIVERSE));
        assertTrue(LongSet.UNIVERSE.overlaps(LongSet.of(Long.MIN_VALUE)));
    }

    @Test
    void testContains() {
        LongSet a = LongSet.of(1, 3, 4, 5, 10);
        assertTrue(a.contains(1));
        assertTrue(a.contains(4));
        assertTrue(a.contains(10));
        assertFalse(a.contains(2));
        assertFalse(a.contains(11));
        assertFalse(LongSet.EMPTY.contains(0));
        assertTrue(LongSet.UNIVERSE.contains(Long.MAX_VALUE));
    }

    @Test
    void testIntersectAndExcept() {
        LongSet a = LongSet.range(0, 10);
        LongSet b = LongSet.range(5, 15).union(LongSet.of(-3));
        assertEquals(LongSet.range(5, 10), a.intersect(b));
        assertEquals(LongSet.range(0, 4), a.except(b));
        assertEquals(LongSet.EMPTY, a.intersect(LongSet.range(20, 30)));
        assertEquals(a, a.except(LongSet.EMPTY));
        assertTrue(a.except(LongSet.UNIVERSE).isEmpty());
    }

    @Test
    void testInvert() {
        assertEquals(LongSet.UNIVERSE, LongSet.EMPTY.invert());
        assertEquals(LongSet.EMPTY, LongSet.UNIVERSE.invert());
        assertEquals(LongSet.range(1, Long.MAX_VALUE), LongSet.range(Long.MIN_VALUE, 0).invert());
        assertEquals(LongSet.range(Long.MIN_VALUE, Long.MAX_VALUE - 1), LongSet.of(Long.MAX_VALUE).invert());
        assertEquals("-9223372036854775808..0, 4..9223372036854775807", LongSet.range(1, 3).invert().toString());
        LongSet a = LongSet.of(-7, 0, 42);
        assertEquals(a, a.invert().invert());
    }

    @Test
    void testExtremesDoNotMerge() {
        LongSet set = LongSet.of(Long.MAX_VALUE, Long.MIN_VALUE);
        assertEquals(2, set.getIntervals().size());
        assertEquals("-9223372036854775808, 9223372036854775807", set.toString());
    }

    @Test
    void testBadInterval() {
        assertThrows(IllegalArgumentException.class, () -> new LongInterval(5, 3));
        assertThrows(IllegalArgumentException.class, () -> LongSet.range(1, 0));
    }
}
