package io.github.eutro.ilcore.util;

/**
 * A non-empty, closed interval of {@code long} values, {@code [start, inclusiveEnd]}.
 * <p>
 * Both ends are inclusive so that every interval of the signed 64-bit domain,
 * including ones touching {@link Long#MAX_VALUE}, can be represented.
 */
public final class LongInterval implements Comparable<LongInterval> {
    /**
     * The smallest value in the interval.
     */
    public final long start;
    /**
     * The largest value in the interval.
     */
    public final long inclusiveEnd;

    /**
     * Construct an interval.
     *
     * @param start        The smallest value in the interval.
     * @param inclusiveEnd The largest value in the interval.
     * @throws IllegalArgumentException If {@code inclusiveEnd < start}.
     */
    public LongInterval(long start, long inclusiveEnd) {
        if (inclusiveEnd < start) {
            throw new IllegalArgumentException(String.format("Empty interval: [%d..%d]", start, inclusiveEnd));
        }
        this.start = start;
        this.inclusiveEnd = inclusiveEnd;
    }

    /**
     * Construct an interval containing a single value.
     *
     * @param value The value.
     * @return The interval.
     */
    public static LongInterval point(long value) {
        return new LongInterval(value, value);
    }

    /**
     * Check whether this interval contains a value.
     *
     * @param value The value.
     * @return Whether {@code start <= value <= inclusiveEnd}.
     */
    public boolean contains(long value) {
        return start <= value && value <= inclusiveEnd;
    }

    /**
     * Check whether this interval shares at least one value with another.
     *
     * @param other The other interval.
     * @return Whether the intervals overlap.
     */
    public boolean overlaps(LongInterval other) {
        return start <= other.inclusiveEnd && other.start <= inclusiveEnd;
    }

    /**
     * Check whether this interval overlaps or directly precedes/follows another,
     * so the two can be merged into a single interval.
     *
     * @param other The other interval.
     * @return Whether the intervals overlap or touch.
     */
    public boolean touches(LongInterval other) {
        if (overlaps(other)) return true;
        if (inclusiveEnd < other.start) return inclusiveEnd + 1 == other.start;
        return other.inclusiveEnd + 1 == start;
    }

    @Override
    public int compareTo(LongInterval o) {
        int c = Long.compare(start, o.start);
        return c != 0 ? c : Long.compare(inclusiveEnd, o.inclusiveEnd);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LongInterval)) return false;
        LongInterval that = (LongInterval) o;
        return start == that.start && inclusiveEnd == that.inclusiveEnd;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(start) * 31 + Long.hashCode(inclusiveEnd);
    }

    @Override
    public String toString() {
        return start == inclusiveEnd ? Long.toString(start) : start + ".." + inclusiveEnd;
    }
}
