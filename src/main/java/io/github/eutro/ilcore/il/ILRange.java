package io.github.eutro.ilcore.il;

/**
 * The range of bytecode offsets an instruction was decoded from, {@code [start, end)}.
 * <p>
 * Used only for diagnostics and mapping decompiled output back to the bytecode.
 */
public final class ILRange {
    /**
     * The empty range, for instructions with no known origin.
     */
    public static final ILRange EMPTY = new ILRange(0, 0);

    /**
     * The first offset in the range.
     */
    public final int start;
    /**
     * The offset after the last offset in the range.
     */
    public final int end;

    /**
     * Construct a range.
     *
     * @param start The first offset.
     * @param end   The offset after the last offset.
     */
    public ILRange(int start, int end) {
        if (end < start) {
            throw new IllegalArgumentException(String.format("Bad range: [%d, %d)", start, end));
        }
        this.start = start;
        this.end = end;
    }

    /**
     * Get whether this range is empty.
     *
     * @return Whether this range contains no offsets.
     */
    public boolean isEmpty() {
        return start == end;
    }

    /**
     * Get the smallest range containing both this and another range.
     *
     * @param other The other range.
     * @return The union.
     */
    public ILRange union(ILRange other) {
        if (other.isEmpty()) return this;
        if (isEmpty()) return other;
        return new ILRange(Math.min(start, other.start), Math.max(end, other.end));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ILRange)) return false;
        ILRange that = (ILRange) o;
        return start == that.start && end == that.end;
    }

    @Override
    public int hashCode() {
        return start * 31 + end;
    }

    @Override
    public String toString() {
        return String.format("IL_%04x..IL_%04x", start, end);
    }
}
