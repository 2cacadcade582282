package io.github.eutro.ilcore.util;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * An immutable set of {@code long} values, represented as a minimal sorted
 * list of disjoint, non-adjacent {@link LongInterval intervals}.
 * <p>
 * Because the representation is canonical, two sets are {@link #equals(Object) equal}
 * exactly when they contain the same values.
 */
public final class LongSet {
    /**
     * The empty set.
     */
    public static final LongSet EMPTY = new LongSet(Collections.emptyList());
    /**
     * The set of all {@code long} values.
     */
    public static final LongSet UNIVERSE = new LongSet(Collections.singletonList(
            new LongInterval(Long.MIN_VALUE, Long.MAX_VALUE)));

    private final List<LongInterval> intervals;

    // intervals must already be sorted, disjoint and non-adjacent
    private LongSet(List<LongInterval> intervals) {
        this.intervals = intervals;
    }

    /**
     * Create a set containing the given values.
     *
     * @param values The values.
     * @return The set.
     */
    public static LongSet of(long... values) {
        LongInterval[] intervals = new LongInterval[values.length];
        for (int i = 0; i < values.length; i++) {
            intervals[i] = LongInterval.point(values[i]);
        }
        return of(intervals);
    }

    /**
     * Create a set containing every value in any of the given intervals.
     * The intervals may overlap, touch, and be in any order.
     *
     * @param intervals The intervals.
     * @return The set.
     */
    public static LongSet of(LongInterval... intervals) {
        return normalize(new ArrayList<>(Arrays.asList(intervals)));
    }

    /**
     * Create a set containing all values from {@code start} to {@code inclusiveEnd}, both inclusive.
     *
     * @param start        The smallest value.
     * @param inclusiveEnd The largest value.
     * @return The set.
     */
    public static LongSet range(long start, long inclusiveEnd) {
        return new LongSet(Collections.singletonList(new LongInterval(start, inclusiveEnd)));
    }

    private static LongSet normalize(List<LongInterval> intervals) {
        if (intervals.isEmpty()) return EMPTY;
        Collections.sort(intervals);
        List<LongInterval> merged = new ArrayList<>(intervals.size());
        LongInterval current = intervals.get(0);
        for (int i = 1; i < intervals.size(); i++) {
            LongInterval next = intervals.get(i);
            if (current.touches(next)) {
                current = new LongInterval(current.start, Math.max(current.inclusiveEnd, next.inclusiveEnd));
            } else {
                merged.add(current);
                current = next;
            }
        }
        merged.add(current);
        return new LongSet(Collections.unmodifiableList(merged));
    }

    /**
     * Get whether this set is empty.
     *
     * @return Whether this set contains no values.
     */
    public boolean isEmpty() {
        return intervals.isEmpty();
    }

    /**
     * Get the intervals of this set, in ascending order. No two intervals overlap or touch.
     *
     * @return The unmodifiable list of intervals.
     */
    public List<LongInterval> getIntervals() {
        return intervals;
    }

    /**
     * Check whether a value is in this set.
     *
     * @param value The value.
     * @return Whether the value is in this set.
     */
    public boolean contains(long value) {
        int lo = 0;
        int hi = intervals.size() - 1;
        while (lo <= hi) {
            int mid = (lo + hi) >>> 1;
            LongInterval interval = intervals.get(mid);
            if (value < interval.start) {
                hi = mid - 1;
            } else if (value > interval.inclusiveEnd) {
                lo = mid + 1;
            } else {
                return true;
            }
        }
        return false;
    }

    /**
     * Compute the union of this set and another.
     *
     * @param other The other set.
     * @return The set of values in either set.
     */
    public LongSet union(LongSet other) {
        if (other.isEmpty()) return this;
        if (isEmpty()) return other;
        List<LongInterval> all = new ArrayList<>(intervals.size() + other.intervals.size());
        all.addAll(intervals);
        all.addAll(other.intervals);
        return normalize(all);
    }

    /**
     * Check whether this set shares any value with another.
     *
     * @param other The other set.
     * @return Whether the intersection of the sets is non-empty.
     */
    public boolean overlaps(LongSet other) {
        int i = 0;
        int j = 0;
        while (i < intervals.size() && j < other.intervals.size()) {
            LongInterval a = intervals.get(i);
            LongInterval b = other.intervals.get(j);
            if (a.overlaps(b)) return true;
            if (a.inclusiveEnd < b.inclusiveEnd) {
                i++;
            } else {
                j++;
            }
        }
        return false;
    }

    /**
     * Compute the intersection of this set and another.
     *
     * @param other The other set.
     * @return The set of values in both sets.
     */
    public LongSet intersect(LongSet other) {
        List<LongInterval> result = new ArrayList<>();
        int i = 0;
        int j = 0;
        while (i < intervals.size() && j < other.intervals.size()) {
            LongInterval a = intervals.get(i);
            LongInterval b = other.intervals.get(j);
            if (a.overlaps(b)) {
                result.add(new LongInterval(Math.max(a.start, b.start), Math.min(a.inclusiveEnd, b.inclusiveEnd)));
            }
            if (a.inclusiveEnd < b.inclusiveEnd) {
                i++;
            } else {
                j++;
            }
        }
        if (result.isEmpty()) return EMPTY;
        return new LongSet(Collections.unmodifiableList(result));
    }

    /**
     * Compute the complement of this set in the {@code long} domain.
     *
     * @return The set of values not in this set.
     */
    public LongSet invert() {
        if (isEmpty()) return UNIVERSE;
        List<LongInterval> result = new ArrayList<>(intervals.size() + 1);
        long nextStart = Long.MIN_VALUE;
        boolean open = true;
        for (LongInterval interval : intervals) {
            if (open && interval.start > nextStart) {
                result.add(new LongInterval(nextStart, interval.start - 1));
            }
            if (interval.inclusiveEnd == Long.MAX_VALUE) {
                open = false;
            } else {
                nextStart = interval.inclusiveEnd + 1;
            }
        }
        if (open) {
            result.add(new LongInterval(nextStart, Long.MAX_VALUE));
        }
        return new LongSet(Collections.unmodifiableList(result));
    }

    /**
     * Compute the difference of this set and another.
     *
     * @param other The other set.
     * @return The set of values in this set but not in {@code other}.
     */
    public LongSet except(LongSet other) {
        if (other.isEmpty() || isEmpty()) return this;
        return intersect(other.invert());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LongSet)) return false;
        return intervals.equals(((LongSet) o).intervals);
    }

    @Override
    public int hashCode() {
        return intervals.hashCode();
    }

    /**
     * Format this set as a comma separated list of values and ranges, such as {@code 1, 3..7, 10}.
     * The empty set is formatted as {@code {}}.
     *
     * @return The formatted set.
     */
    @Override
    public String toString() {
        if (isEmpty()) return "{}";
        return intervals.stream()
                .map(LongInterval::toString)
                .collect(Collectors.joining(", "));
    }
}
