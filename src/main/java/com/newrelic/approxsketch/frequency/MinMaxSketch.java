// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the ApproxSketch project.

package com.newrelic.approxsketch.frequency;

import com.google.common.math.LongMath;
import com.newrelic.approxsketch.IncompatibleSketchesException;
import com.newrelic.approxsketch.hash.SketchHashing;

import java.util.Arrays;

import static com.newrelic.approxsketch.InvalidSketchParameterException.MAX_ARRAY_LENGTH;
import static com.newrelic.approxsketch.InvalidSketchParameterException.check;
import static com.newrelic.approxsketch.InvalidSketchParameterException.checkOpenUnitInterval;
import static com.newrelic.approxsketch.InvalidSketchParameterException.checkPositive;
import static com.newrelic.approxsketch.InvalidSketchParameterException.checkedTableLength;

// Count-min style frequency sketch with conservative update. Counts are non-negative and saturate at
// Long.MAX_VALUE.
//
// Conservative update: the target is (current min across rows) + count, and each row's counter is only
// raised to that target, never blindly incremented. The min across rows therefore never falls below the true
// count, and overestimation from collisions is smaller than with plain count-min.
public class MinMaxSketch {
    private static final long SEED_BASE = 0xA0761D6478BD642FL;

    private final int width;
    private final int depth;
    private final long[] counters; // Row major: row * width + column
    private final long[] seeds;
    private long totalCount;

    public MinMaxSketch(final int width, final int depth) {
        this.width = checkPositive(width, "width");
        this.depth = checkPositive(depth, "depth");
        this.counters = new long[checkedTableLength(width, depth)];
        this.seeds = SketchHashing.deriveSeeds(SEED_BASE, depth);
    }

    private MinMaxSketch(final MinMaxSketch other) {
        this.width = other.width;
        this.depth = other.depth;
        this.counters = other.counters.clone();
        this.seeds = other.seeds.clone();
        this.totalCount = other.totalCount;
    }

    // width = ceil(e / epsilon), depth = ceil(ln(1 / delta)), both at least 1.
    public static MinMaxSketch create(final double epsilon, final double delta) {
        checkOpenUnitInterval(epsilon, "epsilon");
        checkOpenUnitInterval(delta, "delta");
        final double width = Math.ceil(Math.E / epsilon);
        final double depth = Math.ceil(Math.log(1 / delta));
        check(width <= MAX_ARRAY_LENGTH, "epsilon " + epsilon + " requires a width too large to address");
        return new MinMaxSketch((int) Math.max(1, width), (int) Math.max(1, depth));
    }

    public static MinMaxSketch withDimensions(final int width, final int depth) {
        return new MinMaxSketch(width, depth);
    }

    public int getWidth() {
        return width;
    }

    public int getDepth() {
        return depth;
    }

    public long getTotalCount() {
        return totalCount;
    }

    public boolean isEmpty() {
        return totalCount == 0;
    }

    // count must be non-negative.
    public void add(final Object item, final long count) {
        check(count >= 0, "count must not be negative, got " + count);
        if (count == 0) {
            return;
        }

        final int[] indexes = new int[depth];
        long min = Long.MAX_VALUE;
        for (int row = 0; row < depth; row++) {
            indexes[row] = counterIndex(row, item);
            min = Math.min(min, counters[indexes[row]]);
        }

        final long target = LongMath.saturatedAdd(min, count);
        for (final int index : indexes) {
            if (counters[index] < target) {
                counters[index] = target;
            }
        }
        totalCount = LongMath.saturatedAdd(totalCount, count);
    }

    public void increment(final Object item) {
        add(item, 1);
    }

    // Min across rows. Never below the true count.
    public long estimate(final Object item) {
        long min = Long.MAX_VALUE;
        for (int row = 0; row < depth; row++) {
            min = Math.min(min, counters[counterIndex(row, item)]);
        }
        return min;
    }

    // Max across rows. A looser bound than estimate().
    public long maxEstimate(final Object item) {
        long max = 0;
        for (int row = 0; row < depth; row++) {
            max = Math.max(max, counters[counterIndex(row, item)]);
        }
        return max;
    }

    public Interval estimateInterval(final Object item) {
        return new Interval(estimate(item), maxEstimate(item));
    }

    // Element-wise saturating addition. Always returns "this".
    public MinMaxSketch merge(final MinMaxSketch other) {
        IncompatibleSketchesException.check(width == other.width && depth == other.depth,
                "width/depth must match for merge: " + width + "x" + depth + " vs " + other.width + "x" + other.depth);
        IncompatibleSketchesException.check(Arrays.equals(seeds, other.seeds), "hash seeds must match for merge");

        for (int i = 0; i < counters.length; i++) {
            counters[i] = LongMath.saturatedAdd(counters[i], other.counters[i]);
        }
        totalCount = LongMath.saturatedAdd(totalCount, other.totalCount);
        return this;
    }

    public void clear() {
        Arrays.fill(counters, 0);
        totalCount = 0;
    }

    public MinMaxSketch deepCopy() {
        return new MinMaxSketch(this);
    }

    @Override
    public boolean equals(final Object obj) {
        if (!(obj instanceof MinMaxSketch)) {
            return false;
        }
        final MinMaxSketch other = (MinMaxSketch) obj;
        return width == other.width
                && depth == other.depth
                && totalCount == other.totalCount
                && Arrays.equals(seeds, other.seeds)
                && Arrays.equals(counters, other.counters);
    }

    @Override
    public int hashCode() {
        int result = Integer.hashCode(width);
        result = 31 * result + Integer.hashCode(depth);
        result = 31 * result + Long.hashCode(totalCount);
        result = 31 * result + Arrays.hashCode(counters);
        return result;
    }

    @Override
    public String toString() {
        return "MinMaxSketch{width=" + width + ", depth=" + depth + ", totalCount=" + totalCount + "}";
    }

    private int counterIndex(final int row, final Object item) {
        final long column = Long.remainderUnsigned(SketchHashing.seededHash(item, seeds[row]), width);
        return row * width + (int) column;
    }

    // Tightest and loosest estimates for one item. min <= max always holds.
    public static class Interval {
        public final long min;
        public final long max;

        public Interval(final long min, final long max) {
            this.min = min;
            this.max = max;
        }

        @Override
        public boolean equals(final Object obj) {
            if (!(obj instanceof Interval)) {
                return false;
            }
            final Interval other = (Interval) obj;
            return min == other.min && max == other.max;
        }

        @Override
        public int hashCode() {
            return 31 * Long.hashCode(min) + Long.hashCode(max);
        }

        @Override
        public String toString() {
            return "{min=" + min + ", max=" + max + "}";
        }
    }
}
