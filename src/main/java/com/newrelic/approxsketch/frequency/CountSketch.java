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

// Signed approximate frequencies. Supports decrements, so estimates are net counts and may be negative.
//
// Each row has an index hash selecting a column and a sign hash selecting +1 or -1. An update adds
// sign * delta to the selected counter of every row. A point query is the median over rows of
// sign * counter, which cancels collisions in expectation.
public class CountSketch {
    private static final long INDEX_SEED_BASE = 0x0D6E8FD93A5E4C31L;
    private static final long SIGN_SEED_BASE = 0xA0761D6478BD642FL;

    private final int width;
    private final int depth;
    private final long[] counters; // Row major: row * width + column
    private final long[] indexSeeds;
    private final long[] signSeeds;
    private long totalUpdateMagnitude;

    public CountSketch(final int width, final int depth) {
        this.width = checkPositive(width, "width");
        this.depth = checkPositive(depth, "depth");
        this.counters = new long[checkedTableLength(width, depth)];
        this.indexSeeds = SketchHashing.deriveSeeds(INDEX_SEED_BASE, depth);
        this.signSeeds = SketchHashing.deriveSeeds(SIGN_SEED_BASE, depth);
    }

    private CountSketch(final CountSketch other) {
        this.width = other.width;
        this.depth = other.depth;
        this.counters = other.counters.clone();
        this.indexSeeds = other.indexSeeds.clone();
        this.signSeeds = other.signSeeds.clone();
        this.totalUpdateMagnitude = other.totalUpdateMagnitude;
    }

    // width = ceil(3 / epsilon^2), depth = ceil(ln(1 / delta)), both at least 1.
    public static CountSketch create(final double epsilon, final double delta) {
        checkOpenUnitInterval(epsilon, "epsilon");
        checkOpenUnitInterval(delta, "delta");
        final double width = Math.ceil(3 / (epsilon * epsilon));
        final double depth = Math.ceil(Math.log(1 / delta));
        check(width <= MAX_ARRAY_LENGTH, "epsilon " + epsilon + " requires a width too large to address");
        return new CountSketch((int) Math.max(1, width), (int) Math.max(1, depth));
    }

    public static CountSketch withDimensions(final int width, final int depth) {
        return new CountSketch(width, depth);
    }

    public int getWidth() {
        return width;
    }

    public int getDepth() {
        return depth;
    }

    // Sum of |delta| over all updates. Saturates at Long.MAX_VALUE.
    public long getTotalUpdateMagnitude() {
        return totalUpdateMagnitude;
    }

    public boolean isEmpty() {
        return totalUpdateMagnitude == 0;
    }

    public void add(final Object item, final long delta) {
        if (delta == 0) {
            return;
        }
        for (int row = 0; row < depth; row++) {
            final int index = counterIndex(row, item);
            final long signedDelta = isPositive(row, item) ? delta : LongMath.saturatedSubtract(0, delta);
            counters[index] = LongMath.saturatedAdd(counters[index], signedDelta);
        }
        final long magnitude = delta == Long.MIN_VALUE ? Long.MAX_VALUE : Math.abs(delta);
        totalUpdateMagnitude = LongMath.saturatedAdd(totalUpdateMagnitude, magnitude);
    }

    public void increment(final Object item) {
        add(item, 1);
    }

    public void decrement(final Object item) {
        add(item, -1);
    }

    // Median across rows of the sign corrected counters. With an even depth, the mean of the two middle values.
    public long estimate(final Object item) {
        final long[] estimates = new long[depth];
        for (int row = 0; row < depth; row++) {
            final long counter = counters[counterIndex(row, item)];
            estimates[row] = isPositive(row, item) ? counter : LongMath.saturatedSubtract(0, counter);
        }
        Arrays.sort(estimates);

        final int mid = depth / 2;
        return depth % 2 == 1 ? estimates[mid] : midpoint(estimates[mid - 1], estimates[mid]);
    }

    // Element-wise saturating addition. Always returns "this".
    public CountSketch merge(final CountSketch other) {
        IncompatibleSketchesException.check(width == other.width && depth == other.depth,
                "width/depth must match for merge: " + width + "x" + depth + " vs " + other.width + "x" + other.depth);
        IncompatibleSketchesException.check(Arrays.equals(indexSeeds, other.indexSeeds) && Arrays.equals(signSeeds, other.signSeeds),
                "hash seeds must match for merge");

        for (int i = 0; i < counters.length; i++) {
            counters[i] = LongMath.saturatedAdd(counters[i], other.counters[i]);
        }
        totalUpdateMagnitude = LongMath.saturatedAdd(totalUpdateMagnitude, other.totalUpdateMagnitude);
        return this;
    }

    public void clear() {
        Arrays.fill(counters, 0);
        totalUpdateMagnitude = 0;
    }

    public CountSketch deepCopy() {
        return new CountSketch(this);
    }

    @Override
    public boolean equals(final Object obj) {
        if (!(obj instanceof CountSketch)) {
            return false;
        }
        final CountSketch other = (CountSketch) obj;
        return width == other.width
                && depth == other.depth
                && totalUpdateMagnitude == other.totalUpdateMagnitude
                && Arrays.equals(indexSeeds, other.indexSeeds)
                && Arrays.equals(signSeeds, other.signSeeds)
                && Arrays.equals(counters, other.counters);
    }

    @Override
    public int hashCode() {
        int result = Integer.hashCode(width);
        result = 31 * result + Integer.hashCode(depth);
        result = 31 * result + Long.hashCode(totalUpdateMagnitude);
        result = 31 * result + Arrays.hashCode(counters);
        return result;
    }

    @Override
    public String toString() {
        return "CountSketch{width=" + width + ", depth=" + depth + ", totalUpdateMagnitude=" + totalUpdateMagnitude + "}";
    }

    // (a + b) / 2 rounded toward zero, without overflow.
    static long midpoint(final long a, final long b) {
        final long floor = LongMath.mean(a, b);
        return floor < 0 && ((a ^ b) & 1) != 0 ? floor + 1 : floor;
    }

    private int counterIndex(final int row, final Object item) {
        final long column = Long.remainderUnsigned(SketchHashing.seededHash(item, indexSeeds[row]), width);
        return row * width + (int) column;
    }

    private boolean isPositive(final int row, final Object item) {
        return (SketchHashing.seededHash(item, signSeeds[row]) & 1) == 0;
    }
}
