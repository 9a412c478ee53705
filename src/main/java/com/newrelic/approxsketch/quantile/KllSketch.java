// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the ApproxSketch project.

package com.newrelic.approxsketch.quantile;

import com.google.common.math.LongMath;
import com.newrelic.approxsketch.IncompatibleSketchesException;
import com.newrelic.approxsketch.hash.SplitMixRandom;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

import static com.newrelic.approxsketch.InvalidSketchParameterException.check;
import static com.newrelic.approxsketch.InvalidSketchParameterException.checkOpenUnitInterval;

// KLL style quantile sketch.
//
// Level 0 receives raw values. A value retained at level L stands for 2^L input values. Level L holds at most
// max(2, ceil(k * 0.75^L)) values; when it overflows it is compacted: sorted, one value held back if the
// length is odd, and every other value (starting at a random offset of 0 or 1) promoted to level L + 1.
// Memory is O(k log(n / k)) instead of O(n), at the price of a small randomized rank error.
public class KllSketch implements QuantileSketch<KllSketch> {
    public static final int MIN_K = 2;
    public static final int DEFAULT_K = 200;

    private static final double CAPACITY_DECAY = 0.75;
    private static final long RANDOM_SEED = 0xD1B54A32C192ED03L;

    private final int k;
    private final List<Level> levels;
    private final SplitMixRandom random;
    private long count;

    public KllSketch() {
        this(DEFAULT_K);
    }

    public KllSketch(final int k) {
        check(k >= MIN_K, "k must be at least " + MIN_K + ", got " + k);
        this.k = k;
        this.levels = new ArrayList<>();
        this.levels.add(new Level());
        this.random = new SplitMixRandom(RANDOM_SEED);
    }

    private KllSketch(final KllSketch other) {
        this.k = other.k;
        this.levels = new ArrayList<>(other.levels.size());
        for (final Level level : other.levels) {
            this.levels.add(level.deepCopy());
        }
        this.random = other.random.deepCopy();
        this.count = other.count;
    }

    // k = ceil(2 / rankError), at least MIN_K.
    public static KllSketch withErrorRate(final double rankError) {
        checkOpenUnitInterval(rankError, "rankError");
        return new KllSketch((int) Math.max(MIN_K, Math.min(Math.ceil(2 / rankError), Integer.MAX_VALUE)));
    }

    public int getK() {
        return k;
    }

    @Override
    public long getCount() {
        return count;
    }

    @Override
    public boolean isEmpty() {
        return count == 0;
    }

    public int getNumLevels() {
        return levels.size();
    }

    // Number of values physically kept across all levels.
    public int getRetainedItems() {
        int retained = 0;
        for (final Level level : levels) {
            retained += level.size;
        }
        return retained;
    }

    @Override
    public void add(final double value) {
        if (!Double.isFinite(value)) {
            return;
        }
        levels.get(0).add(value);
        count = LongMath.saturatedAdd(count, 1);
        compactAllLevels();
    }

    // Value at weighted rank round(q * (totalWeight - 1)) among the retained values.
    @Override
    public double quantile(final double q) {
        QuantileSketch.checkQuantile(q);
        check(count > 0, "quantile is undefined for an empty sketch");

        final int retained = getRetainedItems();
        final double[] values = new double[retained];
        final long[] weights = new long[retained];
        int n = 0;
        for (int level = 0; level < levels.size(); level++) {
            final Level current = levels.get(level);
            final long weight = level < Long.SIZE - 1 ? 1L << level : Long.MAX_VALUE;
            for (int i = 0; i < current.size; i++) {
                values[n] = current.values[i];
                weights[n] = weight;
                n++;
            }
        }

        final Integer[] order = new Integer[retained];
        long totalWeight = 0;
        for (int i = 0; i < retained; i++) {
            order[i] = i;
            totalWeight = LongMath.saturatedAdd(totalWeight, weights[i]);
        }
        Arrays.sort(order, Comparator.comparingDouble(i -> values[i]));

        final long targetRank = Math.round((totalWeight - 1) * q);
        long cumulative = 0;
        for (final int i : order) {
            cumulative = LongMath.saturatedAdd(cumulative, weights[i]);
            if (cumulative > targetRank) {
                return values[i];
            }
        }
        // The final cumulative weight exceeds any target rank of a non-empty sketch.
        throw new IllegalStateException("Unable to compute quantile " + q + " from " + this);
    }

    // Concatenates matching levels, then compacts. Always returns "this".
    @Override
    public KllSketch merge(final KllSketch other) {
        IncompatibleSketchesException.check(k == other.k, "k must match for merge: " + k + " vs " + other.k);

        final int otherLevels = other.levels.size();
        while (levels.size() < otherLevels) {
            levels.add(new Level());
        }
        for (int level = 0; level < otherLevels; level++) {
            final Level source = other.levels.get(level);
            levels.get(level).addAll(source.values, source.size);
        }
        count = LongMath.saturatedAdd(count, other.count);
        compactAllLevels();
        return this;
    }

    @Override
    public void clear() {
        levels.clear();
        levels.add(new Level());
        count = 0;
    }

    @Override
    public KllSketch deepCopy() {
        return new KllSketch(this);
    }

    @Override
    public boolean equals(final Object obj) {
        if (!(obj instanceof KllSketch)) {
            return false;
        }
        final KllSketch other = (KllSketch) obj;
        return k == other.k
                && count == other.count
                && levels.equals(other.levels)
                && random.equals(other.random);
    }

    @Override
    public int hashCode() {
        int result = Integer.hashCode(k);
        result = 31 * result + Long.hashCode(count);
        result = 31 * result + levels.hashCode();
        return result;
    }

    @Override
    public String toString() {
        return "KllSketch{k=" + k + ", count=" + count + ", levels=" + levels.size() + ", retained=" + getRetainedItems() + "}";
    }

    int levelCapacity(final int level) {
        return (int) Math.max(2, Math.ceil(k * Math.pow(CAPACITY_DECAY, level)));
    }

    private void compactAllLevels() {
        // levels may grow while iterating, the new top level is checked too.
        for (int level = 0; level < levels.size(); level++) {
            if (levels.get(level).size > levelCapacity(level)) {
                compactLevel(level);
            }
        }
    }

    private void compactLevel(final int level) {
        if (level + 1 == levels.size()) {
            levels.add(new Level());
        }
        final Level current = levels.get(level);
        final Level next = levels.get(level + 1);

        Arrays.sort(current.values, 0, current.size);

        // An odd length keeps its largest value at this level.
        final int compactable = current.size - (current.size % 2);
        final int offset = random.nextBoolean() ? 1 : 0;
        for (int i = offset; i < compactable; i += 2) {
            next.add(current.values[i]);
        }

        if (compactable < current.size) {
            current.values[0] = current.values[compactable];
            current.size = 1;
        } else {
            current.size = 0;
        }
    }

    // Growable array of doubles.
    private static final class Level {
        private double[] values = new double[8];
        private int size;

        void add(final double value) {
            if (size == values.length) {
                values = Arrays.copyOf(values, size * 2);
            }
            values[size++] = value;
        }

        void addAll(final double[] source, final int length) {
            if (size + length > values.length) {
                values = Arrays.copyOf(values, Math.max(size + length, size * 2));
            }
            System.arraycopy(source, 0, values, size, length);
            size += length;
        }

        Level deepCopy() {
            final Level copy = new Level();
            copy.values = Arrays.copyOf(values, Math.max(size, 8));
            copy.size = size;
            return copy;
        }

        @Override
        public boolean equals(final Object obj) {
            if (!(obj instanceof Level)) {
                return false;
            }
            final Level other = (Level) obj;
            return Arrays.equals(values, 0, size, other.values, 0, other.size);
        }

        @Override
        public int hashCode() {
            int result = 1;
            for (int i = 0; i < size; i++) {
                result = 31 * result + Double.hashCode(values[i]);
            }
            return result;
        }
    }
}
