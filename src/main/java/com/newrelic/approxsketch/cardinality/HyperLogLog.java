// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the ApproxSketch project.

package com.newrelic.approxsketch.cardinality;

import com.newrelic.approxsketch.IncompatibleSketchesException;
import com.newrelic.approxsketch.JaccardEstimator;
import com.newrelic.approxsketch.hash.SketchHashing;

import java.util.Arrays;

import static com.newrelic.approxsketch.InvalidSketchParameterException.check;
import static com.newrelic.approxsketch.InvalidSketchParameterException.checkOpenUnitInterval;

// Approximate distinct counter over 2^precision one-byte registers.
//
// The top "precision" bits of the 64-bit item hash select a register. The register keeps the max rank seen,
// where rank is the 1-based position of the first set bit in the remaining bits, capped at 64 - precision + 1.
// Estimation is the classic harmonic mean estimator with linear counting for small cardinalities and a
// 64-bit hash space correction for very large ones.
public class HyperLogLog implements JaccardEstimator<HyperLogLog> {
    public static final int MIN_PRECISION = 4;
    public static final int MAX_PRECISION = 18;
    public static final int DEFAULT_PRECISION = 14;

    private static final long HASH_SEED = 0xD6E8FD935E7A4A6DL;
    private static final double TWO_TO_THE_64 = 0x1.0p64;

    private final int precision;
    private final byte[] registers;

    public HyperLogLog() {
        this(DEFAULT_PRECISION);
    }

    public HyperLogLog(final int precision) {
        check(precision >= MIN_PRECISION && precision <= MAX_PRECISION,
                "precision must be in [" + MIN_PRECISION + ", " + MAX_PRECISION + "], got " + precision);
        this.precision = precision;
        this.registers = new byte[1 << precision];
    }

    private HyperLogLog(final HyperLogLog other) {
        this.precision = other.precision;
        this.registers = other.registers.clone();
    }

    // precision = ceil(log2((1.04 / relativeError)^2)), clamped to [MIN_PRECISION, MAX_PRECISION].
    public static HyperLogLog withErrorRate(final double relativeError) {
        checkOpenUnitInterval(relativeError, "relativeError");
        final double requiredRegisters = Math.pow(1.04 / relativeError, 2);
        final int precision = (int) Math.ceil(Math.log(requiredRegisters) / Math.log(2));
        return new HyperLogLog(Math.max(MIN_PRECISION, Math.min(MAX_PRECISION, precision)));
    }

    public int getPrecision() {
        return precision;
    }

    public int getRegisterCount() {
        return registers.length;
    }

    // 1.04 / sqrt(m)
    public double expectedRelativeError() {
        return 1.04 / Math.sqrt(registers.length);
    }

    public boolean isEmpty() {
        for (final byte register : registers) {
            if (register != 0) {
                return false;
            }
        }
        return true;
    }

    public void add(final Object item) {
        addHash(SketchHashing.seededHash(item, HASH_SEED));
    }

    void addHash(final long hash) {
        final int index = (int) (hash >>> (64 - precision));
        final byte rank = rank(hash, precision);
        if (rank > registers[index]) {
            registers[index] = rank;
        }
    }

    public double estimate() {
        if (isEmpty()) {
            return 0;
        }

        final double m = registers.length;
        double harmonicSum = 0;
        int zeroRegisters = 0;
        for (final byte register : registers) {
            harmonicSum += Math.scalb(1.0, -register);
            if (register == 0) {
                zeroRegisters++;
            }
        }

        final double rawEstimate = alpha(registers.length) * m * m / harmonicSum;

        // Small range: linear counting.
        final double estimate = rawEstimate <= 2.5 * m && zeroRegisters > 0
                ? m * Math.log(m / zeroRegisters)
                : rawEstimate;

        // Large range: hash collisions in the 64-bit space.
        if (estimate > TWO_TO_THE_64 / 30) {
            final double ratio = Math.min(estimate / TWO_TO_THE_64, 1 - Math.ulp(1.0));
            return -TWO_TO_THE_64 * Math.log(1 - ratio);
        }
        return estimate;
    }

    public long count() {
        return Math.round(estimate());
    }

    // Register-wise max. Same result as observing the union stream. Always returns "this".
    public HyperLogLog merge(final HyperLogLog other) {
        checkCompatible(other);
        for (int i = 0; i < registers.length; i++) {
            if (other.registers[i] > registers[i]) {
                registers[i] = other.registers[i];
            }
        }
        return this;
    }

    // |A ∪ B|
    public double unionEstimate(final HyperLogLog other) {
        checkCompatible(other);
        return deepCopy().merge(other).estimate();
    }

    // |A| + |B| - |A ∪ B|, clamped into [0, min(|A|, |B|)] to absorb estimator noise.
    public double intersectionEstimate(final HyperLogLog other) {
        final double union = unionEstimate(other);
        final double a = estimate();
        final double b = other.estimate();
        return Math.min(Math.max(a + b - union, 0), Math.min(a, b));
    }

    // Intersection over union in [0, 1]. Two empty sketches are identical sets, hence 1.
    @Override
    public double jaccardIndex(final HyperLogLog other) {
        final double union = unionEstimate(other);
        if (union == 0) {
            return 1.0;
        }
        return Math.min(Math.max(intersectionEstimate(other) / union, 0), 1);
    }

    public void clear() {
        Arrays.fill(registers, (byte) 0);
    }

    public HyperLogLog deepCopy() {
        return new HyperLogLog(this);
    }

    @Override
    public boolean equals(final Object obj) {
        if (!(obj instanceof HyperLogLog)) {
            return false;
        }
        final HyperLogLog other = (HyperLogLog) obj;
        return precision == other.precision && Arrays.equals(registers, other.registers);
    }

    @Override
    public int hashCode() {
        return 31 * Integer.hashCode(precision) + Arrays.hashCode(registers);
    }

    @Override
    public String toString() {
        return "HyperLogLog{precision=" + precision + ", estimate=" + estimate() + "}";
    }

    private void checkCompatible(final HyperLogLog other) {
        IncompatibleSketchesException.check(precision == other.precision,
                "precision must match: " + precision + " vs " + other.precision);
    }

    static byte rank(final long hash, final int precision) {
        final long suffix = hash << precision;
        final int maxRank = 64 - precision + 1;
        return (byte) Math.min(Long.numberOfLeadingZeros(suffix) + 1, maxRank);
    }

    // Bias correction constant for m registers.
    static double alpha(final int m) {
        switch (m) {
            case 16:
                return 0.673;
            case 32:
                return 0.697;
            case 64:
                return 0.709;
            default:
                return 0.7213 / (1 + 1.079 / m);
        }
    }
}
