// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the ApproxSketch project.

package com.newrelic.approxsketch.similarity;

import com.newrelic.approxsketch.IncompatibleSketchesException;
import com.newrelic.approxsketch.JaccardEstimator;
import com.newrelic.approxsketch.hash.SketchHashing;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

import java.util.Arrays;

import static com.newrelic.approxsketch.InvalidSketchParameterException.MAX_ARRAY_LENGTH;
import static com.newrelic.approxsketch.InvalidSketchParameterException.check;
import static com.newrelic.approxsketch.InvalidSketchParameterException.checkArrayLength;
import static com.newrelic.approxsketch.InvalidSketchParameterException.checkOpenUnitInterval;

// MinHash signature for Jaccard similarity estimation.
//
// Slot i keeps the minimum, in unsigned order, of seededHash(item, seed[i]) over all added items. Two sets agree
// on a slot with probability equal to their Jaccard index, so the fraction of equal slots estimates it.
public class MinHash implements JaccardEstimator<MinHash> {
    public static final int DEFAULT_NUM_HASHES = 128;

    private static final long SEED_BASE = 0xBF58476D1CE4E5B9L;
    private static final long EMPTY_SLOT = -1L; // Unsigned max

    private final long[] seeds;
    private final long[] signature;
    private boolean observedAny;

    public MinHash() {
        this(DEFAULT_NUM_HASHES);
    }

    public MinHash(final int numHashes) {
        checkArrayLength(numHashes, "numHashes");
        this.seeds = SketchHashing.deriveSeeds(SEED_BASE, numHashes);
        this.signature = new long[numHashes];
        Arrays.fill(signature, EMPTY_SLOT);
    }

    private MinHash(final MinHash other) {
        this.seeds = other.seeds; // Immutable after construction
        this.signature = other.signature.clone();
        this.observedAny = other.observedAny;
    }

    // numHashes = ceil(1 / stdError^2)
    public static MinHash withErrorRate(final double stdError) {
        checkOpenUnitInterval(stdError, "stdError");
        final double numHashes = Math.ceil(1 / (stdError * stdError));
        check(numHashes <= MAX_ARRAY_LENGTH, "stdError " + stdError + " requires too many hashes");
        return new MinHash(Math.max(1, (int) numHashes));
    }

    public int getNumHashes() {
        return signature.length;
    }

    public double expectedError() {
        return 1 / Math.sqrt(signature.length);
    }

    public boolean isEmpty() {
        return !observedAny;
    }

    // Returns a copy. Slots are unsigned 64-bit values; untouched slots hold -1 (all bits set).
    public long[] getSignature() {
        return signature.clone();
    }

    public void add(final Object item) {
        for (int i = 0; i < seeds.length; i++) {
            final long hash = SketchHashing.seededHash(item, seeds[i]);
            if (Long.compareUnsigned(hash, signature[i]) < 0) {
                signature[i] = hash;
            }
        }
        observedAny = true;
    }

    // 1.0 when both sides are empty, 0.0 when exactly one is.
    public double estimateJaccard(final MinHash other) {
        checkCompatible(other, "estimate");

        if (!observedAny || !other.observedAny) {
            return observedAny == other.observedAny ? 1.0 : 0.0;
        }

        int matches = 0;
        for (int i = 0; i < signature.length; i++) {
            if (signature[i] == other.signature[i]) {
                matches++;
            }
        }
        return (double) matches / signature.length;
    }

    @Override
    public double jaccardIndex(final MinHash other) {
        return estimateJaccard(other);
    }

    // Signature of the union of both input sets.
    public MinHash merge(final MinHash other) {
        checkCompatible(other, "merge");
        for (int i = 0; i < signature.length; i++) {
            if (Long.compareUnsigned(other.signature[i], signature[i]) < 0) {
                signature[i] = other.signature[i];
            }
        }
        observedAny |= other.observedAny;
        return this;
    }

    public void clear() {
        Arrays.fill(signature, EMPTY_SLOT);
        observedAny = false;
    }

    public MinHash deepCopy() {
        return new MinHash(this);
    }

    // No copy. Callers in this package must not modify the array.
    @SuppressFBWarnings(value = "EI_EXPOSE_REP")
    long[] signatureView() {
        return signature;
    }

    private void checkCompatible(final MinHash other, final String operation) {
        IncompatibleSketchesException.check(Arrays.equals(seeds, other.seeds),
                "numHashes/hash seeds must match for " + operation + ": " + seeds.length + " vs " + other.seeds.length);
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof MinHash)) {
            return false;
        }
        final MinHash other = (MinHash) obj;
        return observedAny == other.observedAny
                && Arrays.equals(seeds, other.seeds)
                && Arrays.equals(signature, other.signature);
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(signature);
        result = 31 * result + Boolean.hashCode(observedAny);
        return result;
    }

    @Override
    public String toString() {
        return "MinHash{numHashes=" + signature.length + ", empty=" + !observedAny + "}";
    }
}
