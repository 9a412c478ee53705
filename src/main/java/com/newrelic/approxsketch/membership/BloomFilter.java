// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the ApproxSketch project.

package com.newrelic.approxsketch.membership;

import com.google.common.math.LongMath;
import com.newrelic.approxsketch.IncompatibleSketchesException;
import com.newrelic.approxsketch.hash.SketchHashing;

import java.util.Arrays;

import static com.newrelic.approxsketch.InvalidSketchParameterException.checkOpenUnitInterval;
import static com.newrelic.approxsketch.InvalidSketchParameterException.checkPositive;

// Approximate set membership. May report false positives, never false negatives. No deletion.
//
// Probes use Kirsch-Mitzenmacher double hashing: bit (h1 + i * h2) mod m for i in [0, k), with h2 forced odd.
public class BloomFilter {
    private static final long HASH_SEED_A = 0x243F6A8885A308D3L;
    private static final long HASH_SEED_B = 0x13198A2E03707344L;

    private final int bitLength;
    private final int numHashes;
    private final long[] words;
    private long insertedItems;

    public BloomFilter(final long bitLength, final int numHashes) {
        this.bitLength = checkPositive(bitLength, "bitLength");
        this.numHashes = checkPositive(numHashes, "numHashes");
        this.words = new long[(int) ((this.bitLength + 63L) / 64)];
    }

    private BloomFilter(final BloomFilter other) {
        this.bitLength = other.bitLength;
        this.numHashes = other.numHashes;
        this.words = other.words.clone();
        this.insertedItems = other.insertedItems;
    }

    // Sized for "expectedItems" inserts at the target false positive rate.
    public static BloomFilter create(final long expectedItems, final double falsePositiveRate) {
        final long bitLength = optimalBitLength(expectedItems, falsePositiveRate);
        return new BloomFilter(bitLength, optimalNumHashes(bitLength, expectedItems));
    }

    // m = ceil(-n * ln(p) / ln(2)^2), at least 1.
    public static long optimalBitLength(final long expectedItems, final double falsePositiveRate) {
        checkPositive(expectedItems, "expectedItems");
        checkOpenUnitInterval(falsePositiveRate, "falsePositiveRate");
        final double bits = Math.ceil(-expectedItems * Math.log(falsePositiveRate) / (Math.log(2) * Math.log(2)));
        return Math.max(1, (long) bits);
    }

    // k = round((m / n) * ln(2)), at least 1.
    public static int optimalNumHashes(final long bitLength, final long expectedItems) {
        checkPositive(bitLength, "bitLength");
        checkPositive(expectedItems, "expectedItems");
        return (int) Math.max(1, Math.round((double) bitLength / expectedItems * Math.log(2)));
    }

    public int getBitLength() {
        return bitLength;
    }

    public int getNumHashes() {
        return numHashes;
    }

    // Number of insert() calls, duplicates included. Saturates at Long.MAX_VALUE.
    public long getInsertedItems() {
        return insertedItems;
    }

    public boolean isEmpty() {
        return insertedItems == 0;
    }

    public void insert(final Object item) {
        final long h1 = SketchHashing.seededHash(item, HASH_SEED_A);
        final long h2 = SketchHashing.seededHash(item, HASH_SEED_B) | 1;

        long probe = h1;
        for (int i = 0; i < numHashes; i++) {
            final int bit = (int) Long.remainderUnsigned(probe, bitLength);
            words[bit >>> 6] |= 1L << bit;
            probe += h2;
        }
        insertedItems = LongMath.saturatedAdd(insertedItems, 1);
    }

    // false means definitely absent.
    public boolean contains(final Object item) {
        final long h1 = SketchHashing.seededHash(item, HASH_SEED_A);
        final long h2 = SketchHashing.seededHash(item, HASH_SEED_B) | 1;

        long probe = h1;
        for (int i = 0; i < numHashes; i++) {
            final int bit = (int) Long.remainderUnsigned(probe, bitLength);
            if ((words[bit >>> 6] & (1L << bit)) == 0) {
                return false;
            }
            probe += h2;
        }
        return true;
    }

    // (1 - e^(-k * n / m)) ^ k for the current insert count.
    public double estimatedFalsePositiveRate() {
        if (insertedItems == 0) {
            return 0;
        }
        final double k = numHashes;
        return Math.pow(1 - Math.exp(-k * insertedItems / bitLength), k);
    }

    // Bitwise OR. Always returns "this".
    public BloomFilter merge(final BloomFilter other) {
        IncompatibleSketchesException.check(bitLength == other.bitLength && numHashes == other.numHashes,
                "bitLength and numHashes must match for merge: (" + bitLength + ", " + numHashes + ") vs ("
                        + other.bitLength + ", " + other.numHashes + ")");
        for (int i = 0; i < words.length; i++) {
            words[i] |= other.words[i];
        }
        insertedItems = LongMath.saturatedAdd(insertedItems, other.insertedItems);
        return this;
    }

    public void clear() {
        Arrays.fill(words, 0);
        insertedItems = 0;
    }

    public BloomFilter deepCopy() {
        return new BloomFilter(this);
    }

    @Override
    public boolean equals(final Object obj) {
        if (!(obj instanceof BloomFilter)) {
            return false;
        }
        final BloomFilter other = (BloomFilter) obj;
        return bitLength == other.bitLength
                && numHashes == other.numHashes
                && insertedItems == other.insertedItems
                && Arrays.equals(words, other.words);
    }

    @Override
    public int hashCode() {
        int result = Integer.hashCode(bitLength);
        result = 31 * result + Integer.hashCode(numHashes);
        result = 31 * result + Long.hashCode(insertedItems);
        result = 31 * result + Arrays.hashCode(words);
        return result;
    }

    @Override
    public String toString() {
        return "BloomFilter{bitLength=" + bitLength + ", numHashes=" + numHashes + ", insertedItems=" + insertedItems + "}";
    }
}
