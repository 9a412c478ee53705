// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the ApproxSketch project.

package com.newrelic.approxsketch.membership;

import com.google.common.math.LongMath;
import com.newrelic.approxsketch.hash.SketchHashing;
import com.newrelic.approxsketch.hash.SplitMixRandom;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;

import static com.newrelic.approxsketch.InvalidSketchParameterException.check;
import static com.newrelic.approxsketch.InvalidSketchParameterException.checkOpenUnitInterval;
import static com.newrelic.approxsketch.InvalidSketchParameterException.checkPositive;
import static com.newrelic.approxsketch.InvalidSketchParameterException.checkedTableLength;

// Approximate set membership with deletion.
//
// Each bucket holds BUCKET_SIZE fingerprints of "fingerprintBits" bits. Fingerprint 0 marks an empty slot,
// so real fingerprints are forced non-zero. An item lives in one of two buckets:
//      indexA = hash(item) & (bucketCount - 1)
//      indexB = indexA ^ (hash(fingerprint) & (bucketCount - 1))
// The relation is symmetric, so the alternate of indexB is indexA again. This lets a relocated fingerprint
// find its other home without the original item.
public class CuckooFilter {
    private static final Logger logger = LoggerFactory.getLogger(CuckooFilter.class);

    public static final int BUCKET_SIZE = 4;
    public static final int DEFAULT_MAX_KICKS = 500;
    public static final int MIN_FINGERPRINT_BITS = 4;
    public static final int MAX_FINGERPRINT_BITS = 16;
    public static final int MAX_KICKS_LIMIT = 1 << 16;

    // Largest power-of-two bucket count whose slot array is int-addressable.
    static final int MAX_BUCKET_COUNT = 1 << 28;

    // Buckets are sized for this fraction of slots in use.
    private static final double TARGET_LOAD_FACTOR = 0.90;

    private static final long INDEX_SEED = 0x243F6A8885A308D3L;
    private static final long FINGERPRINT_SEED = 0x13198A2E03707344L;
    private static final long ALT_INDEX_SEED = 0xA4093822299F31D0L;
    private static final long RANDOM_SEED = 0xD6E8FD935E7A4A6DL;

    private final int bucketCount;
    private final int fingerprintBits;
    private final int maxKicks;

    // bucketCount * BUCKET_SIZE slots. Bucket b owns slots [b * BUCKET_SIZE, (b + 1) * BUCKET_SIZE).
    // Fingerprints are unsigned 16-bit values stored in shorts.
    private final short[] slots;
    private final SplitMixRandom random;
    private long insertedItems;
    // Slots touched by the current relocation walk. Grows with the walk, up to maxKicks.
    private int[] kickPath = new int[0];

    public CuckooFilter(final int bucketCount, final int fingerprintBits, final int maxKicks) {
        check(bucketCount > 0 && Integer.bitCount(bucketCount) == 1,
                "bucketCount must be a non-zero power of two, got " + bucketCount);
        check(bucketCount <= MAX_BUCKET_COUNT, "bucketCount is too large, got " + bucketCount);
        check(fingerprintBits >= 1 && fingerprintBits <= MAX_FINGERPRINT_BITS,
                "fingerprintBits must be in [1, " + MAX_FINGERPRINT_BITS + "], got " + fingerprintBits);
        checkPositive(maxKicks, "maxKicks");
        check(maxKicks <= MAX_KICKS_LIMIT, "maxKicks must be at most " + MAX_KICKS_LIMIT + ", got " + maxKicks);

        this.bucketCount = bucketCount;
        this.fingerprintBits = fingerprintBits;
        this.maxKicks = maxKicks;
        this.slots = new short[checkedTableLength(bucketCount, BUCKET_SIZE)];
        this.random = new SplitMixRandom(RANDOM_SEED);
    }

    private CuckooFilter(final CuckooFilter other) {
        this.bucketCount = other.bucketCount;
        this.fingerprintBits = other.fingerprintBits;
        this.maxKicks = other.maxKicks;
        this.slots = other.slots.clone();
        this.random = other.random.deepCopy();
        this.insertedItems = other.insertedItems;
    }

    // Sized for "expectedItems" at the target false positive rate.
    // fingerprintBits = clamp(ceil(log2(1 / p)) + 1, 4, 16)
    // bucketCount = nextPowerOfTwo(max(2, ceil(n / BUCKET_SIZE / TARGET_LOAD_FACTOR)))
    public static CuckooFilter create(final long expectedItems, final double falsePositiveRate) {
        checkPositive(expectedItems, "expectedItems");
        checkOpenUnitInterval(falsePositiveRate, "falsePositiveRate");

        final int bits = (int) Math.ceil(Math.log(1 / falsePositiveRate) / Math.log(2)) + 1;
        final int fingerprintBits = Math.max(MIN_FINGERPRINT_BITS, Math.min(MAX_FINGERPRINT_BITS, bits));

        final long minBuckets = Math.max(2, (long) Math.ceil(expectedItems / (double) BUCKET_SIZE / TARGET_LOAD_FACTOR));
        check(minBuckets <= MAX_BUCKET_COUNT, "expectedItems is too large, got " + expectedItems);
        final int buckets = (int) LongMath.ceilingPowerOfTwo(minBuckets);

        return new CuckooFilter(buckets, fingerprintBits, DEFAULT_MAX_KICKS);
    }

    public int getBucketCount() {
        return bucketCount;
    }

    public int getFingerprintBits() {
        return fingerprintBits;
    }

    public int getMaxKicks() {
        return maxKicks;
    }

    // Successful inserts minus successful deletes.
    public long getInsertedItems() {
        return insertedItems;
    }

    public boolean isEmpty() {
        return insertedItems == 0;
    }

    // Fraction of slots in use, in [0, 1].
    public double loadFactor() {
        return (double) insertedItems / slots.length;
    }

    // ~ 2 * BUCKET_SIZE / 2^fingerprintBits, capped at 1.
    public double expectedFalsePositiveRate() {
        return Math.min(1.0, 2.0 * BUCKET_SIZE / (1 << fingerprintBits));
    }

    // Returns false when no room was found within maxKicks relocations. The item is then not stored and the
    // table is left exactly as it was before the call.
    public boolean insert(final Object item) {
        final short fingerprint = fingerprint(item);
        final int indexA = primaryIndex(item);
        final int indexB = alternateIndex(indexA, fingerprint);

        if (insertIntoBucket(indexA, fingerprint) || insertIntoBucket(indexB, fingerprint)) {
            insertedItems++;
            return true;
        }

        // Random walk: swap the homeless fingerprint with a random victim, then try to re-home the victim.
        short homeless = fingerprint;
        int bucket = random.nextBoolean() ? indexB : indexA;
        for (int kick = 0; kick < maxKicks; kick++) {
            final int slot = bucket * BUCKET_SIZE + (int) random.nextIndex(BUCKET_SIZE);
            if (kick == kickPath.length) {
                kickPath = Arrays.copyOf(kickPath, Math.min(maxKicks, Math.max(16, kick * 2)));
            }
            kickPath[kick] = slot;
            final short victim = slots[slot];
            slots[slot] = homeless;
            homeless = victim;

            bucket = alternateIndex(bucket, homeless);
            if (insertIntoBucket(bucket, homeless)) {
                insertedItems++;
                return true;
            }
        }

        // Undo the walk in reverse so every displaced fingerprint is back in its original slot.
        // What falls out at the end is the new fingerprint itself.
        for (int kick = maxKicks - 1; kick >= 0; kick--) {
            final short displaced = slots[kickPath[kick]];
            slots[kickPath[kick]] = homeless;
            homeless = displaced;
        }
        logger.debug("Cuckoo insert failed after {} kicks: bucketCount={}, loadFactor={}", maxKicks, bucketCount, loadFactor());
        return false;
    }

    public boolean contains(final Object item) {
        final short fingerprint = fingerprint(item);
        final int indexA = primaryIndex(item);
        return bucketContains(indexA, fingerprint) || bucketContains(alternateIndex(indexA, fingerprint), fingerprint);
    }

    // Removes one stored instance of the item's fingerprint. Returns false when none matched.
    public boolean delete(final Object item) {
        final short fingerprint = fingerprint(item);
        final int indexA = primaryIndex(item);
        if (removeFromBucket(indexA, fingerprint) || removeFromBucket(alternateIndex(indexA, fingerprint), fingerprint)) {
            insertedItems--;
            return true;
        }
        return false;
    }

    public void clear() {
        Arrays.fill(slots, (short) 0);
        insertedItems = 0;
    }

    public CuckooFilter deepCopy() {
        return new CuckooFilter(this);
    }

    @Override
    public boolean equals(final Object obj) {
        if (!(obj instanceof CuckooFilter)) {
            return false;
        }
        final CuckooFilter other = (CuckooFilter) obj;
        return bucketCount == other.bucketCount
                && fingerprintBits == other.fingerprintBits
                && maxKicks == other.maxKicks
                && insertedItems == other.insertedItems
                && Arrays.equals(slots, other.slots);
    }

    @Override
    public int hashCode() {
        int result = Integer.hashCode(bucketCount);
        result = 31 * result + Integer.hashCode(fingerprintBits);
        result = 31 * result + Integer.hashCode(maxKicks);
        result = 31 * result + Long.hashCode(insertedItems);
        result = 31 * result + Arrays.hashCode(slots);
        return result;
    }

    @Override
    public String toString() {
        return "CuckooFilter{bucketCount=" + bucketCount + ", fingerprintBits=" + fingerprintBits
                + ", maxKicks=" + maxKicks + ", insertedItems=" + insertedItems + "}";
    }

    private boolean insertIntoBucket(final int bucket, final short fingerprint) {
        final int start = bucket * BUCKET_SIZE;
        for (int slot = start; slot < start + BUCKET_SIZE; slot++) {
            if (slots[slot] == 0) {
                slots[slot] = fingerprint;
                return true;
            }
        }
        return false;
    }

    private boolean removeFromBucket(final int bucket, final short fingerprint) {
        final int start = bucket * BUCKET_SIZE;
        for (int slot = start; slot < start + BUCKET_SIZE; slot++) {
            if (slots[slot] == fingerprint) {
                slots[slot] = 0;
                return true;
            }
        }
        return false;
    }

    private boolean bucketContains(final int bucket, final short fingerprint) {
        final int start = bucket * BUCKET_SIZE;
        for (int slot = start; slot < start + BUCKET_SIZE; slot++) {
            if (slots[slot] == fingerprint) {
                return true;
            }
        }
        return false;
    }

    private int primaryIndex(final Object item) {
        return (int) SketchHashing.seededHash(item, INDEX_SEED) & (bucketCount - 1);
    }

    int alternateIndex(final int bucket, final short fingerprint) {
        final long hashedFingerprint = SketchHashing.seededHash(fingerprint & 0xFFFF, ALT_INDEX_SEED);
        return (bucket ^ (int) hashedFingerprint) & (bucketCount - 1);
    }

    // Low "fingerprintBits" bits of the item hash, forced non-zero.
    short fingerprint(final Object item) {
        final long mask = (1L << fingerprintBits) - 1;
        final long fingerprint = SketchHashing.seededHash(item, FINGERPRINT_SEED) & mask;
        return (short) (fingerprint == 0 ? 1 : fingerprint);
    }
}
