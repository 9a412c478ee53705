// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the ApproxSketch project.

package com.newrelic.approxsketch.membership;

import com.newrelic.approxsketch.InvalidSketchParameterException;
import org.junit.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

public class CuckooFilterTest {
    @Test
    public void testCreate() {
        final CuckooFilter filter = CuckooFilter.create(1000, 0.01);
        assertEquals(512, filter.getBucketCount());
        assertEquals(8, filter.getFingerprintBits());
        assertEquals(CuckooFilter.DEFAULT_MAX_KICKS, filter.getMaxKicks());
        assertTrue(filter.isEmpty());
        assertEquals(0, filter.loadFactor(), 0);
        assertEquals(8.0 / 256, filter.expectedFalsePositiveRate(), 1e-12);

        // Tiny inputs still get two buckets; tiny rates clamp the fingerprint width.
        final CuckooFilter tiny = CuckooFilter.create(1, 1e-9);
        assertEquals(2, tiny.getBucketCount());
        assertEquals(CuckooFilter.MAX_FINGERPRINT_BITS, tiny.getFingerprintBits());
        assertEquals(CuckooFilter.MIN_FINGERPRINT_BITS, CuckooFilter.create(1, 0.9).getFingerprintBits());
    }

    @Test
    public void testInsertAndContains() {
        final CuckooFilter filter = CuckooFilter.create(1000, 0.01);
        double previousLoad = filter.loadFactor();
        for (int i = 0; i < 1000; i++) {
            assertTrue(filter.insert("item-" + i));
            assertTrue(filter.loadFactor() >= previousLoad);
            previousLoad = filter.loadFactor();
        }
        for (int i = 0; i < 1000; i++) {
            assertTrue(filter.contains("item-" + i));
        }
        assertEquals(1000, filter.getInsertedItems());
        assertEquals(1000.0 / (512 * CuckooFilter.BUCKET_SIZE), filter.loadFactor(), 1e-12);
    }

    @Test
    public void testDelete() {
        final CuckooFilter filter = CuckooFilter.create(100, 0.001);
        assertTrue(filter.insert("alpha"));
        assertTrue(filter.contains("alpha"));

        assertTrue(filter.delete("alpha"));
        assertFalse(filter.contains("alpha"));
        assertFalse(filter.delete("alpha"));
        assertTrue(filter.isEmpty());
    }

    @Test
    public void testDuplicateInsertsNeedMatchingDeletes() {
        final CuckooFilter filter = CuckooFilter.create(100, 0.001);
        assertTrue(filter.insert("dup"));
        assertTrue(filter.insert("dup"));
        assertEquals(2, filter.getInsertedItems());

        assertTrue(filter.delete("dup"));
        assertTrue(filter.contains("dup"));
        assertTrue(filter.delete("dup"));
        assertFalse(filter.contains("dup"));
    }

    @Test
    public void testFailedInsertLeavesFilterUnchanged() {
        // 2 buckets x 4 slots. Inserts must start failing once the 8 slots are used.
        final CuckooFilter filter = new CuckooFilter(2, 16, 10);
        final List<String> stored = new ArrayList<>();
        int failures = 0;
        for (int i = 0; i < 50; i++) {
            final CuckooFilter before = filter.deepCopy();
            final String item = "item-" + i;
            if (filter.insert(item)) {
                stored.add(item);
            } else {
                failures++;
                assertEquals(before, filter);
            }
        }

        assertTrue(failures > 0);
        assertTrue(stored.size() <= 8);
        assertEquals(stored.size(), filter.getInsertedItems());
        for (final String item : stored) {
            assertTrue(item, filter.contains(item));
        }
    }

    @Test
    public void testLongWalksFailCleanly() {
        final CuckooFilter filter = new CuckooFilter(2, 16, CuckooFilter.MAX_KICKS_LIMIT);
        int stored = 0;
        for (int i = 0; i < 12; i++) {
            final CuckooFilter before = filter.deepCopy();
            if (filter.insert("walk-" + i)) {
                stored++;
            } else {
                assertEquals(before, filter);
            }
        }
        assertTrue(stored <= 8);
        assertEquals(stored, filter.getInsertedItems());
    }

    @Test
    public void testSlotArrayFitsAtMaxBucketCount() {
        assertTrue((long) CuckooFilter.MAX_BUCKET_COUNT * CuckooFilter.BUCKET_SIZE <= InvalidSketchParameterException.MAX_ARRAY_LENGTH);
    }

    @Test(expected = InvalidSketchParameterException.class)
    public void testBucketCountAboveLimit() {
        new CuckooFilter(CuckooFilter.MAX_BUCKET_COUNT << 1, 8, 500);
    }

    @Test(expected = InvalidSketchParameterException.class)
    public void testTooManyExpectedItems() {
        // Needs more than MAX_BUCKET_COUNT buckets.
        CuckooFilter.create(1_900_000_000L, 0.01);
    }

    @Test(expected = InvalidSketchParameterException.class)
    public void testTooManyKicks() {
        new CuckooFilter(2, 16, CuckooFilter.MAX_KICKS_LIMIT + 1);
    }

    @Test
    public void testAlternateIndexIsInvolution() {
        final CuckooFilter filter = new CuckooFilter(1024, 12, 100);
        for (int i = 0; i < 200; i++) {
            final short fingerprint = filter.fingerprint("key-" + i);
            assertTrue(fingerprint != 0);
            final int bucket = i % 1024;
            final int alternate = filter.alternateIndex(bucket, fingerprint);
            assertTrue(alternate >= 0 && alternate < 1024);
            assertEquals(bucket, filter.alternateIndex(alternate, fingerprint));
        }
    }

    @Test
    public void testFingerprintWidth() {
        final CuckooFilter filter = new CuckooFilter(16, 4, 100);
        for (int i = 0; i < 200; i++) {
            final int fingerprint = filter.fingerprint(i) & 0xFFFF;
            assertTrue(fingerprint >= 1 && fingerprint <= 15);
        }
    }

    @Test
    public void testClearEqualsAndDeepCopy() {
        final CuckooFilter filter = new CuckooFilter(64, 12, 100);
        final CuckooFilter empty = new CuckooFilter(64, 12, 100);
        assertEquals(empty, filter);
        assertEquals(empty.hashCode(), filter.hashCode());

        filter.insert("a");
        final CuckooFilter copy = filter.deepCopy();
        assertEquals(filter, copy);
        copy.insert("b");
        assertNotEquals(filter, copy);
        assertTrue(copy.contains("b"));
        assertEquals(1, filter.getInsertedItems());

        filter.clear();
        assertEquals(empty, filter);
        assertTrue(filter.isEmpty());
    }

    @Test(expected = InvalidSketchParameterException.class)
    public void testBucketCountNotPowerOfTwo() {
        new CuckooFilter(3, 8, 10);
    }

    @Test(expected = InvalidSketchParameterException.class)
    public void testFingerprintBitsTooSmall() {
        new CuckooFilter(4, 0, 10);
    }

    @Test(expected = InvalidSketchParameterException.class)
    public void testFingerprintBitsTooLarge() {
        new CuckooFilter(4, 17, 10);
    }

    @Test(expected = InvalidSketchParameterException.class)
    public void testZeroKicks() {
        new CuckooFilter(4, 8, 0);
    }

    @Test(expected = InvalidSketchParameterException.class)
    public void testBadRate() {
        CuckooFilter.create(100, 0);
    }
}
