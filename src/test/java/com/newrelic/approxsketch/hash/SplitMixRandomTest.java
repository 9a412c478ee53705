// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the ApproxSketch project.

package com.newrelic.approxsketch.hash;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

public class SplitMixRandomTest {
    @Test
    public void testDeterministic() {
        final SplitMixRandom r1 = new SplitMixRandom(7);
        final SplitMixRandom r2 = new SplitMixRandom(7);
        for (int i = 0; i < 100; i++) {
            assertEquals(r1.nextLong(), r2.nextLong());
        }
        assertEquals(r1, r2);
        assertEquals(r1.hashCode(), r2.hashCode());
    }

    @Test
    public void testStateAdvance() {
        final SplitMixRandom random = new SplitMixRandom(7);
        final long first = random.nextLong();
        assertEquals(SketchHashing.mix(7 + SketchHashing.GOLDEN_GAMMA), first);
        assertEquals(SketchHashing.mix(first + SketchHashing.GOLDEN_GAMMA), random.nextLong());
    }

    @Test
    public void testDeepCopy() {
        final SplitMixRandom random = new SplitMixRandom(3);
        random.nextLong();

        final SplitMixRandom copy = random.deepCopy();
        assertEquals(random, copy);
        assertEquals(random.nextLong(), copy.nextLong());

        copy.nextLong();
        assertNotEquals(random, copy);
    }

    @Test
    public void testNextIndex() {
        final SplitMixRandom random = new SplitMixRandom(11);
        final int[] histogram = new int[4];
        for (int i = 0; i < 4000; i++) {
            final long index = random.nextIndex(4);
            assertTrue(index >= 0 && index < 4);
            histogram[(int) index]++;
        }
        for (final int count : histogram) {
            assertTrue("count=" + count, count > 800 && count < 1200);
        }
        assertEquals(0, random.nextIndex(1));
    }

    @Test
    public void testNextBoolean() {
        final SplitMixRandom random = new SplitMixRandom(5);
        int heads = 0;
        for (int i = 0; i < 2000; i++) {
            if (random.nextBoolean()) {
                heads++;
            }
        }
        assertTrue("heads=" + heads, heads > 850 && heads < 1150);
    }
}
