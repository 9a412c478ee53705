// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the ApproxSketch project.

package com.newrelic.approxsketch.frequency;

import com.newrelic.approxsketch.IncompatibleSketchesException;
import com.newrelic.approxsketch.InvalidSketchParameterException;
import com.newrelic.approxsketch.frequency.SpaceSaving.HeavyHitter;
import org.junit.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;

import static org.hamcrest.CoreMatchers.is;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;

public class SpaceSavingTest {
    @Test
    public void testExactUnderCapacity() {
        final SpaceSaving<String> sketch = new SpaceSaving<>(10);
        sketch.add("a", 3);
        sketch.insert("b");
        sketch.insert("b");
        sketch.insert("a");

        assertEquals(OptionalLong.of(4), sketch.estimate("a"));
        assertEquals(OptionalLong.of(2), sketch.estimate("b"));
        assertEquals(OptionalLong.of(4), sketch.lowerBound("a"));
        assertEquals(OptionalLong.empty(), sketch.estimate("c"));
        assertFalse(sketch.estimateWithError("c").isPresent());
        assertEquals(new HeavyHitter<>("b", 2, 0), sketch.estimateWithError("b").get());
        assertEquals(2, sketch.getTrackedItems());
        assertEquals(6, sketch.getTotalCount());
    }

    @Test
    public void testEviction() {
        final SpaceSaving<String> sketch = new SpaceSaving<>(2);
        sketch.add("a", 5);
        sketch.add("b", 2);
        sketch.add("c", 1);

        // "b" had the minimum count and was replaced; "c" inherits it as error.
        assertEquals(OptionalLong.empty(), sketch.estimate("b"));
        assertEquals(new HeavyHitter<>("c", 3, 2), sketch.estimateWithError("c").get());
        assertEquals(1, sketch.estimateWithError("c").get().lowerBound());
        assertEquals(2, sketch.getTrackedItems());
    }

    @Test
    public void testHeavyHittersSurviveLongTail() {
        final SpaceSaving<String> sketch = new SpaceSaving<>(20);
        final Map<String, Long> truth = new HashMap<>();
        for (int i = 0; i < 5000; i++) {
            insert(sketch, truth, "tail-" + i);
            if (i % 5 == 0) {
                insert(sketch, truth, "heavy-a");
            }
            if (i % 10 == 0) {
                insert(sketch, truth, "heavy-b");
            }
        }

        final List<HeavyHitter<String>> top = sketch.topK(2);
        assertEquals(2, top.size());
        assertEquals("heavy-a", top.get(0).item);
        assertEquals("heavy-b", top.get(1).item);

        for (final HeavyHitter<String> hitter : sketch.topK(20)) {
            final long trueCount = truth.get(hitter.item);
            assertTrue(hitter.toString(), hitter.count - hitter.error <= trueCount);
            assertTrue(hitter.toString(), trueCount <= hitter.count);
        }
    }

    private static void insert(final SpaceSaving<String> sketch, final Map<String, Long> truth, final String item) {
        sketch.insert(item);
        truth.merge(item, 1L, Long::sum);
    }

    @Test
    public void testTopKOrder() {
        final SpaceSaving<Integer> sketch = new SpaceSaving<>(10);
        for (int i = 1; i <= 5; i++) {
            sketch.add(i, i * 10);
        }
        final List<HeavyHitter<Integer>> top = sketch.topK(10);
        assertThat(top.size(), is(5));
        for (int i = 1; i < top.size(); i++) {
            assertTrue(top.get(i - 1).count >= top.get(i).count);
        }
        assertThat(top.get(0).item, is(5));
        assertTrue(sketch.topK(0).isEmpty());
    }

    @Test
    public void testMerge() {
        final SpaceSaving<String> left = new SpaceSaving<>(10);
        final SpaceSaving<String> right = new SpaceSaving<>(10);
        left.add("x", 3);
        left.add("y", 2);
        right.add("y", 1);
        right.add("z", 4);

        assertSame(left, left.merge(right));
        assertEquals(OptionalLong.of(3), left.estimate("x"));
        assertEquals(OptionalLong.of(3), left.estimate("y"));
        assertEquals(OptionalLong.of(4), left.estimate("z"));
        assertEquals(10, left.getTotalCount());

        // The argument is untouched.
        assertEquals(5, right.getTotalCount());
        assertEquals(OptionalLong.of(1), right.estimate("y"));
    }

    @Test
    public void testMergeWithItself() {
        final SpaceSaving<String> sketch = new SpaceSaving<>(4);
        sketch.add("x", 3);
        sketch.add("y", 1);
        sketch.merge(sketch);
        assertEquals(OptionalLong.of(6), sketch.estimate("x"));
        assertEquals(OptionalLong.of(2), sketch.estimate("y"));
    }

    @Test(expected = IncompatibleSketchesException.class)
    public void testMergeCapacityMismatch() {
        new SpaceSaving<String>(4).merge(new SpaceSaving<>(5));
    }

    @Test
    public void testClearAndDeepCopy() {
        final SpaceSaving<String> sketch = new SpaceSaving<>(4);
        sketch.add("x", 3);
        final SpaceSaving<String> copy = sketch.deepCopy();
        copy.add("x", 1);
        assertEquals(OptionalLong.of(3), sketch.estimate("x"));
        assertEquals(OptionalLong.of(4), copy.estimate("x"));

        sketch.clear();
        assertTrue(sketch.isEmpty());
        assertEquals(0, sketch.getTrackedItems());
        assertEquals(4, sketch.getCapacity());
    }

    @Test
    public void testZeroCountIsIgnored() {
        final SpaceSaving<String> sketch = new SpaceSaving<>(4);
        sketch.add("x", 0);
        assertTrue(sketch.isEmpty());
        assertEquals(0, sketch.getTrackedItems());
    }

    @Test(expected = InvalidSketchParameterException.class)
    public void testNegativeCount() {
        new SpaceSaving<String>(4).add("x", -1);
    }

    @Test(expected = NullPointerException.class)
    public void testNullItem() {
        new SpaceSaving<String>(4).insert(null);
    }

    @Test(expected = InvalidSketchParameterException.class)
    public void testZeroCapacity() {
        new SpaceSaving<String>(0);
    }

    @Test(expected = InvalidSketchParameterException.class)
    public void testNegativeK() {
        new SpaceSaving<String>(4).topK(-1);
    }
}
