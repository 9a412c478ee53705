// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the ApproxSketch project.

package com.newrelic.approxsketch.quantile;

import com.newrelic.approxsketch.InvalidSketchParameterException;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.hamcrest.CoreMatchers.instanceOf;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThat;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

// Behavior shared by every QuantileSketch implementation.
@SuppressWarnings({"rawtypes", "unchecked"})
@RunWith(Parameterized.class)
public class QuantileSketchTest {
    public interface SketchMaker {
        QuantileSketch make();
    }

    @Parameterized.Parameters(name = "sketch {0}")
    public static Collection<Object[]> data() {
        final Collection<Object[]> collection = new ArrayList<>();
        // Tolerances are a fraction of the value range. KLL trades accuracy for its fixed size.
        collection.add(new Object[]{"KllSketch", (SketchMaker) KllSketch::new, 0.10});
        collection.add(new Object[]{"TDigest", (SketchMaker) TDigest::new, 0.02});
        return collection;
    }

    @Parameterized.Parameter()
    public String name;

    @Parameterized.Parameter(1)
    public SketchMaker sketchMaker;

    @Parameterized.Parameter(2)
    public double rankTolerance;

    private QuantileSketch sketchOfRange(final int from, final int to) {
        final QuantileSketch sketch = sketchMaker.make();
        for (int i = from; i < to; i++) {
            sketch.add(i);
        }
        return sketch;
    }

    @Test
    public void testEmpty() {
        final QuantileSketch sketch = sketchMaker.make();
        assertTrue(sketch.isEmpty());
        assertEquals(0, sketch.getCount());
        try {
            sketch.quantile(0.5);
            fail("Expected exception on empty sketch");
        } catch (final InvalidSketchParameterException e) {
            assertTrue(e.getMessage().contains("empty"));
        }
    }

    @Test
    public void testQuantileRange() {
        final QuantileSketch sketch = sketchOfRange(0, 10);
        for (final double q : new double[]{-0.01, 1.01, Double.NaN, Double.POSITIVE_INFINITY}) {
            try {
                sketch.quantile(q);
                fail("Expected exception for q=" + q);
            } catch (final IllegalArgumentException e) {
                assertThat(e, instanceOf(InvalidSketchParameterException.class));
            }
        }
    }

    @Test
    public void testSmallStream() {
        final QuantileSketch sketch = sketchMaker.make();
        for (int i = 1; i <= 5; i++) {
            sketch.add(i);
        }
        assertEquals(5, sketch.getCount());
        assertEquals(1, sketch.quantile(0), 0);
        assertEquals(3, sketch.quantile(0.5), 0);
        assertEquals(5, sketch.quantile(1), 0);
    }

    @Test
    public void testNonFiniteValuesIgnored() {
        final QuantileSketch sketch = sketchMaker.make();
        sketch.add(Double.NaN);
        sketch.add(Double.POSITIVE_INFINITY);
        sketch.add(Double.NEGATIVE_INFINITY);
        assertTrue(sketch.isEmpty());

        sketch.add(42);
        sketch.add(Double.NaN);
        assertEquals(1, sketch.getCount());
        assertEquals(42, sketch.quantile(0.5), 0);
    }

    @Test
    public void testUniformStream() {
        final QuantileSketch sketch = sketchOfRange(0, 20_001);
        assertEquals(20_001, sketch.getCount());
        assertEquals(10_000, sketch.quantile(0.5), 20_000 * rankTolerance);
        assertEquals(2_000, sketch.quantile(0.1), 20_000 * rankTolerance);
        assertEquals(18_000, sketch.quantile(0.9), 20_000 * rankTolerance);
        assertEquals(0, sketch.quantile(0), 20_000 * rankTolerance);
        assertEquals(20_000, sketch.quantile(1), 20_000 * rankTolerance);
    }

    @Test
    public void testShuffledStream() {
        final List<Integer> values = new ArrayList<>();
        for (int i = 0; i < 20_000; i++) {
            values.add(i);
        }
        Collections.shuffle(values, new Random(42));

        final QuantileSketch sketch = sketchMaker.make();
        for (final int value : values) {
            sketch.add(value);
        }
        assertEquals(10_000, sketch.quantile(0.5), 20_000 * rankTolerance);
        assertEquals(5_000, sketch.quantile(0.25), 20_000 * rankTolerance);
        assertEquals(19_800, sketch.quantile(0.99), 20_000 * rankTolerance);
    }

    @Test
    public void testMonotonic() {
        final Random random = new Random(7);
        final QuantileSketch sketch = sketchMaker.make();
        for (int i = 0; i < 50_000; i++) {
            sketch.add(random.nextGaussian() * 100);
        }

        double previous = Double.NEGATIVE_INFINITY;
        for (int i = 0; i <= 200; i++) {
            final double value = sketch.quantile(i / 200.0);
            assertTrue("q=" + i / 200.0 + " value=" + value + " previous=" + previous, value >= previous);
            previous = value;
        }
    }

    @Test
    public void testQuantiles() {
        final QuantileSketch sketch = sketchOfRange(0, 1000);
        final double[] qs = {0.1, 0.5, 0.9};
        final double[] expected = new double[qs.length];
        for (int i = 0; i < qs.length; i++) {
            expected[i] = sketch.quantile(qs[i]);
        }
        assertArrayEquals(expected, sketch.quantiles(qs), 0);
    }

    @Test
    public void testMergeHalves() {
        final QuantileSketch left = sketchOfRange(0, 10_000);
        final QuantileSketch right = sketchOfRange(10_000, 20_000);

        assertSame(left, left.merge(right));
        assertEquals(20_000, left.getCount());
        assertEquals(10_000, left.quantile(0.5), 20_000 * rankTolerance);
        assertEquals(5_000, left.quantile(0.25), 20_000 * rankTolerance);
        assertEquals(15_000, left.quantile(0.75), 20_000 * rankTolerance);

        // The argument is untouched.
        assertEquals(10_000, right.getCount());
        assertEquals(15_000, right.quantile(0.5), 10_000 * rankTolerance);
    }

    @Test
    public void testMergeEmpty() {
        final QuantileSketch sketch = sketchOfRange(0, 100);
        final QuantileSketch copy = sketch.deepCopy();
        sketch.merge(sketchMaker.make());
        assertEquals(copy, sketch);

        final QuantileSketch empty = sketchMaker.make();
        empty.merge(copy);
        assertEquals(100, empty.getCount());
    }

    @Test
    public void testClearEqualsAndDeepCopy() {
        final QuantileSketch sketch = sketchOfRange(0, 1000);
        final QuantileSketch copy = sketch.deepCopy();
        assertEquals(sketch, copy);
        assertEquals(sketch.hashCode(), copy.hashCode());
        assertEquals(sketch.quantile(0.3), copy.quantile(0.3), 0);

        copy.add(5000);
        assertNotEquals(sketch, copy);
        assertEquals(1000, sketch.getCount());

        // Same input, same state.
        assertEquals(sketchOfRange(0, 1000), sketch);

        sketch.clear();
        assertTrue(sketch.isEmpty());
        assertEquals(0, sketch.getCount());
        sketch.add(1);
        assertEquals(1, sketch.quantile(0.5), 0);
    }
}
