// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the ApproxSketch project.

package com.newrelic.approxsketch.quantile;

import com.newrelic.approxsketch.InvalidSketchParameterException;

// Mergeable approximate quantile estimator over a stream of doubles.
public interface QuantileSketch<S extends QuantileSketch<S>> {

    // Add one value. NaN and infinities are ignored.
    void add(final double value);

    // Value at quantile q in [0, 1]. Non-decreasing in q for a fixed sketch state.
    // Throws InvalidSketchParameterException when q is out of range or the sketch is empty.
    double quantile(final double q);

    // Merge "other" into "this". Always returns "this". An implementation should not modify "other".
    // Throws IncompatibleSketchesException when the shapes differ.
    S merge(final S other);

    // Number of values added, including values merged in.
    long getCount();

    boolean isEmpty();

    void clear();

    S deepCopy();

    // Convenience for several quantiles at once. Output matches the order of "qs".
    default double[] quantiles(final double... qs) {
        final double[] output = new double[qs.length];
        for (int i = 0; i < qs.length; i++) {
            output[i] = quantile(qs[i]);
        }
        return output;
    }

    static void checkQuantile(final double q) {
        if (!(q >= 0 && q <= 1)) {
            throw new InvalidSketchParameterException("q must be finite and in [0, 1], got " + q);
        }
    }
}
