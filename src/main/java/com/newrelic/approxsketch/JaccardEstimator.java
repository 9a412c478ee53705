// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the ApproxSketch project.

package com.newrelic.approxsketch;

// Sketches that can estimate the Jaccard index |A ∩ B| / |A ∪ B| against a peer of the same shape.
// Returned value is in [0, 1]: 0 for disjoint sets, 1 for identical sets.
public interface JaccardEstimator<S extends JaccardEstimator<S>> {

    // Throws IncompatibleSketchesException when "other" has a different shape. Does not modify either sketch.
    double jaccardIndex(final S other);
}
