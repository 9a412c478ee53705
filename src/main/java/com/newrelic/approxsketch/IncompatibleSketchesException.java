// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the ApproxSketch project.

package com.newrelic.approxsketch;

// Two sketches with different shapes (dimensions, precision, compression or hash seeds) were combined.
public class IncompatibleSketchesException extends SketchException {
    private static final long serialVersionUID = 1L;

    public IncompatibleSketchesException(final String message) {
        super("incompatible sketches: " + message);
    }

    @Override
    public Kind getKind() {
        return Kind.INCOMPATIBLE_SKETCHES;
    }

    public static void check(final boolean compatible, final String message) {
        if (!compatible) {
            throw new IncompatibleSketchesException(message);
        }
    }
}
