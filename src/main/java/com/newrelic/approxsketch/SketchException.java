// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the ApproxSketch project.

package com.newrelic.approxsketch;

// Base of the two error kinds raised by sketch operations. Both are raised synchronously by the operation
// that detects the problem, and both are caller errors, hence IllegalArgumentException.
public abstract class SketchException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    public enum Kind {
        INVALID_PARAMETER,
        INCOMPATIBLE_SKETCHES
    }

    protected SketchException(final String message) {
        super(message);
    }

    public abstract Kind getKind();
}
