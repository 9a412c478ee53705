// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the ApproxSketch project.

package com.newrelic.approxsketch;

// A constructor or query received an out-of-domain value: zero or negative sizes, a rate outside (0, 1),
// a quantile outside [0, 1], a quantile on an empty sketch, or dimensions too large to address.
public class InvalidSketchParameterException extends SketchException {
    private static final long serialVersionUID = 1L;

    // Some VMs reserve header words in arrays, so lengths close to Integer.MAX_VALUE cannot be allocated.
    public static final int MAX_ARRAY_LENGTH = Integer.MAX_VALUE - 8;

    public InvalidSketchParameterException(final String message) {
        super("invalid parameter: " + message);
    }

    @Override
    public Kind getKind() {
        return Kind.INVALID_PARAMETER;
    }

    public static void check(final boolean condition, final String message) {
        if (!condition) {
            throw new InvalidSketchParameterException(message);
        }
    }

    // Rates, probabilities and error budgets must be finite and strictly inside (0, 1).
    public static double checkOpenUnitInterval(final double value, final String name) {
        check(Double.isFinite(value) && value > 0 && value < 1, name + " must be finite and strictly between 0 and 1, got " + value);
        return value;
    }

    public static int checkPositive(final long value, final String name) {
        check(value > 0, name + " must be greater than zero, got " + value);
        check(value <= Integer.MAX_VALUE, name + " is too large, got " + value);
        return (int) value;
    }

    // Length of a backing array, in (0, MAX_ARRAY_LENGTH].
    public static int checkArrayLength(final long length, final String name) {
        check(length > 0, name + " must be greater than zero, got " + length);
        check(length <= MAX_ARRAY_LENGTH, name + " is too large to address, got " + length);
        return (int) length;
    }

    // Length of a width x depth table.
    public static int checkedTableLength(final int width, final int depth) {
        return checkArrayLength((long) width * depth, "width * depth (" + width + " * " + depth + ")");
    }
}
