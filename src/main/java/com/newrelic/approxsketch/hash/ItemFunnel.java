// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the ApproxSketch project.

package com.newrelic.approxsketch.hash;

import com.google.common.hash.Funnel;
import com.google.common.hash.PrimitiveSink;

import java.nio.charset.StandardCharsets;

// Turns a stream item into hash input bytes. Common value types are funneled by content, so equal values
// hash identically regardless of instance. Everything else falls back to hashCode(), which callers must keep
// stable for the lifetime of a sketch.
//
// Integral numbers are funneled as long, so Integer 5 and Long 5 are the same item.
public enum ItemFunnel implements Funnel<Object> {
    INSTANCE;

    private static final byte TYPE_STRING = 1;
    private static final byte TYPE_INTEGRAL = 2;
    private static final byte TYPE_FLOATING = 3;
    private static final byte TYPE_BOOLEAN = 4;
    private static final byte TYPE_CHAR = 5;
    private static final byte TYPE_BYTES = 6;
    private static final byte TYPE_LONGS = 7;
    private static final byte TYPE_INTS = 8;
    private static final byte TYPE_OBJECT = 9;

    @Override
    public void funnel(final Object from, final PrimitiveSink into) {
        if (from instanceof CharSequence) {
            into.putByte(TYPE_STRING).putString((CharSequence) from, StandardCharsets.UTF_8);
        } else if (from instanceof Long || from instanceof Integer || from instanceof Short || from instanceof Byte) {
            funnelIntegral(((Number) from).longValue(), into);
        } else if (from instanceof Double || from instanceof Float) {
            into.putByte(TYPE_FLOATING).putDouble(((Number) from).doubleValue());
        } else if (from instanceof Boolean) {
            into.putByte(TYPE_BOOLEAN).putBoolean((Boolean) from);
        } else if (from instanceof Character) {
            into.putByte(TYPE_CHAR).putChar((Character) from);
        } else if (from instanceof byte[]) {
            into.putByte(TYPE_BYTES).putBytes((byte[]) from);
        } else if (from instanceof long[]) {
            into.putByte(TYPE_LONGS);
            for (final long value : (long[]) from) {
                into.putLong(value);
            }
        } else if (from instanceof int[]) {
            into.putByte(TYPE_INTS);
            for (final int value : (int[]) from) {
                into.putInt(value);
            }
        } else {
            into.putByte(TYPE_OBJECT).putInt(from.hashCode());
        }
    }

    // Shared with the primitive long path of SketchHashing, so boxed and unboxed values agree.
    static void funnelIntegral(final long value, final PrimitiveSink into) {
        into.putByte(TYPE_INTEGRAL).putLong(value);
    }

    @Override
    public String toString() {
        return "ItemFunnel.INSTANCE";
    }
}
