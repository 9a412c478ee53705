// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the ApproxSketch project.

package com.newrelic.approxsketch.hash;

// Small deterministic random stream owned by a single sketch. Same seed, same sequence, so sketches stay
// independent, copyable values and tests reproduce. Not thread safe, not unpredictable.
public final class SplitMixRandom {
    private long state;

    public SplitMixRandom(final long seed) {
        this.state = seed;
    }

    public long nextLong() {
        state = SketchHashing.mix(state + SketchHashing.GOLDEN_GAMMA);
        return state;
    }

    public boolean nextBoolean() {
        return (nextLong() & 1) != 0;
    }

    // Uniform-ish index in [0, bound). bound must be positive. Modulo bias is negligible for sketch-sized bounds.
    public long nextIndex(final long bound) {
        return Long.remainderUnsigned(nextLong(), bound);
    }

    public SplitMixRandom deepCopy() {
        return new SplitMixRandom(state);
    }

    @Override
    public boolean equals(final Object obj) {
        return obj instanceof SplitMixRandom && state == ((SplitMixRandom) obj).state;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(state);
    }

    @Override
    public String toString() {
        return "SplitMixRandom{state=" + state + "}";
    }
}
