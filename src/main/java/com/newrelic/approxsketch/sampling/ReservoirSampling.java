// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the ApproxSketch project.

package com.newrelic.approxsketch.sampling;

import com.google.common.math.LongMath;
import com.newrelic.approxsketch.hash.SplitMixRandom;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import org.jetbrains.annotations.NotNull;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.newrelic.approxsketch.InvalidSketchParameterException.checkArrayLength;

// Uniform fixed-size sample of a stream (Algorithm R).
//
// The first "capacity" items are kept in arrival order. For the n-th item after that, an index is drawn uniformly
// from [0, n) and the item replaces that slot only when the index falls inside the reservoir, so every item seen
// so far is retained with probability capacity / n. The random stream is internal and fixed-seeded: the same input
// always yields the same sample.
public class ReservoirSampling<T> {
    private static final long RANDOM_SEED = 0x94D049BB133111EBL;

    private final int capacity;
    private final List<T> samples;
    private final SplitMixRandom random;
    private long seen;

    public ReservoirSampling(final int capacity) {
        this.capacity = checkArrayLength(capacity, "capacity");
        this.samples = new ArrayList<>();
        this.random = new SplitMixRandom(RANDOM_SEED);
    }

    private ReservoirSampling(final ReservoirSampling<T> other) {
        this.capacity = other.capacity;
        this.samples = new ArrayList<>(other.samples);
        this.random = other.random.deepCopy();
        this.seen = other.seen;
    }

    public void add(final T item) {
        seen = LongMath.saturatedAdd(seen, 1);

        if (samples.size() < capacity) {
            samples.add(item);
            return;
        }

        final long slot = random.nextIndex(seen);
        if (slot < capacity) {
            samples.set((int) slot, item);
        }
    }

    public void addAll(final Iterable<? extends T> items) {
        for (final T item : items) {
            add(item);
        }
    }

    // Read-only view, backed by the reservoir.
    @SuppressFBWarnings(value = "EI_EXPOSE_REP")
    @NotNull
    public List<T> getSamples() {
        return Collections.unmodifiableList(samples);
    }

    public long getSeen() {
        return seen;
    }

    public int size() {
        return samples.size();
    }

    public int getCapacity() {
        return capacity;
    }

    public boolean isEmpty() {
        return seen == 0;
    }

    // Drops the sample and the seen count. The random stream continues where it was.
    public void clear() {
        samples.clear();
        seen = 0;
    }

    // Items are shared, the sample list and random state are copied.
    public ReservoirSampling<T> deepCopy() {
        return new ReservoirSampling<>(this);
    }

    @Override
    public String toString() {
        return "ReservoirSampling{capacity=" + capacity + ", seen=" + seen + ", samples=" + samples + "}";
    }
}
