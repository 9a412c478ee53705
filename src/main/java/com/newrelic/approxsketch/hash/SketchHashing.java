// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the ApproxSketch project.

package com.newrelic.approxsketch.hash;

import com.google.common.hash.HashFunction;
import com.google.common.hash.Hasher;
import com.google.common.hash.Hashing;

import java.util.Objects;

// Seeded 64-bit item hashing and the SplitMix64 mixer used to derive per-row and per-band seeds.
// Hashes are deterministic and well distributed, but not meant to resist adversarial input.
public final class SketchHashing {
    // SplitMix64 increment (golden ratio).
    public static final long GOLDEN_GAMMA = 0x9E3779B97F4A7C15L;

    private SketchHashing() {
    }

    // SplitMix64 finalizer. Bijective on 64-bit values.
    public static long mix(final long seed) {
        long x = seed + GOLDEN_GAMMA;
        x = (x ^ (x >>> 30)) * 0xBF58476D1CE4E5B9L;
        x = (x ^ (x >>> 27)) * 0x94D049BB133111EBL;
        return x ^ (x >>> 31);
    }

    // Seed for row (or band, or signature slot) "index" of a hash family identified by "base".
    public static long deriveSeed(final long base, final int index) {
        return mix(base + index);
    }

    public static long[] deriveSeeds(final long base, final int count) {
        final long[] seeds = new long[count];
        for (int i = 0; i < count; i++) {
            seeds[i] = deriveSeed(base, i);
        }
        return seeds;
    }

    public static long seededHash(final Object item, final long seed) {
        Objects.requireNonNull(item, "item");
        return hashFunction(seed).hashObject(item, ItemFunnel.INSTANCE).asLong();
    }

    // Same result as seededHash(Long.valueOf(item), seed), without boxing.
    public static long seededHash(final long item, final long seed) {
        final Hasher hasher = hashFunction(seed).newHasher(1 + Long.BYTES);
        ItemFunnel.funnelIntegral(item, hasher);
        return hasher.hash().asLong();
    }

    // Hashes values[from, to) as one unit.
    public static long hashLongs(final long[] values, final int from, final int to, final long seed) {
        final Hasher hasher = hashFunction(seed).newHasher((to - from) * Long.BYTES);
        for (int i = from; i < to; i++) {
            hasher.putLong(values[i]);
        }
        return hasher.hash().asLong();
    }

    // murmur3 takes a 32-bit seed. Fold the high half in so both halves of the seed matter.
    private static HashFunction hashFunction(final long seed) {
        return Hashing.murmur3_128((int) (seed ^ (seed >>> 32)));
    }
}
