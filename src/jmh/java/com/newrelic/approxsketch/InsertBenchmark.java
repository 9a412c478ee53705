// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the ApproxSketch project.

package com.newrelic.approxsketch;

import com.newrelic.approxsketch.cardinality.HyperLogLog;
import com.newrelic.approxsketch.frequency.CountSketch;
import com.newrelic.approxsketch.frequency.MinMaxSketch;
import com.newrelic.approxsketch.frequency.SpaceSaving;
import com.newrelic.approxsketch.membership.BloomFilter;
import com.newrelic.approxsketch.membership.CuckooFilter;
import com.newrelic.approxsketch.quantile.KllSketch;
import com.newrelic.approxsketch.quantile.TDigest;
import com.newrelic.approxsketch.sampling.ReservoirSampling;
import com.newrelic.approxsketch.similarity.MinHash;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;

import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

@State(Scope.Benchmark)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@BenchmarkMode(Mode.AverageTime)

public class InsertBenchmark {
    @Param("1000000")
    int valueArrayLength;

    long[] values;
    int valueIndex;

    public enum DataType {
        UNIFORM,  // Every value about equally likely
        SKEWED    // A few values dominate
    }

    @Param({"UNIFORM"})
    DataType dataType;

    public enum SketchType {
        BLOOM,
        CUCKOO,
        HLL,
        COUNT_SKETCH,
        MIN_MAX,
        SPACE_SAVING,
        KLL,
        TDIGEST,
        MINHASH,
        RESERVOIR
    }

    @Param({"BLOOM", "CUCKOO", "HLL", "COUNT_SKETCH", "MIN_MAX", "SPACE_SAVING", "KLL", "TDIGEST", "MINHASH", "RESERVOIR"})
    SketchType _sketchType; // Starts with "_" to make it the 1st param in alphabetic param name sort order.

    public interface Inserter {
        void insert(final long value);
    }

    Inserter inserter;
    Object sketch;

    @Setup
    public void setup() {
        switch (_sketchType) {
            case BLOOM: {
                final BloomFilter bloom = BloomFilter.create(valueArrayLength, 0.01);
                inserter = bloom::insert;
                sketch = bloom;
                break;
            }
            case CUCKOO: {
                final CuckooFilter cuckoo = CuckooFilter.create(valueArrayLength, 0.01);
                // Delete after insert keeps the load factor stable over a long run.
                inserter = value -> {
                    if (cuckoo.insert(value)) {
                        cuckoo.delete(value);
                    }
                };
                sketch = cuckoo;
                break;
            }
            case HLL: {
                final HyperLogLog hll = new HyperLogLog();
                inserter = hll::add;
                sketch = hll;
                break;
            }
            case COUNT_SKETCH: {
                final CountSketch countSketch = CountSketch.create(0.01, 0.01);
                inserter = countSketch::increment;
                sketch = countSketch;
                break;
            }
            case MIN_MAX: {
                final MinMaxSketch minMax = MinMaxSketch.create(0.001, 0.01);
                inserter = minMax::increment;
                sketch = minMax;
                break;
            }
            case SPACE_SAVING: {
                final SpaceSaving<Long> spaceSaving = new SpaceSaving<>(100);
                inserter = spaceSaving::insert;
                sketch = spaceSaving;
                break;
            }
            case KLL: {
                final KllSketch kll = new KllSketch();
                inserter = kll::add;
                sketch = kll;
                break;
            }
            case TDIGEST: {
                final TDigest digest = new TDigest();
                inserter = digest::add;
                sketch = digest;
                break;
            }
            case MINHASH: {
                final MinHash minHash = new MinHash();
                inserter = minHash::add;
                sketch = minHash;
                break;
            }
            case RESERVOIR: {
                final ReservoirSampling<Long> reservoir = new ReservoirSampling<>(1000);
                inserter = reservoir::add;
                sketch = reservoir;
                break;
            }
        }

        values = new long[valueArrayLength];
        for (int i = 0; i < values.length; i++) {
            switch (dataType) {
                case SKEWED:
                    // Squaring a uniform draw piles values up near zero.
                    final double draw = ThreadLocalRandom.current().nextDouble();
                    values[i] = (long) (draw * draw * values.length);
                    break;
                case UNIFORM:
                default:
                    values[i] = ThreadLocalRandom.current().nextInt(values.length);
            }
        }
    }

    @Benchmark
    public Object insert() {
        inserter.insert(values[valueIndex]);
        if (++valueIndex >= values.length) {
            valueIndex = 0;
        }
        return sketch;
    }

    // Single thread run outside of JMH. Sketches are not thread safe.
    public static void main(final String[] args) {
        final InsertBenchmark benchmark = new InsertBenchmark();

        benchmark.valueArrayLength = 1000_000;
        benchmark.dataType = DataType.UNIFORM;
        benchmark._sketchType = SketchType.HLL;

        long inserts = 10_000_000;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "-data":
                    benchmark.dataType = DataType.valueOf(args[++i]);
                    break;
                case "-sketch":
                    benchmark._sketchType = SketchType.valueOf(args[++i]);
                    break;
                case "-inserts":
                    inserts = Long.parseLong(args[++i]);
                    break;
                default:
                    throw new IllegalArgumentException("Unknown option " + args[i]);
            }
        }

        benchmark.setup();

        final long startTime = System.nanoTime();
        for (long n = 0; n < inserts; n++) {
            benchmark.insert();
        }
        final long elapsedTime = System.nanoTime() - startTime;

        System.out.println("sketch=" + benchmark.sketch);
        System.out.println("elapsedMs=" + elapsedTime / 1000_000 + "  nsPerInsert=" + (double) elapsedTime / inserts);
    }
}
