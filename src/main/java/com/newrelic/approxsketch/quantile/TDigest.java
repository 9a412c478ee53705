// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the ApproxSketch project.

package com.newrelic.approxsketch.quantile;

import com.newrelic.approxsketch.IncompatibleSketchesException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static com.newrelic.approxsketch.InvalidSketchParameterException.check;
import static com.newrelic.approxsketch.InvalidSketchParameterException.checkOpenUnitInterval;

// Quantile sketch built from weighted centroids, accurate in the tails of the distribution.
//
// Centroids are kept sorted by mean. A new value joins its nearest centroid when the combined weight stays
// under max(4 * totalWeight / compression * q * (1 - q), 1), where q is the centroid's quantile. The cap is
// tight near the median and loose at the tails, so extreme quantiles are summarized by small centroids.
// Otherwise the value starts a new singleton centroid.
public class TDigest implements QuantileSketch<TDigest> {
    private static final Logger logger = LoggerFactory.getLogger(TDigest.class);

    public static final double MIN_COMPRESSION = 10;
    public static final double DEFAULT_COMPRESSION = 100;

    // compress() runs when the centroid count exceeds compression * this factor.
    private static final double CENTROID_LIMIT_FACTOR = 8;

    private final double compression;
    private List<Centroid> centroids;
    private double totalWeight;

    public TDigest() {
        this(DEFAULT_COMPRESSION);
    }

    // Higher compression keeps more centroids. Must be finite and at least MIN_COMPRESSION.
    public TDigest(final double compression) {
        check(Double.isFinite(compression) && compression >= MIN_COMPRESSION,
                "compression must be finite and at least " + MIN_COMPRESSION + ", got " + compression);
        this.compression = compression;
        this.centroids = new ArrayList<>();
    }

    private TDigest(final TDigest other) {
        this.compression = other.compression;
        this.centroids = new ArrayList<>(other.centroids.size());
        for (final Centroid centroid : other.centroids) {
            this.centroids.add(new Centroid(centroid.mean, centroid.weight));
        }
        this.totalWeight = other.totalWeight;
    }

    // compression = ceil(10 / quantileError), at least MIN_COMPRESSION.
    public static TDigest withErrorRate(final double quantileError) {
        checkOpenUnitInterval(quantileError, "quantileError");
        return new TDigest(Math.max(MIN_COMPRESSION, Math.ceil(10 / quantileError)));
    }

    public double getCompression() {
        return compression;
    }

    public int getCentroidCount() {
        return centroids.size();
    }

    // Total weight added, rounded.
    @Override
    public long getCount() {
        return Math.round(totalWeight);
    }

    @Override
    public boolean isEmpty() {
        return totalWeight == 0;
    }

    @Override
    public void add(final double value) {
        addWeighted(value, 1);
    }

    // Non-finite values and non-positive or non-finite weights are ignored.
    public void addWeighted(final double value, final double weight) {
        if (!Double.isFinite(value) || !Double.isFinite(weight) || weight <= 0) {
            return;
        }

        if (centroids.isEmpty()) {
            centroids.add(new Centroid(value, weight));
            totalWeight += weight;
            return;
        }

        final int insertionPoint = lowerBound(value);
        final int nearest = nearestCentroid(insertionPoint, value);
        final Centroid centroid = centroids.get(nearest);

        if (centroid.weight + weight <= maxCentroidWeight(centroidQuantile(nearest))) {
            // The mean moves toward "value", which has no other centroid in between, so order is preserved.
            centroid.absorb(value, weight);
        } else {
            centroids.add(insertionPoint, new Centroid(value, weight));
        }

        totalWeight += weight;
        if (centroids.size() > compression * CENTROID_LIMIT_FACTOR) {
            compress();
        }
    }

    // Linear interpolation between the centers of the two centroids straddling q * totalWeight.
    // q = 0 and q = 1 return the first and last centroid means.
    @Override
    public double quantile(final double q) {
        QuantileSketch.checkQuantile(q);
        check(!centroids.isEmpty(), "quantile is undefined for an empty digest");

        if (q <= 0) {
            return centroids.get(0).mean;
        }
        final Centroid last = centroids.get(centroids.size() - 1);
        if (q >= 1) {
            return last.mean;
        }

        final double target = q * totalWeight;
        double cumulative = 0;
        for (int i = 0; i < centroids.size(); i++) {
            final Centroid current = centroids.get(i);
            final double nextCumulative = cumulative + current.weight;
            if (target <= nextCumulative) {
                if (i == 0) {
                    return current.mean;
                }
                final Centroid previous = centroids.get(i - 1);
                final double leftRank = cumulative - previous.weight * 0.5;
                final double rightRank = cumulative + current.weight * 0.5;
                if (rightRank <= leftRank + Math.ulp(1.0)) {
                    return current.mean;
                }
                final double t = Math.min(1, Math.max(0, (target - leftRank) / (rightRank - leftRank)));
                return previous.mean + t * (current.mean - previous.mean);
            }
            cumulative = nextCumulative;
        }
        return last.mean;
    }

    // Re-adds every centroid of "other" with its weight, then compresses. Compressions must match.
    @Override
    public TDigest merge(final TDigest other) {
        IncompatibleSketchesException.check(Math.abs(compression - other.compression) <= Math.ulp(1.0),
                "compression must match for merge: " + compression + " vs " + other.compression);

        final List<Centroid> incoming = new ArrayList<>(other.centroids.size());
        for (final Centroid centroid : other.centroids) {
            incoming.add(new Centroid(centroid.mean, centroid.weight));
        }
        for (final Centroid centroid : incoming) {
            addWeighted(centroid.mean, centroid.weight);
        }
        compress();
        return this;
    }

    // Greedily merges adjacent centroids while the merged weight stays under the quantile dependent cap.
    public void compress() {
        if (centroids.size() <= 1) {
            return;
        }
        final int before = centroids.size();

        final List<Centroid> merged = new ArrayList<>(before);
        double cumulative = 0;
        for (final Centroid centroid : centroids) {
            if (!merged.isEmpty()) {
                final Centroid last = merged.get(merged.size() - 1);
                final double q = clampUnit((cumulative + 0.5 * last.weight) / Math.max(totalWeight, 1));
                if (last.weight + centroid.weight <= maxCentroidWeight(q)) {
                    last.absorb(centroid.mean, centroid.weight);
                    continue;
                }
                cumulative += last.weight;
            }
            merged.add(centroid);
        }
        centroids = merged;

        if (logger.isTraceEnabled()) {
            logger.trace("Compressed t-digest from {} to {} centroids, totalWeight={}", before, merged.size(), totalWeight);
        }
    }

    @Override
    public void clear() {
        centroids.clear();
        totalWeight = 0;
    }

    @Override
    public TDigest deepCopy() {
        return new TDigest(this);
    }

    @Override
    public boolean equals(final Object obj) {
        if (!(obj instanceof TDigest)) {
            return false;
        }
        final TDigest other = (TDigest) obj;
        return Double.compare(compression, other.compression) == 0
                && Double.compare(totalWeight, other.totalWeight) == 0
                && centroids.equals(other.centroids);
    }

    @Override
    public int hashCode() {
        int result = Double.hashCode(compression);
        result = 31 * result + Double.hashCode(totalWeight);
        result = 31 * result + centroids.hashCode();
        return result;
    }

    @Override
    public String toString() {
        return "TDigest{compression=" + compression + ", centroids=" + centroids.size() + ", totalWeight=" + totalWeight + "}";
    }

    // max(4 * totalWeight / compression * q * (1 - q), 1)
    private double maxCentroidWeight(final double q) {
        return Math.max(4 * totalWeight / compression * q * (1 - q), 1);
    }

    private double centroidQuantile(final int index) {
        double before = 0;
        for (int i = 0; i < index; i++) {
            before += centroids.get(i).weight;
        }
        final double centered = before + centroids.get(index).weight * 0.5;
        return clampUnit(centered / Math.max(totalWeight, 1));
    }

    // Index of the first centroid with mean >= value, or size() when there is none.
    private int lowerBound(final double value) {
        int low = 0;
        int high = centroids.size();
        while (low < high) {
            final int mid = (low + high) >>> 1;
            if (centroids.get(mid).mean < value) {
                low = mid + 1;
            } else {
                high = mid;
            }
        }
        return low;
    }

    // On equal distance the lower index wins.
    private int nearestCentroid(final int insertionPoint, final double value) {
        if (insertionPoint == 0) {
            return 0;
        }
        if (insertionPoint == centroids.size()) {
            return insertionPoint - 1;
        }
        final double below = value - centroids.get(insertionPoint - 1).mean;
        final double above = centroids.get(insertionPoint).mean - value;
        return below <= above ? insertionPoint - 1 : insertionPoint;
    }

    private static double clampUnit(final double value) {
        return Math.min(1, Math.max(0, value));
    }

    private static final class Centroid {
        double mean;
        double weight;

        Centroid(final double mean, final double weight) {
            this.mean = mean;
            this.weight = weight;
        }

        // Weighted running mean.
        void absorb(final double value, final double addedWeight) {
            final double updatedWeight = weight + addedWeight;
            mean += (value - mean) * (addedWeight / updatedWeight);
            weight = updatedWeight;
        }

        @Override
        public boolean equals(final Object obj) {
            if (!(obj instanceof Centroid)) {
                return false;
            }
            final Centroid other = (Centroid) obj;
            return Double.compare(mean, other.mean) == 0 && Double.compare(weight, other.weight) == 0;
        }

        @Override
        public int hashCode() {
            return 31 * Double.hashCode(mean) + Double.hashCode(weight);
        }
    }
}
