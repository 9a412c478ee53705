// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the ApproxSketch project.

package com.newrelic.approxsketch.frequency;

import com.google.common.math.LongMath;
import com.newrelic.approxsketch.IncompatibleSketchesException;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

import static com.newrelic.approxsketch.InvalidSketchParameterException.check;
import static com.newrelic.approxsketch.InvalidSketchParameterException.checkPositive;

// Heavy hitters with at most "capacity" tracked counters.
//
// When a new item arrives and all counters are taken, the entry with the smallest count is evicted and the
// new item inherits its count: count = evicted.count + n, error = evicted.count. For any tracked item
// count - error <= trueCount <= count.
public class SpaceSaving<T> {
    private static final Logger logger = LoggerFactory.getLogger(SpaceSaving.class);

    private final int capacity;
    private final Map<T, Counter> counters;
    private long totalCount;

    public SpaceSaving(final int capacity) {
        this.capacity = checkPositive(capacity, "capacity");
        this.counters = new HashMap<>();
    }

    private SpaceSaving(final SpaceSaving<T> other) {
        this.capacity = other.capacity;
        this.counters = new HashMap<>();
        other.counters.forEach((item, counter) -> counters.put(item, new Counter(counter.count, counter.error)));
        this.totalCount = other.totalCount;
    }

    public int getCapacity() {
        return capacity;
    }

    public int getTrackedItems() {
        return counters.size();
    }

    // Total inserted weight. Saturates at Long.MAX_VALUE.
    public long getTotalCount() {
        return totalCount;
    }

    public boolean isEmpty() {
        return totalCount == 0;
    }

    public void insert(final T item) {
        add(item, 1);
    }

    // n must be non-negative.
    public void add(final T item, final long n) {
        Objects.requireNonNull(item, "item");
        check(n >= 0, "count must not be negative, got " + n);
        if (n == 0) {
            return;
        }
        totalCount = LongMath.saturatedAdd(totalCount, n);

        final Counter tracked = counters.get(item);
        if (tracked != null) {
            tracked.count = LongMath.saturatedAdd(tracked.count, n);
            return;
        }

        if (counters.size() < capacity) {
            counters.put(item, new Counter(n, 0));
            return;
        }

        Map.Entry<T, Counter> min = null;
        for (final Map.Entry<T, Counter> entry : counters.entrySet()) {
            if (min == null || entry.getValue().count < min.getValue().count) {
                min = entry;
            }
        }
        final long evictedCount = min.getValue().count;
        counters.remove(min.getKey());
        counters.put(item, new Counter(LongMath.saturatedAdd(evictedCount, n), evictedCount));
    }

    // Estimated count, empty when the item is not tracked.
    public OptionalLong estimate(final T item) {
        final Counter counter = counters.get(item);
        return counter == null ? OptionalLong.empty() : OptionalLong.of(counter.count);
    }

    public Optional<HeavyHitter<T>> estimateWithError(final T item) {
        final Counter counter = counters.get(item);
        return counter == null ? Optional.empty() : Optional.of(new HeavyHitter<>(item, counter.count, counter.error));
    }

    // count - error, a guaranteed lower bound of the true count. Empty when the item is not tracked.
    public OptionalLong lowerBound(final T item) {
        final Counter counter = counters.get(item);
        return counter == null ? OptionalLong.empty() : OptionalLong.of(counter.count - counter.error);
    }

    // Up to k tracked items by descending count.
    @NotNull
    public List<HeavyHitter<T>> topK(final int k) {
        check(k >= 0, "k must not be negative, got " + k);
        if (k == 0) {
            return Collections.emptyList();
        }
        final List<HeavyHitter<T>> entries = new ArrayList<>(counters.size());
        counters.forEach((item, counter) -> entries.add(new HeavyHitter<>(item, counter.count, counter.error)));
        entries.sort(Comparator.comparingLong((HeavyHitter<T> hitter) -> hitter.count).reversed());
        return entries.size() > k ? new ArrayList<>(entries.subList(0, k)) : entries;
    }

    // Replays the other sketch's tracked counts through add(). Order dependent, so not commutative.
    // Always returns "this".
    public SpaceSaving<T> merge(final SpaceSaving<T> other) {
        IncompatibleSketchesException.check(capacity == other.capacity,
                "capacity must match for merge: " + capacity + " vs " + other.capacity);
        logger.debug("Merging {} tracked items into space saving sketch of capacity {}", other.counters.size(), capacity);
        // Snapshot first, "other" may be "this".
        final List<HeavyHitter<T>> replay = new ArrayList<>(other.counters.size());
        other.counters.forEach((item, counter) -> replay.add(new HeavyHitter<>(item, counter.count, counter.error)));
        for (final HeavyHitter<T> hitter : replay) {
            add(hitter.item, hitter.count);
        }
        return this;
    }

    public void clear() {
        counters.clear();
        totalCount = 0;
    }

    public SpaceSaving<T> deepCopy() {
        return new SpaceSaving<>(this);
    }

    @Override
    public String toString() {
        return "SpaceSaving{capacity=" + capacity + ", trackedItems=" + counters.size() + ", totalCount=" + totalCount + "}";
    }

    private static final class Counter {
        long count;
        long error;

        Counter(final long count, final long error) {
            this.count = count;
            this.error = error;
        }
    }

    // A tracked item with its estimated count and the max overestimation of that count.
    public static class HeavyHitter<T> {
        public final T item;
        public final long count;
        public final long error;

        public HeavyHitter(final T item, final long count, final long error) {
            this.item = item;
            this.count = count;
            this.error = error;
        }

        public long lowerBound() {
            return count - error;
        }

        @Override
        public boolean equals(final Object obj) {
            if (!(obj instanceof HeavyHitter)) {
                return false;
            }
            final HeavyHitter<?> other = (HeavyHitter<?>) obj;
            return count == other.count && error == other.error && Objects.equals(item, other.item);
        }

        @Override
        public int hashCode() {
            int result = Objects.hashCode(item);
            result = 31 * result + Long.hashCode(count);
            result = 31 * result + Long.hashCode(error);
            return result;
        }

        @Override
        public String toString() {
            return "{item=" + item + ", count=" + count + ", error=" + error + "}";
        }
    }
}
