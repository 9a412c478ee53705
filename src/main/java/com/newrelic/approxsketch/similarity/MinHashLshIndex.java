// Copyright 2021 New Relic Corporation. All rights reserved.
// SPDX-License-Identifier: Apache-2.0
// This file is part of the ApproxSketch project.

package com.newrelic.approxsketch.similarity;

import com.newrelic.approxsketch.IncompatibleSketchesException;
import com.newrelic.approxsketch.hash.SketchHashing;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import static com.newrelic.approxsketch.InvalidSketchParameterException.check;

// Banded locality sensitive hashing over MinHash signatures.
//
// A signature of numHashes slots is cut into "bands" groups of rowsPerBand slots. Each group is hashed as a whole
// with a per band seed, and the id is filed under that hash in the band's table. Two ids become candidates for
// each other when they collide in at least one band. Recall is high but not exact: a query only finds ids that share
// a band hash with the query.
//
// Tables preserve insertion order, so candidate order and top-k tie order are deterministic for a given sequence
// of inserts and removes.
public class MinHashLshIndex<I> {
    private static final Logger logger = LoggerFactory.getLogger(MinHashLshIndex.class);

    private static final long BAND_SEED_BASE = 0xA0761D6478BD642FL;

    private final int numHashes;
    private final int bands;
    private final int rowsPerBand;
    private final long[] bandSeeds;
    private final List<Map<Long, Set<I>>> tables;
    private final Map<I, MinHash> signatures = new LinkedHashMap<>();

    public MinHashLshIndex(final int numHashes, final int bands) {
        check(numHashes > 0, "numHashes must be greater than zero, got " + numHashes);
        check(bands > 0, "bands must be greater than zero, got " + bands);
        check(numHashes % bands == 0, "numHashes " + numHashes + " must be divisible by bands " + bands);

        this.numHashes = numHashes;
        this.bands = bands;
        this.rowsPerBand = numHashes / bands;
        this.bandSeeds = SketchHashing.deriveSeeds(BAND_SEED_BASE, bands);
        this.tables = new ArrayList<>(bands);
        for (int band = 0; band < bands; band++) {
            tables.add(new LinkedHashMap<>());
        }
    }

    public int getNumHashes() {
        return numHashes;
    }

    public int getBands() {
        return bands;
    }

    public int getRowsPerBand() {
        return rowsPerBand;
    }

    public int size() {
        return signatures.size();
    }

    public boolean isEmpty() {
        return signatures.isEmpty();
    }

    public boolean containsId(final I id) {
        return signatures.containsKey(id);
    }

    // Indexes a copy of "signature" under "id". A previous signature under the same id is replaced.
    public void insert(final I id, final MinHash signature) {
        Objects.requireNonNull(id, "id");
        ensureCompatible(signature);

        if (remove(id)) {
            logger.debug("Replacing LSH signature for id {}", id);
        }

        final MinHash stored = signature.deepCopy();
        for (int band = 0; band < bands; band++) {
            tables.get(band).computeIfAbsent(bandHash(stored, band), key -> new LinkedHashSet<>()).add(id);
        }
        signatures.put(id, stored);
    }

    // Returns true if the id was indexed.
    public boolean remove(final I id) {
        final MinHash stored = signatures.remove(id);
        if (stored == null) {
            return false;
        }

        for (int band = 0; band < bands; band++) {
            final Map<Long, Set<I>> table = tables.get(band);
            final long hash = bandHash(stored, band);
            final Set<I> bucket = table.get(hash);
            if (bucket != null) {
                bucket.remove(id);
                if (bucket.isEmpty()) {
                    table.remove(hash);
                }
            }
        }
        return true;
    }

    // Ids sharing at least one band hash with the query, each listed once.
    @NotNull
    public List<I> queryCandidates(final MinHash query) {
        ensureCompatible(query);

        final Set<I> candidates = new LinkedHashSet<>();
        for (int band = 0; band < bands; band++) {
            final Set<I> bucket = tables.get(band).get(bandHash(query, band));
            if (bucket != null) {
                candidates.addAll(bucket);
            }
        }
        return new ArrayList<>(candidates);
    }

    // Candidates reranked by estimated Jaccard against the query, highest first. Equal scores keep candidate order.
    @NotNull
    public List<SimilarItem<I>> queryTopK(final MinHash query, final int k) {
        ensureCompatible(query);
        check(k >= 0, "k must not be negative, got " + k);
        if (k == 0) {
            return Collections.emptyList();
        }

        final List<SimilarItem<I>> scored = new ArrayList<>();
        for (final I id : queryCandidates(query)) {
            final MinHash stored = signatures.get(id);
            scored.add(new SimilarItem<>(id, stored.estimateJaccard(query)));
        }

        // List.sort is stable.
        scored.sort(Comparator.comparingDouble((SimilarItem<I> item) -> item.similarity).reversed());
        return scored.size() > k ? new ArrayList<>(scored.subList(0, k)) : scored;
    }

    public void clear() {
        signatures.clear();
        for (final Map<Long, Set<I>> table : tables) {
            table.clear();
        }
    }

    private void ensureCompatible(final MinHash signature) {
        IncompatibleSketchesException.check(signature.getNumHashes() == numHashes,
                "signature numHashes " + signature.getNumHashes() + " must match index numHashes " + numHashes);
    }

    private long bandHash(final MinHash signature, final int band) {
        final int from = band * rowsPerBand;
        return SketchHashing.hashLongs(signature.signatureView(), from, from + rowsPerBand, bandSeeds[band]);
    }

    @Override
    public String toString() {
        return "MinHashLshIndex{numHashes=" + numHashes + ", bands=" + bands + ", rowsPerBand=" + rowsPerBand
                + ", size=" + signatures.size() + "}";
    }

    public static class SimilarItem<I> {
        public final I id;
        public final double similarity;

        public SimilarItem(final I id, final double similarity) {
            this.id = id;
            this.similarity = similarity;
        }

        @Override
        public boolean equals(final Object obj) {
            if (this == obj) {
                return true;
            }
            if (!(obj instanceof SimilarItem)) {
                return false;
            }
            final SimilarItem<?> other = (SimilarItem<?>) obj;
            return Double.compare(similarity, other.similarity) == 0 && Objects.equals(id, other.id);
        }

        @Override
        public int hashCode() {
            int result = Objects.hashCode(id);
            result = 31 * result + Double.hashCode(similarity);
            return result;
        }

        @Override
        public String toString() {
            return "{id=" + id + ", similarity=" + similarity + "}";
        }
    }
}
