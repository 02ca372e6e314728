package com.recommender.index;

import com.recommender.core.FeatureVector;
import com.recommender.core.Vocabulary;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One immutable index generation: a vector per record, all built from the same
 * vocabulary and idf table. Replaced wholesale on rebuild.
 */
public final class SimilarityIndex {

    private final Vocabulary vocabulary;
    private final Map<Integer, FeatureVector> vectors;
    private final Instant builtAt;

    SimilarityIndex(Vocabulary vocabulary, LinkedHashMap<Integer, FeatureVector> vectors, Instant builtAt) {
        this.vocabulary = vocabulary;
        this.vectors = Collections.unmodifiableMap(vectors);
        this.builtAt = builtAt;
    }

    public static SimilarityIndex empty() {
        return new SimilarityIndex(Vocabulary.EMPTY, new LinkedHashMap<>(), Instant.now());
    }

    public FeatureVector vectorOf(int recordId) {
        FeatureVector v = vectors.get(recordId);
        if (v == null) throw new RecordNotFoundException(recordId);
        return v;
    }

    /** Record ids in corpus order. */
    public List<Integer> recordIds() {
        return List.copyOf(vectors.keySet());
    }

    /** Read-only view in corpus order. */
    public Map<Integer, FeatureVector> vectors() {
        return vectors;
    }

    public Vocabulary vocabulary() {
        return vocabulary;
    }

    public int size() {
        return vectors.size();
    }

    public boolean isEmpty() {
        return vectors.isEmpty();
    }

    public Instant builtAt() {
        return builtAt;
    }
}
