package com.recommender.core;

import com.recommender.dto.CorpusRecord;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns documents and free-text queries into normalized tf-idf vectors with
 * an extra weighted dimension per tag.
 */
public final class Vectorizer {

    public static final double DEFAULT_GENRE_WEIGHT = 1.2;

    private final Tokenizer tokenizer;
    private final double genreWeight;

    public Vectorizer(Tokenizer tokenizer) {
        this(tokenizer, DEFAULT_GENRE_WEIGHT);
    }

    public Vectorizer(Tokenizer tokenizer, double genreWeight) {
        if (genreWeight < 0 || Double.isNaN(genreWeight) || Double.isInfinite(genreWeight)) {
            throw new IllegalArgumentException("genre weight must be a non-negative number: " + genreWeight);
        }
        this.tokenizer = tokenizer;
        this.genreWeight = genreWeight;
    }

    public Tokenizer tokenizer() {
        return tokenizer;
    }

    public FeatureVector vectorize(CorpusRecord record, Vocabulary vocabulary) {
        return vectorize(tokenizer.tokenizeFiltered(record.text()), record.tags(), vocabulary);
    }

    /**
     * Builds the unnormalized weights of already tokenized text, then normalizes.
     * Terms and tags missing from the vocabulary are dropped.
     */
    public FeatureVector vectorize(List<String> tokens, List<String> tags, Vocabulary vocabulary) {
        Map<Integer, Double> weights = new HashMap<>();

        Map<String, Integer> counts = toCounts(tokens);
        for (Map.Entry<String, Integer> e : counts.entrySet()) {
            int idx = vocabulary.indexOf(e.getKey());
            if (idx < 0) continue;
            double tf = 1.0 + Math.log(e.getValue());
            weights.put(idx, tf * vocabulary.idf(idx));
        }

        // repeated tags still contribute once
        for (String tag : new LinkedHashSet<>(tags)) {
            int dim = vocabulary.tagDimension(tag);
            if (dim < 0) continue;
            weights.put(dim, genreWeight);
        }

        return FeatureVector.of(weights).normalized();
    }

    /**
     * Query tokens that name a known tag also switch on that tag's dimension,
     * as does the whole query when it equals a tag.
     */
    public FeatureVector vectorizeQuery(String query, Vocabulary vocabulary) {
        List<String> tokens = tokenizer.tokenizeFiltered(query);

        Set<String> tagCandidates = new LinkedHashSet<>(tokens);
        String whole = Vocabulary.normalizeTag(query);
        if (whole != null) tagCandidates.add(whole);

        return vectorize(tokens, List.copyOf(tagCandidates), vocabulary);
    }

    private Map<String, Integer> toCounts(List<String> tokens) {
        Map<String, Integer> counts = new HashMap<>();
        for (String t : tokens) {
            counts.merge(t, 1, Integer::sum);
        }
        return counts;
    }
}
