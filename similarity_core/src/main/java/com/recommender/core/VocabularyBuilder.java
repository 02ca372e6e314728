package com.recommender.core;

import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

public final class VocabularyBuilder {

    /**
     * Smoothed idf: {@code ln(N / (1 + df)) + 1}.
     */
    public static double idf(int documentCount, int documentFrequency) {
        if (documentFrequency > documentCount) {
            throw new IllegalArgumentException("df " + documentFrequency + " exceeds corpus size " + documentCount);
        }
        return Math.log((double) documentCount / (1 + documentFrequency)) + 1.0;
    }

    /**
     * @param tokenizedDocs filtered tokens of every document, in corpus order
     * @param docTags       tags of every document, in the same order
     */
    public Vocabulary build(List<List<String>> tokenizedDocs, List<List<String>> docTags) {
        if (tokenizedDocs.size() != docTags.size()) {
            throw new IllegalArgumentException("token lists and tag lists differ in size: "
                    + tokenizedDocs.size() + " vs " + docTags.size());
        }

        int n = tokenizedDocs.size();
        if (n == 0) return Vocabulary.EMPTY;

        // df: each distinct term once per document
        Map<String, Integer> df = new TreeMap<>();
        for (List<String> tokens : tokenizedDocs) {
            Set<String> seen = new HashSet<>(tokens);
            for (String t : seen) {
                df.merge(t, 1, Integer::sum);
            }
        }

        String[] terms = new String[df.size()];
        int[] freq = new int[df.size()];
        double[] idf = new double[df.size()];
        int i = 0;
        for (Map.Entry<String, Integer> e : df.entrySet()) {
            terms[i] = e.getKey();
            freq[i] = e.getValue();
            idf[i] = idf(n, e.getValue());
            i++;
        }

        Set<String> tags = new TreeSet<>();
        for (List<String> docTagList : docTags) {
            for (String tag : docTagList) {
                String key = Vocabulary.normalizeTag(tag);
                if (key != null) tags.add(key);
            }
        }

        return new Vocabulary(n, terms, freq, idf, tags.toArray(new String[0]));
    }
}
