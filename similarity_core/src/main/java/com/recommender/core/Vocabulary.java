package com.recommender.core;

import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Term and tag dimensions for one index generation, plus the idf table.
 *
 * <p>Lexical terms occupy {@code [0, size())}; tags occupy
 * {@code [size(), dimension())}. Both are ordered lexicographically.
 */
public final class Vocabulary {

    public static final Vocabulary EMPTY = new Vocabulary(0, new String[0], new int[0], new double[0], new String[0]);

    private final int documentCount;
    private final String[] terms;
    private final int[] documentFrequency;
    private final double[] idf;
    private final String[] tags;

    private final Map<String, Integer> termIndex;
    private final Map<String, Integer> tagIndex;

    Vocabulary(int documentCount, String[] terms, int[] documentFrequency, double[] idf, String[] tags) {
        this.documentCount = documentCount;
        this.terms = terms;
        this.documentFrequency = documentFrequency;
        this.idf = idf;
        this.tags = tags;

        this.termIndex = new HashMap<>(terms.length * 2);
        for (int i = 0; i < terms.length; i++) {
            termIndex.put(terms[i], i);
        }
        this.tagIndex = new HashMap<>(tags.length * 2);
        for (int i = 0; i < tags.length; i++) {
            tagIndex.put(tags[i], terms.length + i);
        }
    }

    /**
     * Canonical tag key: trimmed and lowercased. Returns null for blank tags.
     */
    public static String normalizeTag(String tag) {
        if (tag == null || tag.isBlank()) return null;
        return tag.trim().toLowerCase(Locale.ROOT);
    }

    public int documentCount() {
        return documentCount;
    }

    /** Number of lexical terms. */
    public int size() {
        return terms.length;
    }

    public int tagCount() {
        return tags.length;
    }

    /** Total vector dimension: lexical terms plus tags. */
    public int dimension() {
        return terms.length + tags.length;
    }

    public boolean isEmpty() {
        return terms.length == 0 && tags.length == 0;
    }

    /** Index of the term, or -1 when it is not part of this vocabulary. */
    public int indexOf(String term) {
        Integer i = termIndex.get(term);
        return i == null ? -1 : i;
    }

    /** Dimension of the normalized tag, or -1 when the tag is unknown. */
    public int tagDimension(String tag) {
        String key = normalizeTag(tag);
        if (key == null) return -1;
        Integer i = tagIndex.get(key);
        return i == null ? -1 : i;
    }

    public double idf(int index) {
        return idf[index];
    }

    public int documentFrequency(int index) {
        return documentFrequency[index];
    }

    public List<String> terms() {
        return List.of(terms);
    }

    public List<String> tags() {
        return List.of(tags);
    }

    public double[] idfTable() {
        return Arrays.copyOf(idf, idf.length);
    }
}
