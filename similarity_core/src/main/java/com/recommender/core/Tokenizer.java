package com.recommender.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

public final class Tokenizer {

    private static final Pattern SEPARATOR = Pattern.compile("[^a-z0-9]+");

    private static final Set<String> STOPWORDS = Set.of(
            "the", "and", "a", "an", "of", "in", "on", "to", "for", "with",
            "is", "are", "by", "from", "that", "this", "it", "as", "be", "was",
            "which"
    );

    public List<String> tokenize(String text) {
        if (text == null || text.isBlank()) return List.of();

        String lower = text.toLowerCase(Locale.ROOT);

        List<String> out = new ArrayList<>();
        for (String t : SEPARATOR.split(lower)) {
            if (t.isEmpty()) continue;
            out.add(t);
        }
        return out;
    }

    /**
     * Same as {@link #tokenize(String)} with stop words removed.
     */
    public List<String> tokenizeFiltered(String text) {
        List<String> tokens = tokenize(text);
        if (tokens.isEmpty()) return tokens;

        List<String> out = new ArrayList<>(tokens.size());
        for (String t : tokens) {
            if (STOPWORDS.contains(t)) continue;
            out.add(t);
        }
        return out;
    }
}
