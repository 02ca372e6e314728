package com.recommender.service.dto;

import java.util.List;

public record ScoredMovie(
        int id,
        String title,
        Integer year,
        List<String> genres,
        List<String> keywords,
        String poster,
        String desc,
        double score
) {

    public static ScoredMovie of(Movie m, double score) {
        double rounded = Math.round(score * 10_000d) / 10_000d;
        return new ScoredMovie(m.id(), m.title(), m.year(), m.genres(), m.keywords(), m.poster(), m.desc(), rounded);
    }
}
