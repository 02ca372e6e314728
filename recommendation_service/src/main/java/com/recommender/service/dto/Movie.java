package com.recommender.service.dto;

import com.recommender.dto.CorpusRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public record Movie(
        int id,
        String title,
        Integer year,
        List<String> genres,
        List<String> keywords,
        String poster,
        String desc
) {

    public Movie {
        genres = genres == null ? List.of() : genres.stream().filter(Objects::nonNull).toList();
        keywords = keywords == null ? List.of() : keywords.stream().filter(Objects::nonNull).toList();
        poster = poster == null ? "" : poster;
        desc = desc == null ? "" : desc;
    }

    /**
     * Keywords are folded into the description text; genres become tags.
     */
    public CorpusRecord toCorpusRecord() {
        List<String> parts = new ArrayList<>();
        parts.add(desc);
        parts.addAll(keywords);
        return new CorpusRecord(id, title, String.join(" ", parts), genres);
    }
}
