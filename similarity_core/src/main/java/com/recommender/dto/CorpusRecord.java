package com.recommender.dto;

import java.util.List;
import java.util.Objects;

/**
 * One corpus entry as seen by the index. Tags keep their display order;
 * similarity treats them as a set.
 */
public record CorpusRecord(
        int id,
        String title,
        String description,
        List<String> tags
) {

    public CorpusRecord {
        title = title == null ? "" : title;
        description = description == null ? "" : description;
        tags = tags == null
                ? List.of()
                : tags.stream().filter(Objects::nonNull).toList();
    }

    public String text() {
        return title + "\n" + description;
    }
}
