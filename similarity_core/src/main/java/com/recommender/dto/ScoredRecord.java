package com.recommender.dto;

import java.util.Comparator;

public record ScoredRecord(int recordId, double score) {

    /** Score descending, then record id ascending. */
    public static final Comparator<ScoredRecord> RANKING_ORDER =
            Comparator.comparingDouble(ScoredRecord::score).reversed()
                    .thenComparingInt(ScoredRecord::recordId);
}
