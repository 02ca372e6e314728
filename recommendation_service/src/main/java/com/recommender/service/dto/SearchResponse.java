package com.recommender.service.dto;

import java.util.List;

public record SearchResponse(
        String query,
        List<ScoredMovie> results,
        String builtAt
) {}
