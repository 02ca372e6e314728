package com.recommender.service.dto;

import java.util.List;

public record RecommendationResponse(
        int baseId,
        List<ScoredMovie> recommendations,
        String builtAt
) {}
