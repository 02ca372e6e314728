package com.recommender.service.dto;

import java.util.List;

public record MovieRequest(
        String title,
        Integer year,
        List<String> genres,
        List<String> keywords,
        String poster,
        String desc
) {}
