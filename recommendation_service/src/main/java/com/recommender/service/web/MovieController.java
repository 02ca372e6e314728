package com.recommender.service.web;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.recommender.index.RecordNotFoundException;
import com.recommender.service.catalog.MovieCatalog;
import com.recommender.service.dto.Movie;
import com.recommender.service.dto.MovieRequest;
import com.recommender.service.dto.RecommendationResponse;
import com.recommender.service.dto.ScoredMovie;
import com.recommender.service.dto.SearchResponse;
import io.javalin.Javalin;
import io.javalin.http.Context;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class MovieController {

    private static final Logger log = LoggerFactory.getLogger(MovieController.class);

    private final Gson gson;
    private final MovieCatalog catalog;
    private final int defaultTopN;

    public MovieController(Gson gson, MovieCatalog catalog, int defaultTopN) {
        this.gson = gson;
        this.catalog = catalog;
        this.defaultTopN = defaultTopN;
    }

    public void registerRoutes(Javalin app) {

        app.get("/status", ctx -> {
            Map<String, Object> status = new LinkedHashMap<>();
            status.put("service", "recommendation-service");
            status.put("status", "running");
            status.put("movies", catalog.size());
            status.put("builtAt", catalog.index().builtAt().toString());
            ctx.result(gson.toJson(status));
        });

        app.get("/api/movies", ctx -> ctx.result(gson.toJson(catalog.all())));

        app.get("/api/movies/{id}", ctx -> {
            Integer id = pathId(ctx);
            if (id == null) return;

            Optional<Movie> movie = catalog.byId(id);
            if (movie.isEmpty()) {
                error(ctx, 404, "Movie not found");
                return;
            }
            ctx.result(gson.toJson(movie.get()));
        });

        app.get("/api/genres", ctx -> ctx.result(gson.toJson(catalog.genres())));

        app.get("/api/recommendations/{id}", ctx -> {
            Integer id = pathId(ctx);
            if (id == null) return;
            Integer topN = topN(ctx);
            if (topN == null) return;

            List<ScoredMovie> recs;
            try {
                recs = catalog.recommendationsFor(id, topN);
            } catch (RecordNotFoundException e) {
                error(ctx, 404, "Movie not found");
                return;
            }
            String builtAt = catalog.index().builtAt().toString();
            ctx.result(gson.toJson(new RecommendationResponse(id, recs, builtAt)));
        });

        app.get("/api/search", ctx -> {
            String query = ctx.queryParam("q");
            if (query == null || query.trim().isEmpty()) {
                error(ctx, 400, "Query parameter 'q' is required");
                return;
            }
            Integer topN = topN(ctx);
            if (topN == null) return;

            List<ScoredMovie> results = catalog.search(query, topN);
            String builtAt = catalog.index().builtAt().toString();
            ctx.result(gson.toJson(new SearchResponse(query, results, builtAt)));
        });

        app.post("/api/movies", ctx -> {
            MovieRequest req;
            try {
                req = gson.fromJson(ctx.body(), MovieRequest.class);
            } catch (JsonParseException e) {
                error(ctx, 400, "invalid json");
                return;
            }

            try {
                Movie movie = catalog.add(req);
                ctx.status(201).result(gson.toJson(movie));
            } catch (IllegalArgumentException e) {
                error(ctx, 400, e.getMessage());
            } catch (UncheckedIOException e) {
                log.error("Failed to save movie: {}", e.getMessage(), e);
                error(ctx, 500, "Failed to save");
            }
        });

        app.exception(Exception.class, (e, ctx) -> {
            log.error("Unhandled error on {} {}", ctx.method(), ctx.path(), e);
            error(ctx, 500, "Internal server error");
        });
    }

    private Integer pathId(Context ctx) {
        try {
            return Integer.parseInt(ctx.pathParam("id"));
        } catch (NumberFormatException e) {
            error(ctx, 400, "invalid id");
            return null;
        }
    }

    // negative values clamp to zero
    private Integer topN(Context ctx) {
        String raw = ctx.queryParam("topN");
        if (raw == null || raw.isBlank()) return defaultTopN;
        try {
            return Math.max(0, Integer.parseInt(raw.trim()));
        } catch (NumberFormatException e) {
            error(ctx, 400, "invalid topN");
            return null;
        }
    }

    private void error(Context ctx, int status, String message) {
        ctx.status(status).result(gson.toJson(Map.of("error", message)));
    }
}
