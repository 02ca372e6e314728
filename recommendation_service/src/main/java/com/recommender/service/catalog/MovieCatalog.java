package com.recommender.service.catalog;

import com.recommender.dto.CorpusRecord;
import com.recommender.dto.ScoredRecord;
import com.recommender.index.SimilarityEngine;
import com.recommender.index.SimilarityIndex;
import com.recommender.service.dto.Movie;
import com.recommender.service.dto.MovieRequest;
import com.recommender.service.dto.ScoredMovie;
import com.recommender.service.store.MovieRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Movie list plus its similarity index. Additions are persisted first, then the
 * list is published and the index rebuilt.
 */
public final class MovieCatalog {

    private static final Logger log = LoggerFactory.getLogger(MovieCatalog.class);

    private final MovieRepository repository;
    private final SimilarityEngine engine;
    private final Object writeLock = new Object();

    private volatile Map<Integer, Movie> movies = Map.of();

    public MovieCatalog(MovieRepository repository, SimilarityEngine engine) {
        this.repository = repository;
        this.engine = engine;
    }

    public static MovieCatalog open(MovieRepository repository, SimilarityEngine engine) {
        MovieCatalog catalog = new MovieCatalog(repository, engine);
        catalog.reload();
        return catalog;
    }

    /**
     * Replaces the in-memory list with the repository contents and rebuilds the index.
     */
    public void reload() {
        synchronized (writeLock) {
            publish(repository.load());
        }
    }

    public List<Movie> all() {
        return List.copyOf(movies.values());
    }

    public Optional<Movie> byId(int id) {
        return Optional.ofNullable(movies.get(id));
    }

    public int size() {
        return movies.size();
    }

    public List<String> genres() {
        TreeSet<String> all = new TreeSet<>();
        for (Movie m : movies.values()) {
            all.addAll(m.genres());
        }
        return List.copyOf(all);
    }

    public SimilarityIndex index() {
        return engine.index();
    }

    /**
     * @throws IllegalArgumentException if the title is missing
     * @throws java.io.UncheckedIOException if the movie could not be persisted
     */
    public Movie add(MovieRequest req) {
        if (req == null || req.title() == null || req.title().isBlank()) {
            throw new IllegalArgumentException("Missing title");
        }

        synchronized (writeLock) {
            int newId = movies.keySet().stream().mapToInt(Integer::intValue).max().orElse(0) + 1;
            Movie movie = new Movie(
                    newId,
                    req.title(),
                    req.year(),
                    req.genres(),
                    req.keywords(),
                    req.poster(),
                    req.desc()
            );

            List<Movie> next = new ArrayList<>(movies.values());
            next.add(movie);
            repository.save(next);
            publish(next);

            log.info("Added movie {} '{}'", movie.id(), movie.title());
            return movie;
        }
    }

    /**
     * @throws com.recommender.index.RecordNotFoundException if the movie is not indexed
     */
    public List<ScoredMovie> recommendationsFor(int id, int topN) {
        return join(engine.rankByRecord(id, Math.max(0, topN)));
    }

    public List<ScoredMovie> search(String query, int topN) {
        return join(engine.rankByQuery(query, Math.max(0, topN)));
    }

    // the list is published before the index, so every indexed id resolves
    private void publish(List<Movie> list) {
        LinkedHashMap<Integer, Movie> byId = new LinkedHashMap<>();
        for (Movie m : list) {
            if (byId.putIfAbsent(m.id(), m) != null) {
                log.warn("Duplicate movie id {} ignored", m.id());
            }
        }
        movies = byId;

        List<CorpusRecord> corpus = byId.values().stream().map(Movie::toCorpusRecord).toList();
        engine.rebuildIndex(corpus);
    }

    private List<ScoredMovie> join(List<ScoredRecord> ranked) {
        Map<Integer, Movie> snapshot = movies;
        return ranked.stream()
                .map(r -> {
                    Movie m = snapshot.get(r.recordId());
                    return m == null ? null : ScoredMovie.of(m, r.score());
                })
                .filter(Objects::nonNull)
                .toList();
    }
}
