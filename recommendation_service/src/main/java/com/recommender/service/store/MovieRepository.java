package com.recommender.service.store;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.reflect.TypeToken;
import com.recommender.service.dto.Movie;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Objects;

/**
 * Movie records kept as one JSON array on disk.
 */
public final class MovieRepository {

    private static final Logger log = LoggerFactory.getLogger(MovieRepository.class);

    private static final Type MOVIE_LIST = new TypeToken<List<Movie>>() {}.getType();

    private final Path dataFile;
    private final Gson gson;

    public MovieRepository(Path dataFile, Gson gson) {
        this.dataFile = dataFile;
        this.gson = gson;
    }

    /**
     * Reads all movies. A missing or unreadable file yields an empty list.
     */
    public List<Movie> load() {
        if (!Files.exists(dataFile)) {
            log.warn("No movie file at {}, starting with an empty corpus", dataFile);
            return List.of();
        }
        try (Reader r = Files.newBufferedReader(dataFile, StandardCharsets.UTF_8)) {
            List<Movie> movies = gson.fromJson(r, MOVIE_LIST);
            if (movies == null) return List.of();
            return movies.stream().filter(Objects::nonNull).toList();
        } catch (IOException | JsonParseException e) {
            log.error("Failed to load {}: {}", dataFile, e.getMessage());
            return List.of();
        }
    }

    /**
     * Writes all movies, replacing the file in one move.
     */
    public void save(List<Movie> movies) {
        try {
            Path parent = dataFile.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = dataFile.resolveSibling(dataFile.getFileName() + ".tmp");
            Files.writeString(tmp, gson.toJson(movies, MOVIE_LIST), StandardCharsets.UTF_8);
            Files.move(tmp, dataFile, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to save movies to " + dataFile, e);
        }
    }
}
