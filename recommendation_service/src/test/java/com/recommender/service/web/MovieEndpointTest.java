package com.recommender.service.web;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.recommender.service.App;
import com.recommender.service.ServiceConfig;
import io.javalin.Javalin;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public final class MovieEndpointTest {

    private static Javalin app;
    private static int port;
    private static Path tempRoot;

    private final HttpClient http = HttpClient.newHttpClient();

    @BeforeAll
    static void startServer() throws Exception {
        tempRoot = Files.createTempDirectory("recommendation-service-test-");
        Path dataFile = tempRoot.resolve("movies.json");

        String json = """
                [
                  { "id": 1, "title": "Space War", "year": 1998, "genres": ["SciFi"], "keywords": [], "poster": "", "desc": "a war in space" },
                  { "id": 2, "title": "Love Story", "year": 2004, "genres": ["Romance"], "keywords": [], "poster": "", "desc": "a romance in paris" },
                  { "id": 3, "title": "Space Romance", "year": 2012, "genres": ["SciFi", "Romance"], "keywords": [], "poster": "", "desc": "love and war in space" }
                ]
                """;
        Files.writeString(dataFile, json, StandardCharsets.UTF_8);

        app = App.start(ServiceConfig.of(0, dataFile));
        port = app.port();
    }

    @AfterAll
    static void stopServer() {
        if (app != null) app.stop();
        if (tempRoot != null) {
            try (var paths = Files.walk(tempRoot)) {
                paths.sorted(Comparator.reverseOrder())
                        .forEach(path -> path.toFile().delete());
            } catch (Exception ignored) {
                // best-effort cleanup for test temp dir
            }
        }
    }

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create("http://localhost:" + port + path))
                .GET()
                .build();
        return http.send(req, HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path, String body) throws Exception {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create("http://localhost:" + port + path))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        return http.send(req, HttpResponse.BodyHandlers.ofString());
    }

    private static List<Integer> ids(JsonArray arr) {
        List<Integer> out = new ArrayList<>();
        arr.forEach(e -> out.add(e.getAsJsonObject().get("id").getAsInt()));
        return out;
    }

    @Test
    void getMovieReturnsItOr404() throws Exception {
        HttpResponse<String> found = get("/api/movies/2");
        assertEquals(200, found.statusCode());
        assertEquals("Love Story", JsonParser.parseString(found.body()).getAsJsonObject().get("title").getAsString());

        HttpResponse<String> missing = get("/api/movies/999");
        assertEquals(404, missing.statusCode());
        assertTrue(missing.body().contains("\"error\":\"Movie not found\""));

        assertEquals(400, get("/api/movies/abc").statusCode());
    }

    @Test
    void genresAreDistinctAndSorted() throws Exception {
        HttpResponse<String> resp = get("/api/genres");

        assertEquals(200, resp.statusCode());
        List<String> genres = new ArrayList<>();
        JsonParser.parseString(resp.body()).getAsJsonArray().forEach(e -> genres.add(e.getAsString()));
        assertTrue(genres.containsAll(List.of("Romance", "SciFi")));
        assertEquals(genres.stream().sorted().distinct().toList(), genres);
    }

    @Test
    void recommendationsAreRankedWithScores() throws Exception {
        HttpResponse<String> resp = get("/api/recommendations/1?topN=2");

        assertEquals(200, resp.statusCode());
        JsonObject body = JsonParser.parseString(resp.body()).getAsJsonObject();
        assertEquals(1, body.get("baseId").getAsInt());
        assertTrue(body.has("builtAt"));
        JsonArray recs = body.getAsJsonArray("recommendations");
        assertEquals(List.of(3, 2), ids(recs));
        assertTrue(recs.get(0).getAsJsonObject().get("score").getAsDouble() > 0);
    }

    @Test
    void recommendationsForUnknownMovieIs404() throws Exception {
        assertEquals(404, get("/api/recommendations/999").statusCode());
        assertEquals(400, get("/api/recommendations/1?topN=lots").statusCode());
    }

    @Test
    void negativeTopNReturnsEmptyList() throws Exception {
        HttpResponse<String> resp = get("/api/recommendations/1?topN=-2");

        assertEquals(200, resp.statusCode());
        JsonObject body = JsonParser.parseString(resp.body()).getAsJsonObject();
        assertEquals(0, body.getAsJsonArray("recommendations").size());
    }

    @Test
    void searchOmitsNonMatchingMovies() throws Exception {
        HttpResponse<String> resp = get("/api/search?q=space%20battle&topN=5");

        assertEquals(200, resp.statusCode());
        JsonArray results = JsonParser.parseString(resp.body()).getAsJsonObject().getAsJsonArray("results");
        assertEquals(List.of(1, 3), ids(results));

        assertEquals(400, get("/api/search").statusCode());
    }

    @Test
    void postWithoutTitleIsRejected() throws Exception {
        HttpResponse<String> resp = post("/api/movies", "{ \"desc\": \"no title here\" }");

        assertEquals(400, resp.statusCode());
        assertTrue(resp.body().contains("\"error\":\"Missing title\""));

        assertEquals(400, post("/api/movies", "{ broken").statusCode());
    }

    @Test
    void postedMovieIsStoredAndRecommendable() throws Exception {
        HttpResponse<String> created = post("/api/movies", """
                { "title": "Submarine Depths", "genres": ["Thriller"], "keywords": ["submarine"], "desc": "a crew trapped under the ice" }
                """);

        assertEquals(201, created.statusCode());
        int id = JsonParser.parseString(created.body()).getAsJsonObject().get("id").getAsInt();
        assertTrue(id > 3);

        assertEquals(200, get("/api/movies/" + id).statusCode());
        assertEquals(200, get("/api/recommendations/" + id).statusCode());

        JsonArray results = JsonParser.parseString(get("/api/search?q=submarine").body())
                .getAsJsonObject().getAsJsonArray("results");
        assertEquals(List.of(id), ids(results));
    }

    @Test
    void statusReportsRunning() throws Exception {
        HttpResponse<String> resp = get("/status");

        assertEquals(200, resp.statusCode());
        assertTrue(resp.body().contains("\"status\":\"running\""));
    }
}
