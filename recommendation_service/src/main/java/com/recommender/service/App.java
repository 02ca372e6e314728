package com.recommender.service;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.recommender.index.SimilarityEngine;
import com.recommender.service.catalog.MovieCatalog;
import com.recommender.service.store.MovieRepository;
import com.recommender.service.web.MovieController;
import io.javalin.Javalin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class App {

    private static final Logger log = LoggerFactory.getLogger(App.class);

    public static Javalin start(ServiceConfig config) {
        Gson gson = new Gson();
        Gson fileGson = new GsonBuilder().setPrettyPrinting().serializeNulls().create();

        MovieRepository repository = new MovieRepository(config.dataFile(), fileGson);
        SimilarityEngine engine = SimilarityEngine.create(config.genreWeight());
        MovieCatalog catalog = MovieCatalog.open(repository, engine);

        MovieController movieController = new MovieController(gson, catalog, config.defaultTopN());

        Javalin app = Javalin.create(cfg -> {
            cfg.http.defaultContentType = "application/json";
            cfg.bundledPlugins.enableCors(cors -> cors.addRule(rule -> rule.anyHost()));
        });

        movieController.registerRoutes(app);

        app.start(config.port());
        log.info("Movie recommender API listening on port {} ({} movies from {})",
                app.port(), catalog.size(), config.dataFile());
        return app;
    }

    public static void main(String[] args) {
        start(ServiceConfig.fromEnv());
    }
}
