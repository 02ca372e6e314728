package com.recommender.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Map;
import java.util.Properties;

/**
 * Service settings. Environment variables win over {@code application.properties},
 * which wins over the built-in defaults.
 */
public final class ServiceConfig {

    private static final Logger log = LoggerFactory.getLogger(ServiceConfig.class);

    final int port;
    final Path dataFile;
    final double genreWeight;
    final int defaultTopN;

    ServiceConfig(int port, Path dataFile, double genreWeight, int defaultTopN) {
        this.port = port;
        this.dataFile = dataFile;
        this.genreWeight = genreWeight;
        this.defaultTopN = defaultTopN;
    }

    public static ServiceConfig fromEnv() {
        return from(System.getenv(), loadProperties("application.properties"));
    }

    static ServiceConfig from(Map<String, String> env, Properties props) {
        int port = Integer.parseInt(value(env, "PORT", props, "server.port", "4000"));
        Path dataFile = Path.of(value(env, "DATA_FILE", props, "data.file", "data/movies.json"));
        double genreWeight = Double.parseDouble(value(env, "GENRE_WEIGHT", props, "similarity.genre.weight", "1.2"));
        int defaultTopN = Integer.parseInt(value(env, "DEFAULT_TOP_N", props, "recommendations.default.topN", "5"));
        return new ServiceConfig(port, dataFile, genreWeight, defaultTopN);
    }

    public static ServiceConfig of(int port, Path dataFile) {
        return new ServiceConfig(port, dataFile, 1.2, 5);
    }

    private static String value(Map<String, String> env, String envKey, Properties props, String propKey, String def) {
        String fromEnv = env.get(envKey);
        if (fromEnv != null && !fromEnv.isBlank()) return fromEnv.trim();
        return props.getProperty(propKey, def).trim();
    }

    private static Properties loadProperties(String resource) {
        Properties properties = new Properties();
        try (InputStream input = ServiceConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (input != null) {
                properties.load(input);
            }
        } catch (IOException e) {
            log.error("Failed to load configuration {}: {}", resource, e.getMessage());
        }
        return properties;
    }

    public int port() {
        return port;
    }

    public Path dataFile() {
        return dataFile;
    }

    public double genreWeight() {
        return genreWeight;
    }

    public int defaultTopN() {
        return defaultTopN;
    }
}
