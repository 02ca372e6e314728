package com.recommender.benchmarks;

import com.recommender.core.Tokenizer;
import com.recommender.core.Vectorizer;
import com.recommender.core.VocabularyBuilder;
import com.recommender.dto.CorpusRecord;
import com.recommender.dto.ScoredRecord;
import com.recommender.index.IndexBuilder;
import com.recommender.index.SimilarityIndex;
import com.recommender.index.SimilarityRanker;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

import java.util.*;
import java.util.concurrent.TimeUnit;

/**
 * Microbenchmarks for index rebuilds and ranking
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@State(Scope.Benchmark)
@Warmup(iterations = 5, time = 1)
@Measurement(iterations = 10, time = 1)
@Fork(1)
public class RankingBenchmark {

    private IndexBuilder builder;
    private SimilarityRanker ranker;

    private List<CorpusRecord> smallCorpus;
    private List<CorpusRecord> mediumCorpus;
    private SimilarityIndex smallIndex;
    private SimilarityIndex mediumIndex;

    @Setup(Level.Trial)
    public void setup() {
        Vectorizer vectorizer = new Vectorizer(new Tokenizer());
        builder = new IndexBuilder(vectorizer, new VocabularyBuilder());
        ranker = new SimilarityRanker(vectorizer);

        smallCorpus = createTestMovies(100);
        mediumCorpus = createTestMovies(1000);
        smallIndex = builder.build(smallCorpus);
        mediumIndex = builder.build(mediumCorpus);
    }

    @Benchmark
    public void rebuildSmallCorpus(Blackhole bh) {
        bh.consume(builder.build(smallCorpus));
    }

    @Benchmark
    public void rebuildMediumCorpus(Blackhole bh) {
        bh.consume(builder.build(mediumCorpus));
    }

    @Benchmark
    public void rankByRecordSmall(Blackhole bh) {
        List<ScoredRecord> results = ranker.rankByRecord(smallIndex, 1, 10);
        bh.consume(results);
    }

    @Benchmark
    public void rankByRecordMedium(Blackhole bh) {
        List<ScoredRecord> results = ranker.rankByRecord(mediumIndex, 1, 10);
        bh.consume(results);
    }

    @Benchmark
    public void singleTermQuery(Blackhole bh) {
        List<ScoredRecord> results = ranker.rankByQuery(mediumIndex, "love", 10);
        bh.consume(results);
    }

    @Benchmark
    public void multiTermQuery(Blackhole bh) {
        List<ScoredRecord> results = ranker.rankByQuery(mediumIndex, "young love adventure mystery romance", 10);
        bh.consume(results);
    }

    private List<CorpusRecord> createTestMovies(int count) {
        List<CorpusRecord> movies = new ArrayList<>();
        Random random = new Random(42); // Fixed seed for reproducibility

        String[] titles = {
            "The Great Adventure", "Love Story", "Mystery Night", "Space War",
            "Ocean Heist", "Haunted Manor", "Dragon Quest", "Detective Story"
        };

        String[] words = {
            "love", "adventure", "mystery", "romance", "space", "war", "ghost",
            "heist", "ocean", "dragon", "young", "city", "revenge", "island"
        };

        String[] genres = {"SciFi", "Romance", "Drama", "Horror", "Thriller", "Comedy"};

        for (int i = 1; i <= count; i++) {
            String title = titles[random.nextInt(titles.length)] + " " + i;
            StringBuilder desc = new StringBuilder();
            int len = 5 + random.nextInt(15);
            for (int w = 0; w < len; w++) {
                desc.append(words[random.nextInt(words.length)]).append(' ');
            }
            List<String> tags = List.of(genres[random.nextInt(genres.length)], genres[random.nextInt(genres.length)]);

            movies.add(new CorpusRecord(i, title, desc.toString(), tags));
        }

        return movies;
    }
}
