package com.recommender.index;

import com.recommender.core.Tokenizer;
import com.recommender.core.Vectorizer;
import com.recommender.core.VocabularyBuilder;
import com.recommender.dto.CorpusRecord;
import com.recommender.dto.ScoredRecord;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the current index snapshot for its owner. A rebuild constructs the new
 * snapshot first and then swaps the reference, so a query sees one snapshot
 * from start to end.
 */
public final class SimilarityEngine {

    private final IndexBuilder indexBuilder;
    private final SimilarityRanker ranker;
    private final AtomicReference<SimilarityIndex> current = new AtomicReference<>(SimilarityIndex.empty());

    public SimilarityEngine(IndexBuilder indexBuilder, SimilarityRanker ranker) {
        this.indexBuilder = indexBuilder;
        this.ranker = ranker;
    }

    public static SimilarityEngine create(double genreWeight) {
        Vectorizer vectorizer = new Vectorizer(new Tokenizer(), genreWeight);
        return new SimilarityEngine(
                new IndexBuilder(vectorizer, new VocabularyBuilder()),
                new SimilarityRanker(vectorizer)
        );
    }

    public SimilarityIndex rebuildIndex(List<CorpusRecord> corpusSnapshot) {
        SimilarityIndex next = indexBuilder.build(List.copyOf(corpusSnapshot));
        current.set(next);
        return next;
    }

    public SimilarityIndex index() {
        return current.get();
    }

    public List<ScoredRecord> rankByRecord(int recordId, int topN) {
        return ranker.rankByRecord(current.get(), recordId, topN);
    }

    public List<ScoredRecord> rankByQuery(String query, int topN) {
        return ranker.rankByQuery(current.get(), query, topN);
    }
}
