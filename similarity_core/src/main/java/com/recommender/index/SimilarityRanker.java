package com.recommender.index;

import com.recommender.core.FeatureVector;
import com.recommender.core.Vectorizer;
import com.recommender.dto.ScoredRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Cosine ranking against one index snapshot. Stored vectors are unit length,
 * so cosine reduces to a dot product.
 */
public final class SimilarityRanker {

    private final Vectorizer vectorizer;

    public SimilarityRanker(Vectorizer vectorizer) {
        this.vectorizer = vectorizer;
    }

    /**
     * Records most similar to {@code recordId}, the record itself excluded.
     * Zero scores are kept.
     *
     * @throws RecordNotFoundException if the id is not part of the snapshot
     */
    public List<ScoredRecord> rankByRecord(SimilarityIndex index, int recordId, int topN) {
        FeatureVector source = index.vectorOf(recordId);
        if (topN <= 0) return List.of();

        double[] dense = source.toDense(index.vocabulary().dimension());

        List<ScoredRecord> scores = new ArrayList<>(index.size());
        for (Map.Entry<Integer, FeatureVector> e : index.vectors().entrySet()) {
            if (e.getKey() == recordId) continue;
            scores.add(new ScoredRecord(e.getKey(), e.getValue().dot(dense)));
        }
        return topN(scores, topN);
    }

    /**
     * Records most similar to free text. Records scoring exactly zero are omitted,
     * and a query without any known term or tag yields an empty list.
     */
    public List<ScoredRecord> rankByQuery(SimilarityIndex index, String query, int topN) {
        if (topN <= 0 || index.isEmpty()) return List.of();

        FeatureVector q = vectorizer.vectorizeQuery(query, index.vocabulary());
        if (q.isZero()) return List.of();

        List<ScoredRecord> scores = new ArrayList<>();
        for (Map.Entry<Integer, FeatureVector> e : index.vectors().entrySet()) {
            double score = e.getValue().dot(q);
            if (score == 0.0) continue;
            scores.add(new ScoredRecord(e.getKey(), score));
        }
        return topN(scores, topN);
    }

    private List<ScoredRecord> topN(List<ScoredRecord> scores, int topN) {
        scores.sort(ScoredRecord.RANKING_ORDER);
        if (scores.size() <= topN) return List.copyOf(scores);
        return List.copyOf(scores.subList(0, topN));
    }
}
