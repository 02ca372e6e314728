package com.recommender.index;

import com.recommender.core.FeatureVector;
import com.recommender.core.Tokenizer;
import com.recommender.core.Vectorizer;
import com.recommender.core.Vocabulary;
import com.recommender.core.VocabularyBuilder;
import com.recommender.dto.CorpusRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;

public final class IndexBuilder {

    private static final Logger log = LoggerFactory.getLogger(IndexBuilder.class);

    private final Vectorizer vectorizer;
    private final VocabularyBuilder vocabularyBuilder;

    public IndexBuilder(Vectorizer vectorizer, VocabularyBuilder vocabularyBuilder) {
        this.vectorizer = vectorizer;
        this.vocabularyBuilder = vocabularyBuilder;
    }

    /**
     * Full rebuild: tokenize, vocabulary + idf, vectorize. The corpus is only read.
     *
     * @throws IllegalArgumentException if two records share an id
     */
    public SimilarityIndex build(List<CorpusRecord> corpus) {
        if (corpus == null || corpus.isEmpty()) {
            log.warn("Empty corpus, index has no queryable records");
            return SimilarityIndex.empty();
        }

        Set<Integer> ids = new HashSet<>();
        for (CorpusRecord r : corpus) {
            if (!ids.add(r.id())) {
                throw new IllegalArgumentException("duplicate record id: " + r.id());
            }
        }

        Tokenizer tokenizer = vectorizer.tokenizer();
        List<List<String>> tokenized = new ArrayList<>(corpus.size());
        List<List<String>> tags = new ArrayList<>(corpus.size());
        for (CorpusRecord r : corpus) {
            tokenized.add(tokenizer.tokenizeFiltered(r.text()));
            tags.add(r.tags());
        }

        Vocabulary vocabulary = vocabularyBuilder.build(tokenized, tags);

        LinkedHashMap<Integer, FeatureVector> vectors = new LinkedHashMap<>();
        for (int i = 0; i < corpus.size(); i++) {
            vectors.put(corpus.get(i).id(), vectorizer.vectorize(tokenized.get(i), tags.get(i), vocabulary));
        }

        SimilarityIndex index = new SimilarityIndex(vocabulary, vectors, Instant.now());
        log.info("Index built: {} docs, vocab={}, tags={}", index.size(), vocabulary.size(), vocabulary.tagCount());
        return index;
    }
}
