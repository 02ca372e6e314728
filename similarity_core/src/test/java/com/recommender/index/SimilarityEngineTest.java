package com.recommender.index;

import com.recommender.core.FeatureVector;
import com.recommender.dto.CorpusRecord;
import com.recommender.dto.ScoredRecord;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public final class SimilarityEngineTest {

    @Test
    void freshEngineHasEmptyIndex() {
        SimilarityEngine engine = SimilarityEngine.create(1.2);

        assertTrue(engine.index().isEmpty());
        assertTrue(engine.rankByQuery("space", 5).isEmpty());
        assertThrows(RecordNotFoundException.class, () -> engine.rankByRecord(1, 5));
    }

    @Test
    void rebuildReplacesSnapshotWholesale() {
        SimilarityEngine engine = SimilarityEngine.create(1.2);

        SimilarityIndex first = engine.rebuildIndex(Corpora.threeMovies());
        assertSame(first, engine.index());

        List<CorpusRecord> grown = new ArrayList<>(Corpora.threeMovies());
        grown.add(new CorpusRecord(4, "Space Odyssey", "war of robots in space", List.of("SciFi")));
        SimilarityIndex second = engine.rebuildIndex(grown);

        assertNotSame(first, second);
        assertSame(second, engine.index());
        assertEquals(3, first.size());
        assertEquals(4, second.size());
        assertThrows(RecordNotFoundException.class, () -> first.vectorOf(4));
    }

    @Test
    void rebuildDoesNotSeeLaterCorpusChanges() {
        SimilarityEngine engine = SimilarityEngine.create(1.2);
        List<CorpusRecord> corpus = new ArrayList<>(Corpora.threeMovies());

        engine.rebuildIndex(corpus);
        corpus.add(new CorpusRecord(4, "Later", "added after rebuild", List.of()));

        assertEquals(3, engine.index().size());
        assertThrows(RecordNotFoundException.class, () -> engine.rankByRecord(4, 5));
    }

    @Test
    void engineDelegatesToCurrentSnapshot() {
        SimilarityEngine engine = SimilarityEngine.create(1.2);
        engine.rebuildIndex(Corpora.threeMovies());

        List<Integer> byRecord = engine.rankByRecord(1, 2).stream().map(ScoredRecord::recordId).toList();
        List<Integer> byQuery = engine.rankByQuery("space battle", 5).stream().map(ScoredRecord::recordId).toList();

        assertEquals(List.of(3, 2), byRecord);
        assertEquals(List.of(1, 3), byQuery);
    }

    @Test
    void readersNeverSeeTornSnapshotDuringRebuilds() throws Exception {
        SimilarityEngine engine = SimilarityEngine.create(1.2);
        List<CorpusRecord> small = Corpora.threeMovies();
        List<CorpusRecord> large = Corpora.synthetic(120, 9L);
        engine.rebuildIndex(small);

        ExecutorService exec = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        AtomicBoolean running = new AtomicBoolean(true);
        List<String> failures = Collections.synchronizedList(new ArrayList<>());

        Runnable reader = () -> {
            try {
                start.await();
                while (running.get()) {
                    SimilarityIndex snapshot = engine.index();
                    int dimension = snapshot.vocabulary().dimension();
                    if (snapshot.size() != small.size() && snapshot.size() != large.size()) {
                        failures.add("unexpected size " + snapshot.size());
                    }
                    for (FeatureVector v : snapshot.vectors().values()) {
                        // throws if a vector uses a dimension outside its own vocabulary
                        v.toDense(dimension);
                    }
                    engine.rankByQuery("space war", 5);
                }
            } catch (Exception e) {
                failures.add(e.toString());
            }
        };

        List<Future<?>> readers = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            readers.add(exec.submit(reader));
        }

        start.countDown();
        for (int i = 0; i < 40; i++) {
            engine.rebuildIndex(i % 2 == 0 ? large : small);
        }
        running.set(false);

        for (Future<?> f : readers) {
            f.get(10, TimeUnit.SECONDS);
        }
        exec.shutdownNow();

        assertTrue(failures.isEmpty(), failures.toString());
    }
}
