package com.interviewindex.index;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class LocalJsonVectorStoreTest {

    @TempDir
    Path tempDir;

    @Test
    void shouldRankByInnerProductAndLimitToOverK() {
        LocalJsonVectorStore store = new LocalJsonVectorStore(tempDir.resolve("s.vectors.json"), 3, "test-v1");
        store.insert(0L, new float[] { 1f, 0f, 0f });
        store.insert(1L, new float[] { 0f, 1f, 0f });
        store.insert(2L, unit(1f, 1f, 0f));

        List<VectorHit> hits = store.search(new float[] { 1f, 0f, 0f }, 2);

        assertEquals(2, hits.size());
        assertEquals(0L, hits.get(0).id());
        assertEquals(1f, hits.get(0).score(), 1e-6f);
        assertEquals(2L, hits.get(1).id());
        assertEquals(0.7071f, hits.get(1).score(), 1e-3f);
    }

    @Test
    void shouldRejectWrongDimensionUnnormalizedAndDuplicateVectors() {
        LocalJsonVectorStore store = new LocalJsonVectorStore(tempDir.resolve("s.vectors.json"), 3, "test-v1");
        store.insert(0L, new float[] { 1f, 0f, 0f });

        assertThrows(IllegalArgumentException.class, () -> store.insert(1L, new float[] { 1f, 0f }));
        assertThrows(IllegalArgumentException.class, () -> store.insert(1L, new float[] { 1f, 1f, 0f }));
        assertThrows(IllegalStateException.class, () -> store.insert(0L, new float[] { 0f, 1f, 0f }));
        assertEquals(1, store.count());
    }

    @Test
    void shouldPersistAndReloadVectors() throws Exception {
        Path path = tempDir.resolve("index/s.vectors.json");
        LocalJsonVectorStore store = new LocalJsonVectorStore(path, 3, "test-v1");
        store.insert(4L, new float[] { 0f, 0f, 1f });
        store.insert(7L, new float[] { 0f, 1f, 0f });
        store.flush();

        LocalJsonVectorStore reloaded = LocalJsonVectorStore.load(path, 3, "test-v1");

        assertEquals(Set.of(4L, 7L), reloaded.ids());
        assertEquals(7L, reloaded.search(new float[] { 0f, 1f, 0f }, 1).get(0).id());
    }

    @Test
    void shouldRefuseToLoadVectorsFromAnotherEmbeddingVersion() throws Exception {
        Path path = tempDir.resolve("s.vectors.json");
        LocalJsonVectorStore store = new LocalJsonVectorStore(path, 3, "test-v1");
        store.insert(0L, new float[] { 1f, 0f, 0f });
        store.flush();

        IncompatibleIndexException ex = assertThrows(IncompatibleIndexException.class,
                () -> LocalJsonVectorStore.load(path, 3, "test-v2"));
        assertTrue(ex.getMessage().contains("reset"));
    }

    @Test
    void shouldReturnNothingFromEmptyStore() {
        LocalJsonVectorStore store = new LocalJsonVectorStore(tempDir.resolve("s.vectors.json"), 3, "test-v1");

        assertTrue(store.search(new float[] { 1f, 0f, 0f }, 5).isEmpty());
    }

    private static float[] unit(float... values) {
        double norm = 0d;
        for (float value : values) {
            norm += value * value;
        }
        float[] out = new float[values.length];
        for (int i = 0; i < values.length; i++) {
            out[i] = (float) (values[i] / Math.sqrt(norm));
        }
        return out;
    }
}
