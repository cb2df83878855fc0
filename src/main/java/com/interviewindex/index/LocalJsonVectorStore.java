package com.interviewindex.index;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.interviewindex.ingest.EmbeddingServices;
import com.interviewindex.runtime.JsonFiles;

/**
 * Vector store kept in memory and persisted as one JSON file. Search is exhaustive, so the
 * ranking is exact.
 */
public class LocalJsonVectorStore implements VectorStore {
    private static final double NORM_TOLERANCE = 1e-3;

    private final Map<Long, float[]> vectors = new LinkedHashMap<>();
    private final ObjectMapper objectMapper = JsonFiles.mapper();
    private final Path path;
    private final int dimension;
    private final String embeddingVersion;

    public LocalJsonVectorStore(Path path, int dimension, String embeddingVersion) {
        this.path = path;
        this.dimension = dimension;
        this.embeddingVersion = embeddingVersion;
    }

    @Override
    public void insert(long id, float[] vector) {
        if (vector == null || vector.length != dimension) {
            throw new IllegalArgumentException("expected a " + dimension + "-d vector for id " + id);
        }
        double norm = EmbeddingServices.norm(vector);
        if (Math.abs(norm - 1d) > NORM_TOLERANCE) {
            throw new IllegalArgumentException("vector for id " + id + " is not unit-normalized (norm=" + norm + ")");
        }
        if (vectors.containsKey(id)) {
            throw new IllegalStateException("vector id " + id + " already written");
        }
        vectors.put(id, vector.clone());
    }

    @Override
    public boolean remove(long id) {
        return vectors.remove(id) != null;
    }

    @Override
    public List<VectorHit> search(float[] queryVector, int overK) {
        if (overK <= 0 || vectors.isEmpty()) {
            return List.of();
        }
        return vectors.entrySet().stream()
                .map(entry -> new VectorHit(entry.getKey(), dot(queryVector, entry.getValue())))
                .sorted(Comparator.comparing(VectorHit::score).reversed().thenComparing(VectorHit::id))
                .limit(overK)
                .toList();
    }

    @Override
    public int count() {
        return vectors.size();
    }

    @Override
    public Set<Long> ids() {
        return new LinkedHashSet<>(vectors.keySet());
    }

    @Override
    public int dimension() {
        return dimension;
    }

    public String embeddingVersion() {
        return embeddingVersion;
    }

    @Override
    public void flush() throws IOException {
        List<StoredVector> stored = new ArrayList<>(vectors.size());
        vectors.forEach((id, vector) -> stored.add(new StoredVector(id, vector)));
        JsonFiles.writeAtomically(objectMapper, path, new StoredVectors(embeddingVersion, dimension, stored));
    }

    public static LocalJsonVectorStore load(Path path, int dimension, String embeddingVersion) throws IOException {
        LocalJsonVectorStore store = new LocalJsonVectorStore(path, dimension, embeddingVersion);
        if (!Files.exists(path)) {
            return store;
        }
        StoredVectors loaded = store.objectMapper.readValue(path.toFile(), StoredVectors.class);
        if (!embeddingVersion.equals(loaded.embeddingVersion()) || loaded.dimension() != dimension) {
            throw new IncompatibleIndexException("Index " + path + " was built with " + loaded.embeddingVersion()
                    + "/" + loaded.dimension() + "d but the active model is " + embeddingVersion + "/" + dimension
                    + "d; reset the subject to re-index it");
        }
        for (StoredVector entry : loaded.vectors()) {
            store.vectors.put(entry.id(), entry.vector());
        }
        return store;
    }

    private static float dot(float[] a, float[] b) {
        int len = Math.min(a.length, b.length);
        double sum = 0d;
        for (int i = 0; i < len; i++) {
            sum += a[i] * b[i];
        }
        return (float) Math.max(-1d, Math.min(1d, sum));
    }

    public record StoredVectors(String embeddingVersion, int dimension, List<StoredVector> vectors) {
        public StoredVectors {
            vectors = vectors == null ? List.of() : vectors;
        }
    }

    public record StoredVector(long id, float[] vector) {
    }
}
