package com.interviewindex.ingest;

/**
 * Turns text into a fixed-size, unit-normalized vector. Implementations must be deterministic
 * for a given {@link #version()}; vectors written under one version are never compared with
 * vectors from another.
 */
public interface EmbeddingService {
    float[] embed(String text);

    int dimension();

    default String version() {
        return "legacy-v1";
    }
}
