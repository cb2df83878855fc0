package com.interviewindex.index;

import java.io.IOException;
import java.util.List;
import java.util.Set;

/**
 * Append-only store of unit-normalized vectors for one subject.
 */
public interface VectorStore {
    void insert(long id, float[] vector);

    /**
     * Removes a vector whose metadata write failed. Not a general delete.
     */
    boolean remove(long id);

    /**
     * Up to {@code overK} hits ordered by descending inner product.
     */
    List<VectorHit> search(float[] queryVector, int overK);

    int count();

    Set<Long> ids();

    int dimension();

    void flush() throws IOException;
}
