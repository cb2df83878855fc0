package com.interviewindex.index;

import java.io.IOException;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Question metadata for one subject, keyed by the ids shared with its {@link VectorStore}.
 * Owns the subject's id counter.
 */
public interface MetadataStore {
    /**
     * Reserves the next id. Reserved ids are never handed out again, even if nothing is
     * written under them.
     */
    long allocateId();

    /**
     * Raises the counter so the next allocated id is greater than {@code id}.
     */
    void ensureNextIdAbove(long id);

    /**
     * Writes {@code record} under {@code id}; each id may be written once.
     */
    void put(long id, QuestionRecord record);

    Optional<QuestionRecord> get(long id);

    /**
     * Drops an entry with no matching vector. Used only while reconciling after a crash.
     */
    boolean discard(long id);

    int count();

    Set<Long> ids();

    List<QuestionRecord> all();

    void flush() throws IOException;
}
