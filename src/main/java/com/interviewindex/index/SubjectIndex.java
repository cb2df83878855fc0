package com.interviewindex.index;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * One subject's partition: a vector store and a metadata store that share an id space.
 *
 * <p>Every completed {@link #append} leaves both stores holding the same ids. Appends hold the
 * write lock for the whole allocate/insert/put sequence, so searches under the read lock never
 * see an id that exists in only one store.
 */
public class SubjectIndex {
    private static final Logger log = LoggerFactory.getLogger(SubjectIndex.class);

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final String subjectId;
    private final VectorStore vectorStore;
    private final MetadataStore metadataStore;
    private final int metadataWriteRetries;

    public SubjectIndex(String subjectId, VectorStore vectorStore, MetadataStore metadataStore, int metadataWriteRetries) {
        this.subjectId = subjectId;
        this.vectorStore = vectorStore;
        this.metadataStore = metadataStore;
        this.metadataWriteRetries = Math.max(0, metadataWriteRetries);
    }

    public String subjectId() {
        return subjectId;
    }

    public QuestionRecord append(String text, List<QuestionSource> sources, float[] vector, Instant capturedAt) {
        lock.writeLock().lock();
        try {
            long id = metadataStore.allocateId();
            QuestionRecord record;
            try {
                record = new QuestionRecord(id, subjectId, text, sources, capturedAt);
                vectorStore.insert(id, vector);
            } catch (RuntimeException e) {
                throw new IndexWriteException(subjectId, id, "vector write failed", e);
            }

            RuntimeException lastFailure = null;
            for (int attempt = 0; attempt <= metadataWriteRetries; attempt++) {
                try {
                    metadataStore.put(id, record);
                    return record;
                } catch (RuntimeException e) {
                    lastFailure = e;
                    log.warn("index.metadata.write.failed subject={} id={} attempt={}", subjectId, id, attempt + 1, e);
                }
            }

            vectorStore.remove(id);
            log.error("index.write.rolled_back subject={} id={}", subjectId, id);
            throw new IndexWriteException(subjectId, id, "metadata write failed, vector rolled back", lastFailure);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public List<ScoredRecord> search(float[] queryVector, int overK) {
        lock.readLock().lock();
        try {
            List<ScoredRecord> joined = new ArrayList<>();
            for (VectorHit hit : vectorStore.search(queryVector, overK)) {
                metadataStore.get(hit.id()).ifPresent(record -> joined.add(new ScoredRecord(record, hit.score())));
            }
            return joined;
        } finally {
            lock.readLock().unlock();
        }
    }

    public Optional<QuestionRecord> get(long id) {
        lock.readLock().lock();
        try {
            return metadataStore.get(id);
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<QuestionRecord> records() {
        lock.readLock().lock();
        try {
            return metadataStore.all();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int count() {
        lock.readLock().lock();
        try {
            return metadataStore.count();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int vectorCount() {
        lock.readLock().lock();
        try {
            return vectorStore.count();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int dimension() {
        return vectorStore.dimension();
    }

    /**
     * Writes vectors before metadata; a crash in between leaves orphan vectors that
     * {@link #reconcile()} drops on the next load.
     */
    public void flush() throws IOException {
        lock.writeLock().lock();
        try {
            vectorStore.flush();
            metadataStore.flush();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Drops ids found in only one store and moves the id counter past every id seen.
     *
     * @return number of orphan entries dropped
     */
    public int reconcile() {
        lock.writeLock().lock();
        try {
            Set<Long> vectorIds = vectorStore.ids();
            Set<Long> metadataIds = metadataStore.ids();
            Set<Long> seen = new HashSet<>(vectorIds);
            seen.addAll(metadataIds);
            seen.stream().mapToLong(Long::longValue).max().ifPresent(metadataStore::ensureNextIdAbove);

            int dropped = 0;
            for (Long id : vectorIds) {
                if (!metadataIds.contains(id)) {
                    vectorStore.remove(id);
                    dropped++;
                    log.warn("index.orphan.vector.dropped subject={} id={}", subjectId, id);
                }
            }
            for (Long id : metadataIds) {
                if (!vectorIds.contains(id)) {
                    metadataStore.discard(id);
                    dropped++;
                    log.warn("index.orphan.metadata.dropped subject={} id={}", subjectId, id);
                }
            }
            return dropped;
        } finally {
            lock.writeLock().unlock();
        }
    }
}
