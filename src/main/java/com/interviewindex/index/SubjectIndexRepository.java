package com.interviewindex.index;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Opens, caches and resets per-subject partitions under one directory.
 */
public class SubjectIndexRepository {
    private static final Logger log = LoggerFactory.getLogger(SubjectIndexRepository.class);

    private final Map<String, SubjectIndex> open = new HashMap<>();
    private final Path indexDir;
    private final int dimension;
    private final String embeddingVersion;
    private final int metadataWriteRetries;

    public SubjectIndexRepository(Path indexDir, int dimension, String embeddingVersion, int metadataWriteRetries) {
        this.indexDir = indexDir;
        this.dimension = dimension;
        this.embeddingVersion = embeddingVersion;
        this.metadataWriteRetries = metadataWriteRetries;
    }

    public synchronized SubjectIndex open(String subjectKey) throws IOException {
        SubjectIndex existing = open.get(subjectKey);
        if (existing != null) {
            return existing;
        }
        LocalJsonVectorStore vectors = LocalJsonVectorStore.load(vectorPath(subjectKey), dimension, embeddingVersion);
        JsonMetadataStore metadata = JsonMetadataStore.load(metadataPath(subjectKey), subjectKey);
        SubjectIndex index = new SubjectIndex(subjectKey, vectors, metadata, metadataWriteRetries);
        int dropped = index.reconcile();
        if (dropped > 0) {
            index.flush();
            log.warn("index.reconciled subject={} dropped={}", subjectKey, dropped);
        }
        open.put(subjectKey, index);
        log.debug("index.opened subject={} records={}", subjectKey, index.count());
        return index;
    }

    /**
     * True when a partition exists on disk or has been opened in this process.
     */
    public synchronized boolean exists(String subjectKey) {
        return open.containsKey(subjectKey) || Files.exists(vectorPath(subjectKey)) || Files.exists(metadataPath(subjectKey));
    }

    public synchronized void reset(String subjectKey) throws IOException {
        open.remove(subjectKey);
        Files.deleteIfExists(vectorPath(subjectKey));
        Files.deleteIfExists(metadataPath(subjectKey));
        log.info("index.reset subject={}", subjectKey);
    }

    public void flushAll() throws IOException {
        List<SubjectIndex> loaded;
        synchronized (this) {
            loaded = new ArrayList<>(open.values());
        }
        for (SubjectIndex index : loaded) {
            index.flush();
        }
    }

    public Path vectorPath(String subjectKey) {
        return indexDir.resolve(Subjects.fileName(subjectKey) + ".vectors.json");
    }

    public Path metadataPath(String subjectKey) {
        return indexDir.resolve(Subjects.fileName(subjectKey) + ".metadata.json");
    }

    public String embeddingVersion() {
        return embeddingVersion;
    }
}
