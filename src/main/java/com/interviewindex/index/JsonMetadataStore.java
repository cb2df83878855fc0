package com.interviewindex.index;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.interviewindex.runtime.JsonFiles;

public class JsonMetadataStore implements MetadataStore {
    private final TreeMap<Long, QuestionRecord> records = new TreeMap<>();
    private final ObjectMapper objectMapper = JsonFiles.mapper();
    private final Path path;
    private final String subjectId;
    private long nextId;

    public JsonMetadataStore(Path path, String subjectId) {
        this.path = path;
        this.subjectId = subjectId;
    }

    @Override
    public long allocateId() {
        return nextId++;
    }

    @Override
    public void ensureNextIdAbove(long id) {
        nextId = Math.max(nextId, id + 1);
    }

    @Override
    public void put(long id, QuestionRecord record) {
        if (record.id() != id) {
            throw new IllegalArgumentException("record id " + record.id() + " does not match slot " + id);
        }
        if (records.containsKey(id)) {
            throw new IllegalStateException("metadata id " + id + " already written");
        }
        records.put(id, record);
    }

    @Override
    public Optional<QuestionRecord> get(long id) {
        return Optional.ofNullable(records.get(id));
    }

    @Override
    public boolean discard(long id) {
        return records.remove(id) != null;
    }

    @Override
    public int count() {
        return records.size();
    }

    @Override
    public Set<Long> ids() {
        return new TreeSet<>(records.keySet());
    }

    @Override
    public List<QuestionRecord> all() {
        return new ArrayList<>(records.values());
    }

    public long nextId() {
        return nextId;
    }

    @Override
    public void flush() throws IOException {
        JsonFiles.writeAtomically(objectMapper, path, new StoredMetadata(subjectId, nextId, all()));
    }

    public static JsonMetadataStore load(Path path, String subjectId) throws IOException {
        JsonMetadataStore store = new JsonMetadataStore(path, subjectId);
        if (!Files.exists(path)) {
            return store;
        }
        StoredMetadata loaded = store.objectMapper.readValue(path.toFile(), StoredMetadata.class);
        for (QuestionRecord record : loaded.records()) {
            store.records.put(record.id(), record);
            store.ensureNextIdAbove(record.id());
        }
        store.nextId = Math.max(store.nextId, loaded.nextId());
        return store;
    }

    public record StoredMetadata(String subjectId, long nextId, List<QuestionRecord> records) {
        public StoredMetadata {
            records = records == null ? List.of() : records;
        }
    }
}
