package com.interviewindex.registry;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Iterator;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.interviewindex.runtime.JsonFiles;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-subject rollup persisted as a single JSON object keyed by subject id.
 *
 * <p>An entry that cannot be read is kept verbatim and reported through
 * {@link RegistryCorruptException} until the subject is removed; other subjects are
 * unaffected.
 */
public class EntityRegistry {
    private static final Logger log = LoggerFactory.getLogger(EntityRegistry.class);
    private static final String SUBJECTS = "subjects";

    private final ObjectMapper objectMapper = JsonFiles.mapper();
    private final Map<String, RegistryEntry> entries = new TreeMap<>();
    private final Map<String, JsonNode> corrupt = new TreeMap<>();
    private final Path registryPath;

    private EntityRegistry(Path registryPath) {
        this.registryPath = registryPath;
    }

    public static EntityRegistry load(Path registryPath) throws IOException {
        EntityRegistry registry = new EntityRegistry(registryPath);
        if (!Files.exists(registryPath) || Files.size(registryPath) == 0L) {
            return registry;
        }
        JsonNode root;
        try {
            root = registry.objectMapper.readTree(registryPath.toFile());
        } catch (JsonProcessingException e) {
            throw new RegistryCorruptException("Registry " + registryPath + " is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new RegistryCorruptException("Registry " + registryPath + " must be a JSON object");
        }
        JsonNode subjects = root.path(SUBJECTS);
        Iterator<Map.Entry<String, JsonNode>> fields = subjects.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            try {
                RegistryEntry entry = registry.objectMapper.treeToValue(field.getValue(), RegistryEntry.class);
                if (!field.getKey().equals(entry.subjectId())) {
                    throw new IllegalArgumentException("entry subjectId " + entry.subjectId() + " is filed under " + field.getKey());
                }
                registry.entries.put(field.getKey(), entry);
            } catch (JsonProcessingException | IllegalArgumentException e) {
                registry.corrupt.put(field.getKey(), field.getValue());
                log.error("registry.entry.corrupt subject={} path={}", field.getKey(), registryPath, e);
            }
        }
        log.debug("registry.loaded path={} subjects={} corrupt={}", registryPath, registry.entries.size(), registry.corrupt.size());
        return registry;
    }

    public synchronized Optional<RegistryEntry> get(String subjectId) throws RegistryCorruptException {
        if (corrupt.containsKey(subjectId)) {
            throw new RegistryCorruptException("Registry entry for " + subjectId + " is unreadable; reset the subject");
        }
        return Optional.ofNullable(entries.get(subjectId));
    }

    /**
     * Adds one ingestion run to the subject's rollup and stamps {@code lastIndexedAt = now}.
     */
    public synchronized RegistryEntry upsert(
            String subjectId,
            String displayName,
            SourceCounts deltaCounts,
            long questionsAdded,
            boolean degraded,
            Instant now) throws IOException {
        RegistryEntry current = get(subjectId).orElse(null);
        SourceCounts counts = current == null ? deltaCounts : current.sourceCounts().plus(deltaCounts);
        long questionCount = (current == null ? 0L : current.questionCount()) + questionsAdded;
        IndexStatus status = degraded ? IndexStatus.DEGRADED : questionCount == 0L ? IndexStatus.EMPTY : IndexStatus.READY;
        String name = displayName == null || displayName.isBlank()
                ? current == null ? subjectId : current.displayName()
                : displayName;

        RegistryEntry updated = new RegistryEntry(subjectId, name, now, counts, questionCount, status);
        entries.put(subjectId, updated);
        save();
        log.info("registry.upsert subject={} questions={} status={}", subjectId, questionCount, status);
        return updated;
    }

    public synchronized boolean remove(String subjectId) throws IOException {
        boolean removed = entries.remove(subjectId) != null;
        removed |= corrupt.remove(subjectId) != null;
        if (removed) {
            save();
        }
        return removed;
    }

    public synchronized Map<String, RegistryEntry> entries() {
        return new TreeMap<>(entries);
    }

    public synchronized void flush() throws IOException {
        save();
    }

    private void save() throws IOException {
        ObjectNode root = objectMapper.createObjectNode();
        ObjectNode subjects = root.putObject(SUBJECTS);
        entries.forEach((subjectId, entry) -> subjects.set(subjectId, objectMapper.valueToTree(entry)));
        corrupt.forEach(subjects::set);
        JsonFiles.writeAtomically(objectMapper, registryPath, root);
    }
}
