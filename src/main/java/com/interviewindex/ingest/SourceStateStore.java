package com.interviewindex.ingest;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.interviewindex.index.Subjects;
import com.interviewindex.runtime.JsonFiles;

/**
 * Per-subject ledger of {@code sourceUrl -> fingerprint} from the last run that read each
 * source.
 */
public class SourceStateStore {
    private final ObjectMapper mapper = JsonFiles.mapper();
    private final Path directory;

    public SourceStateStore(Path directory) {
        this.directory = directory;
    }

    public Map<String, String> load(String subjectKey) throws IOException {
        Path path = path(subjectKey);
        if (!Files.exists(path)) {
            return new HashMap<>();
        }
        return mapper.readValue(path.toFile(), new TypeReference<Map<String, String>>() {
        });
    }

    public void save(String subjectKey, Map<String, String> state) throws IOException {
        JsonFiles.writeAtomically(mapper, path(subjectKey), state);
    }

    public boolean delete(String subjectKey) throws IOException {
        return Files.deleteIfExists(path(subjectKey));
    }

    public Path path(String subjectKey) {
        return directory.resolve(Subjects.fileName(subjectKey) + ".json");
    }
}
