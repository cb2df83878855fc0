package com.interviewindex.index;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.interviewindex.ingest.HashingEmbeddingService;
import com.interviewindex.source.VideoSource;

class SubjectIndexRepositoryTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");
    private static final List<QuestionSource> SOURCES = List.of(
            QuestionSource.of(new VideoSource("https://video.example/1", "Chat show", null), 42.0));

    private final HashingEmbeddingService embedding = new HashingEmbeddingService(64);

    @TempDir
    Path tempDir;

    @Test
    void shouldPersistRecordsAndIdCounterAcrossRestart() throws Exception {
        SubjectIndexRepository repository = repository("hashing-64-v1");
        SubjectIndex index = repository.open("virat_kohli");
        index.append("What inspired you?", SOURCES, embedding.embed("What inspired you?"), NOW);
        index.append("How do you prepare?", SOURCES, embedding.embed("How do you prepare?"), NOW);
        repository.flushAll();

        SubjectIndex reopened = repository("hashing-64-v1").open("virat_kohli");

        assertNotSame(index, reopened);
        assertEquals(2, reopened.count());
        assertEquals(42.0, reopened.get(1L).orElseThrow().primarySource().mediaTimestampSeconds());
        assertEquals(NOW, reopened.get(0L).orElseThrow().capturedAt());
        assertEquals(2L, reopened.append("Who coached you?", SOURCES, embedding.embed("Who coached you?"), NOW).id());
    }

    @Test
    void shouldDropVectorsWrittenWithoutMetadataOnLoad() throws Exception {
        SubjectIndexRepository repository = repository("hashing-64-v1");
        SubjectIndex index = repository.open("virat_kohli");
        index.append("What inspired you?", SOURCES, embedding.embed("What inspired you?"), NOW);
        index.flush();

        // Simulate a crash after the vector file was written but before the metadata file.
        LocalJsonVectorStore vectors = LocalJsonVectorStore.load(repository.vectorPath("virat_kohli"), 64, "hashing-64-v1");
        vectors.insert(1L, embedding.embed("How do you prepare?"));
        vectors.flush();

        SubjectIndex reopened = repository("hashing-64-v1").open("virat_kohli");

        assertEquals(1, reopened.count());
        assertEquals(1, reopened.vectorCount());
        assertEquals(2L, reopened.append("Who coached you?", SOURCES, embedding.embed("Who coached you?"), NOW).id());
    }

    @Test
    void shouldRefuseIndexBuiltWithDifferentEmbeddingVersion() throws Exception {
        SubjectIndex index = repository("hashing-64-v1").open("virat_kohli");
        index.append("What inspired you?", SOURCES, embedding.embed("What inspired you?"), NOW);
        index.flush();

        assertThrows(IncompatibleIndexException.class, () -> repository("other-64-v1").open("virat_kohli"));
    }

    @Test
    void shouldKeepSubjectsInSeparateFilesAndResetOnlyOne() throws Exception {
        SubjectIndexRepository repository = repository("hashing-64-v1");
        repository.open("virat_kohli").append("What inspired you?", SOURCES, embedding.embed("What inspired you?"), NOW);
        repository.open("ms_dhoni").append("How do you stay calm?", SOURCES, embedding.embed("How do you stay calm?"), NOW);
        repository.flushAll();

        repository.reset("virat_kohli");

        assertFalse(repository.exists("virat_kohli"));
        assertFalse(Files.exists(repository.metadataPath("virat_kohli")));
        assertTrue(repository.exists("ms_dhoni"));
        assertEquals(0, repository.open("virat_kohli").count());
        assertEquals(1, repository.open("ms_dhoni").count());
    }

    private SubjectIndexRepository repository(String version) {
        return new SubjectIndexRepository(tempDir.resolve("index"), 64, version, 2);
    }
}
