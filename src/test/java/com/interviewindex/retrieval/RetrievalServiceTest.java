package com.interviewindex.retrieval;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.interviewindex.index.JsonMetadataStore;
import com.interviewindex.index.LocalJsonVectorStore;
import com.interviewindex.index.QuestionSource;
import com.interviewindex.index.SubjectIndex;
import com.interviewindex.index.VectorHit;
import com.interviewindex.ingest.EmbeddingService;
import com.interviewindex.ingest.EmbeddingUnavailableException;
import com.interviewindex.ingest.LocalModelEmbeddingService;
import com.interviewindex.source.VideoSource;

class RetrievalServiceTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");
    private static final List<QuestionSource> SOURCES = List.of(
            QuestionSource.of(new VideoSource("https://video.example/1", "Chat show", null), 30.0));
    private static final List<String> QUESTIONS = List.of(
            "What inspired you to become an actor?",
            "How do you prepare for a difficult role?",
            "Who was your biggest influence growing up?",
            "Why did you turn down the superhero franchise?");

    private final EmbeddingService embedding = new LocalModelEmbeddingService(384);

    @TempDir
    Path tempDir;

    private RecordingVectorStore vectors;
    private SubjectIndex index;

    @BeforeEach
    void setUp() {
        vectors = new RecordingVectorStore(tempDir.resolve("v.json"));
        index = new SubjectIndex("subject", vectors, new JsonMetadataStore(tempDir.resolve("m.json"), "subject"), 2);
        for (String question : QUESTIONS) {
            index.append(question, SOURCES, embedding.embed(question), NOW);
        }
    }

    @Test
    void shouldReturnStoredQuestionFirstWithSelfSimilarity() {
        List<QuestionMatch> matches = new RetrievalService(embedding, 4)
                .retrieve(index, "How do you prepare for a difficult role?", 3, 0.5);

        assertEquals("How do you prepare for a difficult role?", matches.get(0).record().text());
        assertEquals(1.0f, matches.get(0).score(), 1e-3f);
        assertEquals(30.0, matches.get(0).record().primarySource().mediaTimestampSeconds());
    }

    @Test
    void shouldOverFetchByConfiguredFactor() {
        new RetrievalService(embedding, 4).retrieve(index, "What inspired you?", 1, 0.5);

        assertEquals(4, vectors.lastOverK);
    }

    @Test
    void shouldCapOverFetchInsteadOfOverflowingForHugeTopK() {
        List<QuestionMatch> matches = new RetrievalService(embedding, 4).retrieve(index, QUESTIONS.get(3), 600_000_000, 0.5);

        assertEquals(Integer.MAX_VALUE, vectors.lastOverK);
        assertEquals(QUESTIONS.get(3), matches.get(0).record().text());
        assertEquals(1.0f, matches.get(0).score(), 1e-3f);
    }

    @Test
    void shouldReturnNothingAboveImpossibleThreshold() {
        assertTrue(new RetrievalService(embedding, 4).retrieve(index, QUESTIONS.get(0), 5, 1.01).isEmpty());
    }

    @Test
    void shouldNeverPadResultsToTopK() {
        List<QuestionMatch> everything = new RetrievalService(embedding, 4).retrieve(index, QUESTIONS.get(1), 10, -1.0);
        List<QuestionMatch> strict = new RetrievalService(embedding, 4).retrieve(index, QUESTIONS.get(1), 10, 0.99);

        assertEquals(QUESTIONS.size(), everything.size());
        assertEquals(1, strict.size());
        for (int i = 1; i < everything.size(); i++) {
            assertTrue(everything.get(i - 1).score() >= everything.get(i).score());
        }
    }

    @Test
    void shouldRejectNonPositiveTopK() {
        assertThrows(IllegalArgumentException.class,
                () -> new RetrievalService(embedding, 4).retrieve(index, QUESTIONS.get(0), 0, 0.5));
    }

    @Test
    void shouldReturnEmptyForMissingIndex() {
        assertTrue(new RetrievalService(embedding, 4).retrieve(null, QUESTIONS.get(0), 5, 0.5).isEmpty());
    }

    @Test
    void shouldRaiseQueryEmbeddingFailureForThisCallOnly() {
        EmbeddingService broken = new EmbeddingService() {
            @Override
            public float[] embed(String text) {
                throw new EmbeddingUnavailableException("provider returned HTTP 503");
            }

            @Override
            public int dimension() {
                return 384;
            }
        };

        assertThrows(QueryEmbeddingException.class,
                () -> new RetrievalService(broken, 4).retrieve(index, QUESTIONS.get(0), 5, 0.5));
        assertEquals(1, new RetrievalService(embedding, 4).retrieve(index, QUESTIONS.get(0), 1, 0.5).size());
    }

    @Test
    void shouldExplainEachOutcome() {
        RetrievalService retrieval = new RetrievalService(embedding, 4);
        SubjectIndex empty = new SubjectIndex("empty", new LocalJsonVectorStore(tempDir.resolve("e.json"), 384, "x"),
                new JsonMetadataStore(tempDir.resolve("em.json"), "empty"), 2);

        assertEquals(NoMatchExplanation.Reason.NO_INDEX, retrieval.explain(null, "anything?", 0.5).reason());
        assertEquals(NoMatchExplanation.Reason.EMPTY_INDEX, retrieval.explain(empty, "anything?", 0.5).reason());

        NoMatchExplanation below = retrieval.explain(index, QUESTIONS.get(2), 1.01);
        assertEquals(NoMatchExplanation.Reason.BELOW_THRESHOLD, below.reason());
        assertEquals(QUESTIONS.get(2), below.closest().text());

        NoMatchExplanation matched = retrieval.explain(index, QUESTIONS.get(2), 0.5);
        assertEquals(NoMatchExplanation.Reason.MATCHED, matched.reason());
        assertNull(retrieval.explain(null, "anything?", 0.5).closest());
    }

    private static final class RecordingVectorStore extends LocalJsonVectorStore {
        private int lastOverK;

        private RecordingVectorStore(Path path) {
            super(path, 384, "local-question-v1-384");
        }

        @Override
        public List<VectorHit> search(float[] queryVector, int overK) {
            lastOverK = overK;
            return super.search(queryVector, overK);
        }
    }
}
