package com.interviewindex.ingest;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class LocalModelEmbeddingServiceTest {

    private final LocalModelEmbeddingService embedding = new LocalModelEmbeddingService(384);

    @Test
    void shouldProduceDeterministicUnitVectors() {
        float[] first = embedding.embed("How do you prepare for a difficult role?");
        float[] second = embedding.embed("How do you prepare for a difficult role?");

        assertArrayEquals(first, second);
        assertEquals(384, first.length);
        assertEquals(1.0, EmbeddingServices.norm(first), 1e-3);
    }

    @Test
    void shouldPlaceParaphrasesCloserThanUnrelatedQuestions() {
        float[] query = embedding.embed("How do you prepare for a role?");
        double paraphrase = dot(query, embedding.embed("How did you prepare for that role?"));
        double unrelated = dot(query, embedding.embed("Who won the cricket final?"));

        assertTrue(paraphrase > unrelated);
    }

    @Test
    void shouldTagVersionWithDimension() {
        assertEquals("local-question-v1-384", embedding.version());
        assertNotEquals(embedding.version(), new LocalModelEmbeddingService(128).version());
        assertNotEquals(embedding.version(), new HashingEmbeddingService(384).version());
    }

    private static double dot(float[] a, float[] b) {
        double sum = 0d;
        for (int i = 0; i < a.length; i++) {
            sum += a[i] * b[i];
        }
        return sum;
    }
}
