package com.interviewindex.ingest;

import java.util.Locale;
import java.util.Set;

/**
 * Offline embedding built from hashed tokens and character trigrams. Interrogative and
 * filler words are down-weighted so that two questions about the same topic land close
 * together even when they are phrased differently.
 */
public class LocalModelEmbeddingService implements EmbeddingService {
    private static final String VERSION = "local-question-v1";
    private static final Set<String> FUNCTION_WORDS = Set.of(
            "what", "why", "how", "when", "where", "who", "which", "would", "could", "can",
            "do", "does", "did", "is", "are", "was", "were", "you", "your", "the", "a", "an",
            "to", "of", "in", "on", "for", "and", "that", "it", "me", "tell", "about");

    private final int dimension;

    public LocalModelEmbeddingService(int dimension) {
        this.dimension = dimension;
    }

    @Override
    public float[] embed(String text) {
        float[] vector = new float[dimension];
        if (text == null || text.isBlank()) {
            return vector;
        }

        String normalized = text.toLowerCase(Locale.ROOT);
        String[] tokens = normalized.split("\\W+");
        for (String token : tokens) {
            if (token.isBlank()) {
                continue;
            }
            float weight = FUNCTION_WORDS.contains(token) ? 0.25f : 1.0f;
            addHashed(vector, "tok:" + token, weight);
            if (token.length() >= 3) {
                for (int i = 0; i <= token.length() - 3; i++) {
                    addHashed(vector, "tri:" + token.substring(i, i + 3), 0.35f * weight);
                }
            }
        }

        return EmbeddingServices.normalize(vector);
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public String version() {
        return VERSION + "-" + dimension;
    }

    private void addHashed(float[] vector, String key, float weight) {
        int index = Math.floorMod(key.hashCode(), vector.length);
        vector[index] += weight;
    }
}
