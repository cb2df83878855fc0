package com.interviewindex.ingest;

import okhttp3.OkHttpClient;

public final class EmbeddingServices {
    private EmbeddingServices() {
    }

    public static EmbeddingService fromEnvironment(OkHttpClient httpClient, int dimension) {
        String endpoint = System.getenv("INTERVIEW_INDEX_EMBEDDING_URL");
        if (endpoint == null || endpoint.isBlank()) {
            return new LocalModelEmbeddingService(dimension);
        }
        String provider = System.getenv().getOrDefault("INTERVIEW_INDEX_EMBEDDING_PROVIDER", "custom");
        String apiKey = System.getenv("INTERVIEW_INDEX_API_KEY");
        return new ExternalProviderEmbeddingService(httpClient, endpoint, provider, apiKey, dimension);
    }

    /**
     * Scales {@code vector} in place to unit L2 norm. Zero vectors are left untouched.
     */
    public static float[] normalize(float[] vector) {
        double norm = 0d;
        for (float value : vector) {
            norm += value * value;
        }
        norm = Math.sqrt(norm);
        if (norm <= 0d) {
            return vector;
        }
        for (int i = 0; i < vector.length; i++) {
            vector[i] = (float) (vector[i] / norm);
        }
        return vector;
    }

    public static double norm(float[] vector) {
        double sum = 0d;
        for (float value : vector) {
            sum += value * value;
        }
        return Math.sqrt(sum);
    }
}
