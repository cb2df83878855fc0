package com.interviewindex.ingest;

import java.io.IOException;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

/**
 * Calls a JSON embedding endpoint: {@code {"input": text}} in, {@code {"embedding": [...]}} out.
 * Failures surface as {@link EmbeddingUnavailableException}; there is no silent fallback to a
 * different model because vectors from two models must never share an index.
 */
public class ExternalProviderEmbeddingService implements EmbeddingService {
    private static final MediaType JSON = MediaType.parse("application/json");
    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;
    private final String endpoint;
    private final String provider;
    private final String apiKey;
    private final int dimension;

    public ExternalProviderEmbeddingService(OkHttpClient httpClient,
            String endpoint,
            String provider,
            String apiKey,
            int dimension) {
        this.httpClient = httpClient;
        this.mapper = new ObjectMapper();
        this.endpoint = endpoint;
        this.provider = provider;
        this.apiKey = apiKey;
        this.dimension = dimension;
    }

    @Override
    public float[] embed(String text) {
        try {
            String payload = mapper.writeValueAsString(Map.of("input", text));
            Request.Builder requestBuilder = new Request.Builder()
                    .url(endpoint)
                    .post(RequestBody.create(payload, JSON));
            if (apiKey != null && !apiKey.isBlank()) {
                requestBuilder.header("Authorization", "Bearer " + apiKey);
            }
            try (Response response = httpClient.newCall(requestBuilder.build()).execute()) {
                if (!response.isSuccessful() || response.body() == null) {
                    throw new EmbeddingUnavailableException(
                            "Embedding provider " + provider + " returned status " + response.code());
                }
                JsonNode root = mapper.readTree(response.body().string());
                JsonNode vectorNode = root.path("embedding");
                if (!vectorNode.isArray() || vectorNode.size() != dimension) {
                    throw new EmbeddingUnavailableException(
                            "Embedding provider " + provider + " returned no " + dimension + "-d embedding");
                }
                float[] out = new float[vectorNode.size()];
                for (int i = 0; i < vectorNode.size(); i++) {
                    out[i] = (float) vectorNode.get(i).asDouble();
                }
                return EmbeddingServices.normalize(out);
            }
        } catch (IOException e) {
            throw new EmbeddingUnavailableException("Embedding provider " + provider + " unreachable", e);
        }
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public String version() {
        return "external-" + provider + "-" + dimension + "-v1";
    }
}
