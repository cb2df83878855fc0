package com.interviewindex.extract;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

/**
 * Posts {@code {"candidates": [...]}} and expects {@code {"questions": [...], "usage":
 * {"input_tokens": n, "output_tokens": m}}}. When the service reports no usage the token
 * counts are estimated from whitespace-separated words.
 */
public class ExternalProviderQuestionRefiner implements QuestionRefiner {
    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();
    private final String endpoint;
    private final String apiKey;

    public ExternalProviderQuestionRefiner(OkHttpClient httpClient, String endpoint, String apiKey) {
        this.httpClient = httpClient;
        this.endpoint = endpoint;
        this.apiKey = apiKey;
    }

    @Override
    public RefinementResult refine(List<String> batch) throws RefinementException {
        try {
            String payload = mapper.writeValueAsString(Map.of("candidates", batch));
            Request.Builder requestBuilder = new Request.Builder()
                    .url(endpoint)
                    .post(RequestBody.create(payload, JSON));
            if (apiKey != null && !apiKey.isBlank()) {
                requestBuilder.header("Authorization", "Bearer " + apiKey);
            }
            try (Response response = httpClient.newCall(requestBuilder.build()).execute()) {
                if (!response.isSuccessful() || response.body() == null) {
                    throw new RefinementException("Refinement service returned HTTP " + response.code());
                }
                return parse(mapper.readTree(response.body().string()), batch);
            }
        } catch (IOException e) {
            throw new RefinementException("Refinement service unreachable", e);
        }
    }

    static RefinementResult parse(JsonNode root, List<String> batch) throws RefinementException {
        JsonNode questionNodes = root.path("questions");
        if (!questionNodes.isArray()) {
            throw new RefinementException("Refinement response has no questions array");
        }
        List<String> questions = new ArrayList<>();
        for (JsonNode node : questionNodes) {
            questions.add(node.asText(""));
        }
        JsonNode usage = root.path("usage");
        int inputTokens = usage.has("input_tokens") ? usage.get("input_tokens").asInt() : estimateTokens(batch);
        int outputTokens = usage.has("output_tokens") ? usage.get("output_tokens").asInt() : estimateTokens(questions);
        return new RefinementResult(questions, inputTokens, outputTokens);
    }

    static int estimateTokens(List<String> texts) {
        return texts.stream()
                .filter(text -> text != null && !text.isBlank())
                .mapToInt(text -> text.strip().split("\\s+").length)
                .sum();
    }
}
