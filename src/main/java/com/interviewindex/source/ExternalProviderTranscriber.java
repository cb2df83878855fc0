package com.interviewindex.source;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;

/**
 * Delegates download and transcription to an HTTP service. Request:
 * {@code {"url": ..., "media_type": "video"}}. Response: {@code {"segments": [{"start": 12.5,
 * "text": "..."}]}} or, without segment timing, {@code {"text": "..."}}.
 */
public class ExternalProviderTranscriber implements Transcriber {
    private static final MediaType JSON = MediaType.parse("application/json");

    private final OkHttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();
    private final String endpoint;
    private final String apiKey;

    public ExternalProviderTranscriber(OkHttpClient httpClient, String endpoint, String apiKey) {
        this.httpClient = httpClient;
        this.endpoint = endpoint;
        this.apiKey = apiKey;
    }

    @Override
    public Transcript transcribe(AudioReference audio) throws SourceUnavailableException {
        try {
            String payload = mapper.writeValueAsString(Map.of(
                    "url", audio.url(),
                    "media_type", audio.mediaType().name().toLowerCase(Locale.ROOT)));
            Request.Builder requestBuilder = new Request.Builder()
                    .url(endpoint)
                    .post(RequestBody.create(payload, JSON));
            if (apiKey != null && !apiKey.isBlank()) {
                requestBuilder.header("Authorization", "Bearer " + apiKey);
            }
            try (Response response = httpClient.newCall(requestBuilder.build()).execute()) {
                if (!response.isSuccessful() || response.body() == null) {
                    throw new SourceUnavailableException(audio.url(),
                            "Transcription failed with HTTP " + response.code());
                }
                return parse(mapper.readTree(response.body().string()));
            }
        } catch (IOException e) {
            throw new SourceUnavailableException(audio.url(), "Transcription service unreachable", e);
        }
    }

    static Transcript parse(JsonNode root) {
        List<TextSegment> segments = new ArrayList<>();
        JsonNode segmentNodes = root.path("segments");
        if (segmentNodes.isArray() && segmentNodes.size() > 0) {
            for (JsonNode node : segmentNodes) {
                Double start = node.hasNonNull("start") ? node.get("start").asDouble() : null;
                segments.add(new TextSegment(start, node.path("text").asText("")));
            }
        } else {
            segments.add(new TextSegment(null, root.path("text").asText("")));
        }
        return new Transcript(segments);
    }
}
