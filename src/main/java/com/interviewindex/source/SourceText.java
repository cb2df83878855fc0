package com.interviewindex.source;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Raw text produced by a source, kept as ordered segments so transcript timestamps survive
 * into extraction.
 */
public record SourceText(InterviewSource source, List<TextSegment> segments) {

    public SourceText {
        segments = segments == null ? List.of() : List.copyOf(segments);
    }

    public String fullText() {
        return segments.stream()
                .map(TextSegment::text)
                .filter(text -> text != null && !text.isBlank())
                .collect(Collectors.joining("\n"));
    }

    /**
     * SHA-256 of the full text; incremental ingestion compares it with the ledger to decide
     * whether a source changed since the last run.
     */
    public String fingerprint() {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(fullText().getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }

    static void requireUrl(String url) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("source url must not be blank");
        }
    }
}
