package com.interviewindex.source;

/**
 * A source could not be fetched or transcribed. Ingestion skips the source and carries on.
 */
public class SourceUnavailableException extends Exception {
    private final String sourceUrl;

    public SourceUnavailableException(String sourceUrl, String message) {
        super(message);
        this.sourceUrl = sourceUrl;
    }

    public SourceUnavailableException(String sourceUrl, String message, Throwable cause) {
        super(message, cause);
        this.sourceUrl = sourceUrl;
    }

    public String sourceUrl() {
        return sourceUrl;
    }
}
