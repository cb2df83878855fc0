package com.interviewindex.source;

public interface SourceFetcher {
    /**
     * Returns the plain text behind {@code urlOrFeed}.
     */
    String fetch(String urlOrFeed) throws SourceUnavailableException;
}
