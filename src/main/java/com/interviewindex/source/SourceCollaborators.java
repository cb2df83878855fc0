package com.interviewindex.source;

public record SourceCollaborators(Transcriber transcriber, SourceFetcher fetcher) {
}
