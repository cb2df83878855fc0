package com.interviewindex.source;

public record AudioReference(String url, SourceType mediaType) {
}
