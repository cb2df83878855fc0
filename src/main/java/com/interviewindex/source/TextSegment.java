package com.interviewindex.source;

/**
 * A run of source text. {@code startSeconds} is the media offset for transcript segments and
 * {@code null} for articles.
 */
public record TextSegment(Double startSeconds, String text) {
}
