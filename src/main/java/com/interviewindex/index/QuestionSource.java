package com.interviewindex.index;

import com.interviewindex.source.InterviewSource;
import com.interviewindex.source.SourceType;

/**
 * Where a question was asked. {@code mediaTimestampSeconds} is the offset into the video or
 * audio and {@code null} for articles.
 */
public record QuestionSource(
        SourceType sourceType,
        String sourceUrl,
        String sourceTitle,
        Double mediaTimestampSeconds,
        String publishedDate) {

    public static QuestionSource of(InterviewSource source, Double mediaTimestampSeconds) {
        return new QuestionSource(source.type(), source.url(), source.title(), mediaTimestampSeconds,
                source.publishedDate());
    }
}
