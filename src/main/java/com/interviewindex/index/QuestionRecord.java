package com.interviewindex.index;

import java.time.Instant;
import java.util.List;

/**
 * A persisted interviewer question. Immutable; removed only when its subject is reset.
 * With deduplication off {@code sources} holds exactly one entry.
 */
public record QuestionRecord(
        long id,
        String subjectId,
        String text,
        List<QuestionSource> sources,
        Instant capturedAt) {

    public QuestionRecord {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("question text must not be blank");
        }
        if (sources == null || sources.isEmpty()) {
            throw new IllegalArgumentException("question must carry at least one source");
        }
        sources = List.copyOf(sources);
    }

    public QuestionSource primarySource() {
        return sources.get(0);
    }
}
