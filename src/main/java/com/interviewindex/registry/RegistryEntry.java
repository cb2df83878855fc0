package com.interviewindex.registry;

import java.time.Instant;

/**
 * Rollup of what has been indexed for one subject.
 */
public record RegistryEntry(
        String subjectId,
        String displayName,
        Instant lastIndexedAt,
        SourceCounts sourceCounts,
        long questionCount,
        IndexStatus status) {

    public RegistryEntry {
        if (subjectId == null || subjectId.isBlank()) {
            throw new IllegalArgumentException("subjectId must not be blank");
        }
        if (lastIndexedAt == null) {
            throw new IllegalArgumentException("lastIndexedAt is required");
        }
        if (questionCount < 0) {
            throw new IllegalArgumentException("questionCount must not be negative");
        }
        sourceCounts = sourceCounts == null ? SourceCounts.NONE : sourceCounts;
        status = status == null ? IndexStatus.READY : status;
    }
}
