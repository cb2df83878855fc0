package com.interviewindex.extract;

import java.time.Instant;

public record RefinementUsageEntry(
        Instant timestamp,
        String subject,
        String sourceUrl,
        int batchSize,
        int outputSize,
        int inputTokens,
        int outputTokens,
        String outcome) {
}
