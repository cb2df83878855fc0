package com.interviewindex.ingest;

import java.util.List;
import java.util.Map;

import com.interviewindex.policy.IngestAction;
import com.interviewindex.source.SourceType;

/**
 * Outcome of one ingestion run.
 *
 * @param countsByType sources per type that contributed text in this run
 * @param skippedSources urls that could not be fetched or timed out
 * @param unchangedSources urls whose text matched the ledger and were not re-extracted
 * @param failedWrites questions that could not be embedded or written and were rolled back
 */
public record IngestionReport(
        String subject,
        IngestAction action,
        Map<SourceType, Integer> countsByType,
        int questionsAdded,
        int totalQuestions,
        List<String> skippedSources,
        List<String> unchangedSources,
        int failedWrites,
        boolean degraded) {

    public IngestionReport {
        countsByType = Map.copyOf(countsByType);
        skippedSources = List.copyOf(skippedSources);
        unchangedSources = List.copyOf(unchangedSources);
    }
}
