package com.interviewindex.policy;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import com.interviewindex.registry.RegistryEntry;

/**
 * Rule table, first match wins: no entry, zero questions, force, fresh, stale.
 */
public class FreshnessDecisionPolicy implements DecisionPolicy {

    @Override
    public Decision decide(Optional<RegistryEntry> entry, boolean force, Duration freshnessWindow, Instant now) {
        if (entry.isEmpty()) {
            return new Decision(IngestAction.INGEST, "no prior data");
        }
        RegistryEntry current = entry.get();
        if (current.questionCount() == 0L) {
            return new Decision(IngestAction.INGEST,
                    "prior ingestion at " + current.lastIndexedAt() + " produced no questions");
        }
        if (force) {
            return new Decision(IngestAction.INGEST,
                    "forced re-ingest over " + current.questionCount() + " existing questions");
        }
        Instant freshUntil = current.lastIndexedAt().plus(freshnessWindow);
        if (now.isBefore(freshUntil)) {
            return new Decision(IngestAction.RETRIEVE,
                    "indexed at " + current.lastIndexedAt() + " with " + current.questionCount()
                            + " questions, fresh until " + freshUntil);
        }
        return new Decision(IngestAction.INCREMENTAL_INGEST,
                "indexed at " + current.lastIndexedAt() + ", stale since " + freshUntil);
    }
}
