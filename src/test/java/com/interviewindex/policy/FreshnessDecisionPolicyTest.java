package com.interviewindex.policy;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import org.junit.jupiter.api.Test;

import com.interviewindex.registry.IndexStatus;
import com.interviewindex.registry.RegistryEntry;
import com.interviewindex.registry.SourceCounts;

class FreshnessDecisionPolicyTest {

    private static final Duration WINDOW = Duration.ofDays(30);
    private static final Instant INDEXED = Instant.parse("2024-05-01T10:00:00Z");

    private final FreshnessDecisionPolicy policy = new FreshnessDecisionPolicy();

    @Test
    void shouldIngestColdStartWithNoPriorDataReason() {
        Decision decision = policy.decide(Optional.empty(), false, WINDOW, INDEXED);

        assertEquals(IngestAction.INGEST, decision.action());
        assertEquals("no prior data", decision.reason());
    }

    @Test
    void shouldIngestWhenPriorRunFoundNothingEvenIfFresh() {
        Decision decision = policy.decide(Optional.of(entry(0)), false, WINDOW, INDEXED.plus(Duration.ofHours(1)));

        assertEquals(IngestAction.INGEST, decision.action());
    }

    @Test
    void shouldIngestWhenForced() {
        Decision decision = policy.decide(Optional.of(entry(12)), true, WINDOW, INDEXED.plus(Duration.ofHours(1)));

        assertEquals(IngestAction.INGEST, decision.action());
    }

    @Test
    void shouldRetrieveInsideFreshnessWindow() {
        Decision decision = policy.decide(Optional.of(entry(12)), false, WINDOW, INDEXED.plus(Duration.ofDays(29)));

        assertEquals(IngestAction.RETRIEVE, decision.action());
    }

    @Test
    void shouldIncrementallyIngestOnceStale() {
        Decision atBoundary = policy.decide(Optional.of(entry(12)), false, WINDOW, INDEXED.plus(WINDOW));
        Decision later = policy.decide(Optional.of(entry(12)), false, WINDOW, INDEXED.plus(Duration.ofDays(90)));

        assertEquals(IngestAction.INCREMENTAL_INGEST, atBoundary.action());
        assertEquals(IngestAction.INCREMENTAL_INGEST, later.action());
    }

    @Test
    void shouldGiveIdenticalReasonForUnchangedState() {
        Optional<RegistryEntry> entry = Optional.of(entry(12));

        Decision first = policy.decide(entry, false, WINDOW, INDEXED.plus(Duration.ofDays(1)));
        Decision second = policy.decide(entry, false, WINDOW, INDEXED.plus(Duration.ofDays(2)));

        assertEquals(first, second);
    }

    private static RegistryEntry entry(long questions) {
        return new RegistryEntry("virat_kohli", "Virat Kohli", INDEXED, new SourceCounts(1, 0, 2), questions,
                questions == 0 ? IndexStatus.EMPTY : IndexStatus.READY);
    }
}
