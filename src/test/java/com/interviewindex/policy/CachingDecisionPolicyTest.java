package com.interviewindex.policy;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

class CachingDecisionPolicyTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Test
    void shouldReturnFirstVerdictForRepeatedSnapshot() {
        AtomicInteger calls = new AtomicInteger();
        DecisionPolicy flipping = (entry, force, window, now) -> calls.incrementAndGet() % 2 == 1
                ? new Decision(IngestAction.INGEST, "scored high")
                : new Decision(IngestAction.RETRIEVE, "scored low");
        CachingDecisionPolicy policy = new CachingDecisionPolicy(flipping);

        Decision first = policy.decide(Optional.empty(), false, Duration.ofDays(30), NOW);
        Decision second = policy.decide(Optional.empty(), false, Duration.ofDays(30), NOW);

        assertEquals(first, second);
        assertEquals(1, calls.get());
        assertEquals(1, policy.cachedVerdicts());
    }

    @Test
    void shouldAskDelegateAgainWhenInputsChange() {
        CachingDecisionPolicy policy = new CachingDecisionPolicy(new FreshnessDecisionPolicy());

        assertEquals(IngestAction.INGEST, policy.decide(Optional.empty(), false, Duration.ofDays(30), NOW).action());
        assertEquals(IngestAction.INGEST, policy.decide(Optional.empty(), true, Duration.ofDays(30), NOW).action());
        assertEquals(2, policy.cachedVerdicts());
    }
}
