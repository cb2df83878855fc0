package com.interviewindex.policy;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import com.interviewindex.registry.RegistryEntry;

/**
 * Remembers the delegate's verdict per input snapshot, so a non-deterministic delegate
 * (a learned scorer, say) still answers the same question the same way.
 */
public class CachingDecisionPolicy implements DecisionPolicy {
    private static final int MAX_VERDICTS = 4096;

    private final Map<Snapshot, Decision> verdicts = new ConcurrentHashMap<>();
    private final DecisionPolicy delegate;

    public CachingDecisionPolicy(DecisionPolicy delegate) {
        this.delegate = delegate;
    }

    @Override
    public Decision decide(Optional<RegistryEntry> entry, boolean force, Duration freshnessWindow, Instant now) {
        Snapshot snapshot = new Snapshot(entry.orElse(null), force, freshnessWindow, now);
        if (verdicts.size() >= MAX_VERDICTS && !verdicts.containsKey(snapshot)) {
            verdicts.clear();
        }
        return verdicts.computeIfAbsent(snapshot, key -> delegate.decide(entry, force, freshnessWindow, now));
    }

    public int cachedVerdicts() {
        return verdicts.size();
    }

    private record Snapshot(RegistryEntry entry, boolean force, Duration freshnessWindow, Instant now) {
    }
}
