package com.interviewindex.policy;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import com.interviewindex.registry.RegistryEntry;

/**
 * Chooses what to do for a subject from its registry state. Implementations must return the
 * same decision for the same inputs.
 */
public interface DecisionPolicy {
    Decision decide(Optional<RegistryEntry> entry, boolean force, Duration freshnessWindow, Instant now);
}
