package com.interviewindex.extract;

/**
 * Receives token accounting for every refinement call.
 */
public interface RefinementUsageSink {
    RefinementUsageSink NONE = entry -> {
    };

    void record(RefinementUsageEntry entry);
}
