package com.interviewindex.extract;

/**
 * Whether near-duplicate questions found in one ingestion run are merged into a single record
 * carrying every contributing source.
 */
public record DedupPolicy(boolean enabled, double similarityThreshold) {

    public static DedupPolicy disabled() {
        return new DedupPolicy(false, 1.0);
    }

    public static DedupPolicy mergeAbove(double similarityThreshold) {
        return new DedupPolicy(true, similarityThreshold);
    }
}
