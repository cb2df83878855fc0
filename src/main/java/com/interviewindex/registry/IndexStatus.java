package com.interviewindex.registry;

public enum IndexStatus {
    READY,
    /** Indexed at least once but no questions were found. */
    EMPTY,
    /** The last run fell back to heuristics-only extraction. */
    DEGRADED
}
