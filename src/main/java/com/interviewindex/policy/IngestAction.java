package com.interviewindex.policy;

public enum IngestAction {
    /** Extract every catalogued source and append. */
    INGEST,
    /** Serve the query from the existing index. */
    RETRIEVE,
    /** Extract only sources that changed since the last run and append. */
    INCREMENTAL_INGEST;

    public boolean requiresIngestion() {
        return this != RETRIEVE;
    }
}
