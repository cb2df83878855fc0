package com.interviewindex.index;

/**
 * A single record could not be written to both stores. Whatever was written has been rolled
 * back; the id stays reserved.
 */
public class IndexWriteException extends RuntimeException {
    private final String subjectId;
    private final long id;

    public IndexWriteException(String subjectId, long id, String message, Throwable cause) {
        super("subject=" + subjectId + " id=" + id + ": " + message, cause);
        this.subjectId = subjectId;
        this.id = id;
    }

    public String subjectId() {
        return subjectId;
    }

    public long id() {
        return id;
    }
}
