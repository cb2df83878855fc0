package com.interviewindex.retrieval;

/**
 * The query could not be embedded. Fails only the retrieval that raised it.
 */
public class QueryEmbeddingException extends RuntimeException {
    public QueryEmbeddingException(String message, Throwable cause) {
        super(message, cause);
    }

    public QueryEmbeddingException(String message) {
        super(message);
    }
}
