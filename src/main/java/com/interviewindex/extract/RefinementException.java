package com.interviewindex.extract;

public class RefinementException extends Exception {
    public RefinementException(String message) {
        super(message);
    }

    public RefinementException(String message, Throwable cause) {
        super(message, cause);
    }
}
