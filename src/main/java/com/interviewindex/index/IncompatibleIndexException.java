package com.interviewindex.index;

import java.io.IOException;

/**
 * A stored partition was built with a different embedding model or dimension. The subject
 * has to be reset before it can be indexed or searched again.
 */
public class IncompatibleIndexException extends IOException {
    public IncompatibleIndexException(String message) {
        super(message);
    }
}
