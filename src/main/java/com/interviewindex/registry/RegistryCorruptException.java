package com.interviewindex.registry;

import java.io.IOException;

public class RegistryCorruptException extends IOException {
    public RegistryCorruptException(String message) {
        super(message);
    }

    public RegistryCorruptException(String message, Throwable cause) {
        super(message, cause);
    }
}
