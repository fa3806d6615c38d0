package com.example.slidecast_backend.exception;

/**
 * Every provider of a chain failed. The individual failures are attached as suppressed exceptions.
 */
public class ProviderException extends RuntimeException {
    public ProviderException(String message) {
        super(message);
    }

    public ProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
