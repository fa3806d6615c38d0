package com.example.slidecast_backend.exception;

public class FanOutFailedException extends RuntimeException {
    private final int attempted;

    public FanOutFailedException(String message, int attempted) {
        super(message);
        this.attempted = attempted;
    }

    public int getAttempted() {
        return attempted;
    }
}
