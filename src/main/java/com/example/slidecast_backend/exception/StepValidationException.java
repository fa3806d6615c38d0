package com.example.slidecast_backend.exception;

/**
 * A step cannot run because required input from an earlier step is missing or unusable.
 */
public class StepValidationException extends RuntimeException {
    public StepValidationException(String message) {
        super(message);
    }
}
