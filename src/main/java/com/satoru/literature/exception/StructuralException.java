package com.satoru.literature.exception;

/**
 * Response could not be parsed into the minimum required shape. Never retried.
 */
public class StructuralException extends RuntimeException {

    public StructuralException(String message) {
        super(message);
    }

    public StructuralException(String message, Throwable cause) {
        super(message, cause);
    }
}
