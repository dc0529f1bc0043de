package com.satoru.literature.exception;

import lombok.Getter;

/**
 * Network failure, timeout or non-success status from E-utilities. Transient: callers may retry.
 */
@Getter
public class TransportException extends RuntimeException {
    private final boolean timeout;
    private final Integer statusCode;

    public TransportException(String message, Throwable cause) {
        super(message, cause);
        this.timeout = false;
        this.statusCode = null;
    }

    public TransportException(String message, int statusCode) {
        super(message);
        this.timeout = false;
        this.statusCode = statusCode;
    }

    private TransportException(String message, boolean timeout, Throwable cause) {
        super(message, cause);
        this.timeout = timeout;
        this.statusCode = null;
    }

    public static TransportException timeout(String utility, long deadlineMillis, Throwable cause) {
        return new TransportException(
            "E-utilities " + utility + " call exceeded deadline of " + deadlineMillis + " ms", true, cause);
    }
}
