package com.satoru.literature.exception;

/**
 * Explicit throttling answer (HTTP 429). Handled everywhere as a {@link TransportException}.
 */
public class RateLimitExceededException extends TransportException {

    public RateLimitExceededException(String utility) {
        super("E-utilities " + utility + " rejected the request: rate limit exceeded", 429);
    }
}
