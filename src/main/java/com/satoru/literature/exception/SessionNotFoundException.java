package com.satoru.literature.exception;

import java.util.UUID;

/**
 * Raised both when a session does not exist and when it belongs to another owner.
 */
public class SessionNotFoundException extends EntityNotFoundException {

    public SessionNotFoundException(UUID sessionId) {
        super("Search session", sessionId);
    }
}
