package com.satoru.literature.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.UUID;

/**
 * One page reloaded from a stored session. {@code resubmitted} is set when the stored
 * continuation tokens could not be used and the query text was sent again.
 */
public record SessionPage(
    @JsonProperty("session_id") UUID sessionId,
    String query,
    boolean resubmitted,
    FetchResult result
) {}
