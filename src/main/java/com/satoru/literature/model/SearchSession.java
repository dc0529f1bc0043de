package com.satoru.literature.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public record SearchSession(
    UUID id,
    String owner,
    String query,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("total_count") int totalCount,
    List<Article> snapshot,
    ContinuationTokenPair tokens
) {
    public SearchSession {
        snapshot = snapshot == null ? List.of() : List.copyOf(snapshot);
        tokens = tokens == null ? ContinuationTokenPair.NONE : tokens;
    }
}
