package com.satoru.literature.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.UUID;

public record SessionSummary(
    UUID id,
    String query,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("total_count") int totalCount
) {}
