package com.satoru.literature.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record SubmitResult(
    @JsonProperty("total_count") int totalCount,
    List<String> ids,
    ContinuationTokenPair tokens
) {
    public SubmitResult {
        ids = ids == null ? List.of() : List.copyOf(ids);
        tokens = tokens == null ? ContinuationTokenPair.NONE : tokens;
    }
}
