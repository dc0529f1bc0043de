package com.satoru.literature.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.satoru.literature.model.Article;
import com.satoru.literature.model.ContinuationTokenPair;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

import java.util.List;

public record SaveSessionRequest(
    @NotBlank @Size(max = 1000) String query,
    @PositiveOrZero @JsonProperty("total_count") int totalCount,
    List<Article> articles,
    ContinuationTokenPair tokens
) {}
