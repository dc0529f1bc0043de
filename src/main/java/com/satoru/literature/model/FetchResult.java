package com.satoru.literature.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record FetchResult(
    @JsonProperty("total_count") int totalCount,
    List<Article> articles,
    ContinuationTokenPair tokens
) {

    public FetchResult {
        articles = articles == null ? List.of() : List.copyOf(articles);
        tokens = tokens == null ? ContinuationTokenPair.NONE : tokens;
        if (totalCount < articles.size()) {
            totalCount = articles.size();
        }
    }

    public static FetchResult empty() {
        return new FetchResult(0, List.of(), ContinuationTokenPair.NONE);
    }
}
