package com.satoru.literature.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Remote-issued handle (WebEnv + query_key) that lets a later EFetch continue a query
 * submitted earlier. Both parts are present or both are absent; values are never built locally.
 */
public record ContinuationTokenPair(
    @JsonProperty("web_env") String webEnv,
    @JsonProperty("query_key") String queryKey
) {

    public static final ContinuationTokenPair NONE = new ContinuationTokenPair(null, null);

    public ContinuationTokenPair {
        boolean hasWebEnv = webEnv != null && !webEnv.isBlank();
        boolean hasQueryKey = queryKey != null && !queryKey.isBlank();
        if (hasWebEnv != hasQueryKey) {
            throw new IllegalArgumentException("WebEnv and query_key must be both present or both absent");
        }
        if (!hasWebEnv) {
            webEnv = null;
            queryKey = null;
        }
    }

    /**
     * Pairs the values read from a response, or {@link #NONE} unless both are present.
     */
    public static ContinuationTokenPair of(String webEnv, String queryKey) {
        if (webEnv == null || webEnv.isBlank() || queryKey == null || queryKey.isBlank()) {
            return NONE;
        }
        return new ContinuationTokenPair(webEnv.trim(), queryKey.trim());
    }

    @JsonIgnore
    public boolean isPresent() {
        return webEnv != null;
    }
}
