package com.satoru.literature.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "app.eutils")
public record EutilsProperties(
    @NotBlank String baseUrl,
    @NotBlank String tool,
    @NotNull String email,
    String apiKey,
    @NotNull Duration minInterval,
    @NotNull Duration keyedMinInterval,
    @NotNull Duration connectTimeout,
    @NotNull Duration requestTimeout
) {

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    /**
     * NCBI allows more requests per second when an API key is sent.
     */
    public Duration effectiveMinInterval() {
        return hasApiKey() ? keyedMinInterval : minInterval;
    }
}
