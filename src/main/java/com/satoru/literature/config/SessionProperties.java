package com.satoru.literature.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.sessions")
public record SessionProperties(
    @NotNull @Min(1) @Max(50) Integer snapshotSize,
    @NotNull @Min(10) Integer maxTextLength,
    @NotNull @Min(1) @Max(200) Integer listLimit
) {}
