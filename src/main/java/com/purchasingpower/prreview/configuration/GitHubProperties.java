package com.purchasingpower.prreview.configuration;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.time.Duration;

@Data
public class GitHubProperties {

    @NotBlank
    private String baseUrl = "https://api.github.com";

    /**
     * Fallback token, used when the request does not carry its own.
     */
    private String token;

    @NotNull
    private Duration timeout = Duration.ofSeconds(30);
}
