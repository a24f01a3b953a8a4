package com.purchasingpower.prreview.configuration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    @NotBlank
    private String name = "PR Review Orchestrator";

    @NotBlank
    private String version = "1.0.0";

    @NotBlank
    private String environment = "development";

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private GitHubProperties github = new GitHubProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private GeminiProperties gemini = new GeminiProperties();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private ReviewProperties review = new ReviewProperties();
}
