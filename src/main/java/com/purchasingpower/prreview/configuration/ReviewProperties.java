package com.purchasingpower.prreview.configuration;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

@Data
public class ReviewProperties {

    /**
     * Time budget for a single analysis stage, measured from dispatch.
     */
    @NotNull
    private Duration stageTimeout = Duration.ofSeconds(120);

    /**
     * Overrides of {@link #stageTimeout} keyed by stage name.
     */
    private Map<String, Duration> stageTimeouts = new HashMap<>();

    /**
     * Added/deleted lines rendered per file into a stage prompt.
     */
    @Min(1)
    private int maxChangesPerFile = 50;

    @NotBlank
    private String defaultContext = "No additional context";

    @Min(1)
    private int executorCoreSize = 4;

    @Min(1)
    private int executorMaxSize = 16;

    @Min(0)
    private int executorQueueCapacity = 100;

    public Duration timeoutFor(String stageName) {
        return stageTimeouts.getOrDefault(stageName, stageTimeout);
    }
}
