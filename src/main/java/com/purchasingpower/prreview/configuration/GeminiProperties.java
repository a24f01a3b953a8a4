package com.purchasingpower.prreview.configuration;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Settings for the Gemini generateContent API.
 *
 * <pre>
 * app:
 *   gemini:
 *     api-key: ${GEMINI_KEY}
 *     chat-model: gemini-1.5-flash
 *     temperature: 0.3
 *     stage-temperatures:
 *       security-reviewer: 0.1
 *     retry:
 *       max-attempts: 3
 *       initial-backoff-seconds: 2
 * </pre>
 */
@Data
public class GeminiProperties {

    private String apiKey;

    @NotBlank
    private String chatModel = "gemini-1.5-flash";

    @NotBlank
    private String baseUrl = "https://generativelanguage.googleapis.com";

    @NotBlank
    private String apiVersion = "v1beta";

    private double temperature = 0.3;

    private int maxOutputTokens = 2048;

    /**
     * Per-stage overrides of {@link #temperature}, keyed by stage name.
     */
    private Map<String, Double> stageTemperatures = new HashMap<>();

    @Valid
    @NotNull
    private Retry retry = new Retry();

    public double getTemperatureForStage(String stageName) {
        if (stageTemperatures == null) {
            return temperature;
        }
        return stageTemperatures.getOrDefault(stageName, temperature);
    }

    @Data
    public static class Retry {

        private int maxAttempts = 3;

        private long initialBackoffSeconds = 2;

        private long maxBackoffSeconds = 10;

        /**
         * Status codes worth retrying. Empty means 429 and any 5xx.
         */
        private List<Integer> retryableStatusCodes = List.of(429, 500, 502, 503, 504);
    }
}
