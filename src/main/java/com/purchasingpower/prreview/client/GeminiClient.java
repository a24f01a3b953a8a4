package com.purchasingpower.prreview.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.prreview.configuration.AppProperties;
import com.purchasingpower.prreview.configuration.GeminiProperties;
import com.purchasingpower.prreview.exception.GeminiException;
import com.purchasingpower.prreview.model.CallContext;
import com.purchasingpower.prreview.model.ServiceType;
import com.purchasingpower.prreview.util.ExternalCallLogger;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.util.retry.Retry;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Thin client over Gemini's {@code generateContent} endpoint, used by the LLM-backed
 * analysis stages. Requests JSON output and retries transient HTTP failures with backoff.
 */
@Slf4j
@Component
public class GeminiClient {

    private final GeminiProperties props;
    private final ObjectMapper objectMapper;
    private final WebClient webClient;

    public GeminiClient(AppProperties appProperties, ObjectMapper objectMapper, WebClient.Builder builder) {
        this.props = appProperties.getGemini();
        this.objectMapper = objectMapper;

        // API key travels in a header so it never shows up in access logs
        WebClient.Builder configured = builder.clone()
                .baseUrl(props.getBaseUrl())
                .exchangeStrategies(ExchangeStrategies.builder()
                        .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(16 * 1024 * 1024))
                        .build());
        if (props.getApiKey() != null && !props.getApiKey().isBlank()) {
            configured.defaultHeader("x-goog-api-key", props.getApiKey());
        }
        this.webClient = configured.build();
    }

    /**
     * Generate a JSON-formatted completion for {@code prompt}.
     *
     * @param prompt    fully rendered prompt
     * @param stageName calling stage, selects the temperature and tags the log lines
     * @return the model's text output
     * @throws IllegalStateException if no API key is configured
     * @throws GeminiException if the call fails after retries or the response has no text
     */
    public String generate(String prompt, String stageName) {
        if (props.getApiKey() == null || props.getApiKey().isBlank()) {
            throw new IllegalStateException("Gemini API key is not configured (app.gemini.api-key)");
        }

        CallContext call = ExternalCallLogger.startCall(ServiceType.GEMINI, "generateContent", log);
        String model = props.getChatModel();
        double temperature = props.getTemperatureForStage(stageName);

        call.logRequest("Generating review findings",
                "Stage", stageName,
                "Model", model,
                "Temperature", temperature,
                "Prompt Length", prompt.length() + " chars",
                "Prompt", ExternalCallLogger.truncate(prompt, 500));

        Map<String, Object> body = Map.of(
                "contents", List.of(Map.of("parts", List.of(Map.of("text", prompt)))),
                "generationConfig", Map.of(
                        "responseMimeType", "application/json",
                        "temperature", temperature,
                        "maxOutputTokens", props.getMaxOutputTokens()));

        try {
            String json = webClient.post()
                    .uri("/{version}/models/{model}:generateContent", props.getApiVersion(), model)
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(String.class)
                    .retryWhen(buildRetrySpec())
                    .block();

            String text = extractText(json);
            call.logResponse("Findings generated",
                    "Response Length", text.length() + " chars",
                    "Response", ExternalCallLogger.truncate(text, 500));
            return text;

        } catch (WebClientResponseException e) {
            call.logError(e.getStatusCode() + ": " + e.getMessage(), e);
            throw new GeminiException("Gemini API call failed for stage: " + stageName, e);
        } catch (GeminiException e) {
            call.logError(e.getMessage(), e);
            throw e;
        } catch (Exception e) {
            call.logError("Unexpected error", e);
            throw new GeminiException("Gemini API call failed for stage: " + stageName, e);
        }
    }

    String extractText(String rawJson) throws IOException {
        if (rawJson == null || rawJson.isBlank()) {
            throw new GeminiException("Empty response from Gemini", null);
        }
        JsonNode root = objectMapper.readTree(rawJson);
        JsonNode text = root.path("candidates").path(0).path("content").path("parts").path(0).path("text");
        if (text.isMissingNode() || text.isNull()) {
            throw new GeminiException("Gemini response carried no candidate text", null);
        }
        return text.asText();
    }

    private Retry buildRetrySpec() {
        GeminiProperties.Retry retry = props.getRetry();
        return Retry.backoff(retry.getMaxAttempts(), Duration.ofSeconds(retry.getInitialBackoffSeconds()))
                .maxBackoff(Duration.ofSeconds(retry.getMaxBackoffSeconds()))
                .filter(this::isRetryable)
                .onRetryExhaustedThrow((spec, signal) -> signal.failure());
    }

    private boolean isRetryable(Throwable ex) {
        if (!(ex instanceof WebClientResponseException webEx)) {
            return false;
        }
        List<Integer> codes = props.getRetry().getRetryableStatusCodes();
        if (codes == null || codes.isEmpty()) {
            return webEx.getStatusCode().is5xxServerError() || webEx.getStatusCode().value() == 429;
        }
        return codes.contains(webEx.getStatusCode().value());
    }
}
