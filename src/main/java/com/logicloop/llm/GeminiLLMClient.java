package com.logicloop.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Random;

/**
 * GeminiLLMClient: LLMClient backed by the Gemini generateContent REST API.
 *
 * Retries only transient failures (429, 503, I/O) with exponential backoff
 * plus jitter, at most MAX_RETRIES times. Everything else is rethrown.
 */
@Component
@Profile("gemini")
public class GeminiLLMClient implements LLMClient {

    private static final Logger log = LoggerFactory.getLogger(GeminiLLMClient.class);

    /** Retry configuration (fixed for reproducible runs) */
    private static final int  MAX_RETRIES     = 3;
    private static final long BASE_BACKOFF_MS = 500;
    private static final long MAX_JITTER_MS   = 250;

    private final WebClient webClient;
    private final Random    jitterRandom = new Random();

    private final String   apiKey;
    private final String   model;
    private final String   baseUrl;
    private final Duration requestTimeout;

    public GeminiLLMClient(
            WebClient.Builder builder,
            @Value("${gemini.api.key}") String apiKey,
            @Value("${gemini.api.model:gemini-1.5-flash}") String model,
            @Value("${gemini.api.base-url:https://generativelanguage.googleapis.com/v1beta}") String baseUrl,
            @Value("${gemini.api.timeout-seconds:30}") long timeoutSeconds
    ) {
        this.webClient      = builder.build();
        this.apiKey         = apiKey;
        this.model          = model;
        this.baseUrl        = baseUrl;
        this.requestTimeout = Duration.ofSeconds(timeoutSeconds);
    }

    @Override
    public String generateWithRole(GeneratorRole role, String userPrompt, double temperature) {

        log.info("[Gemini] role={} model={} keyHash={}", role, model, apiKey.hashCode());

        Map<String, Object> body = Map.of(
            "systemInstruction", Map.of(
                "parts", List.of(Map.of("text", SystemPrompts.forRole(role)))
            ),
            "contents", List.of(
                Map.of("parts", List.of(Map.of("text", userPrompt)))
            ),
            "generationConfig", Map.of("temperature", temperature)
        );

        int attempt = 0;

        while (true) {
            try {
                attempt++;
                log.debug("[Gemini] Attempt {} sending request", attempt);

                Map<?, ?> response = webClient
                        .post()
                        .uri(baseUrl + "/models/" + model + ":generateContent?key=" + apiKey)
                        .contentType(MediaType.APPLICATION_JSON)
                        .accept(MediaType.APPLICATION_JSON)
                        .bodyValue(body)
                        .retrieve()
                        .bodyToMono(Map.class)
                        .timeout(requestTimeout)
                        .block();

                log.info("[Gemini] Call succeeded | retries={}", attempt - 1);
                return extractText(response);

            } catch (RuntimeException ex) {

                if (!isRetryable(ex) || attempt > MAX_RETRIES) {
                    log.error("[Gemini] Final failure | attempts={}", attempt, ex);
                    throw ex;
                }

                long backoff = computeBackoff(attempt);
                log.warn("[Gemini] Transient failure on attempt {}. Retrying after {} ms. Cause: {}",
                        attempt, backoff, rootMessage(ex));
                sleep(backoff);
            }
        }
    }

    @SuppressWarnings("unchecked")
    private String extractText(Map<?, ?> response) {
        try {
            var candidates = (List<Map<String, Object>>) response.get("candidates");
            var content    = (Map<String, Object>) candidates.get(0).get("content");
            var parts      = (List<Map<String, Object>>) content.get("parts");
            Object text    = parts.get(0).get("text");
            return text != null ? text.toString() : "";
        } catch (RuntimeException e) {
            log.error("[Gemini] Failed to parse response: {}", response, e);
            throw new IllegalStateException("Malformed Gemini response", e);
        }
    }

    private boolean isRetryable(Exception ex) {
        return ex instanceof WebClientResponseException.ServiceUnavailable   // 503
            || ex instanceof WebClientResponseException.TooManyRequests      // 429
            || ex.getCause() instanceof IOException;
    }

    private long computeBackoff(int attempt) {
        long exponential = BASE_BACKOFF_MS * (1L << (attempt - 1));
        long jitter      = (long) (jitterRandom.nextDouble() * (MAX_JITTER_MS + 1));
        return exponential + jitter;
    }

    private void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while backing off", ie);
        }
    }

    private String rootMessage(Throwable t) {
        Throwable cause = t;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage();
    }
}
