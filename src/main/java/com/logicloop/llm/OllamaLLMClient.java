package com.logicloop.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Profile;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * OllamaLLMClient: LLMClient backed by a local Ollama server (/api/generate).
 *
 * Non-streaming; the whole completion comes back in the "response" field.
 * Any transport or decoding failure is rethrown as IllegalStateException.
 */
@Component
@Profile("ollama")
public class OllamaLLMClient implements LLMClient {

    private static final Logger log = LoggerFactory.getLogger(OllamaLLMClient.class);

    private final String       baseUrl;
    private final String       model;
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    @Autowired
    public OllamaLLMClient(
            RestTemplateBuilder builder,
            ObjectMapper objectMapper,
            @Value("${ollama.base-url:http://localhost:11434}") String baseUrl,
            @Value("${ollama.model:llama3:8b}") String model,
            @Value("${ollama.read-timeout-ms:120000}") long readTimeoutMs
    ) {
        this(builder.setConnectTimeout(Duration.ofSeconds(5))
                    .setReadTimeout(Duration.ofMillis(readTimeoutMs))
                    .build(),
             objectMapper, baseUrl, model);
    }

    OllamaLLMClient(RestTemplate restTemplate, ObjectMapper objectMapper, String baseUrl, String model) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.baseUrl      = baseUrl;
        this.model        = model;
    }

    @Override
    public String generateWithRole(GeneratorRole role, String userPrompt, double temperature) {
        String fullPrompt = SystemPrompts.forRole(role) + "\n\n" + userPrompt;
        log.debug("[Ollama] role={} temperature={} promptLen={}", role, temperature, fullPrompt.length());
        return callOllama(fullPrompt, temperature);
    }

    private String callOllama(String prompt, double temperature) {
        try {
            Map<String, Object> options = new HashMap<>();
            options.put("temperature", temperature);

            Map<String, Object> body = new HashMap<>();
            body.put("model",   model);
            body.put("prompt",  prompt);
            body.put("options", options);
            body.put("stream",  false);

            HttpHeaders headers = new HttpHeaders();
            headers.setContentType(MediaType.APPLICATION_JSON);

            ResponseEntity<String> response = restTemplate.postForEntity(
                    baseUrl + "/api/generate", new HttpEntity<>(body, headers), String.class);

            JsonNode root = objectMapper.readTree(response.getBody());
            String result = root != null && root.has("response") ? root.get("response").asText() : "";
            log.debug("[Ollama] responseLen={}", result.length());
            return result;

        } catch (Exception e) {
            log.error("[Ollama] Call failed: {}", e.getMessage());
            throw new IllegalStateException("Ollama LLM call failed: " + e.getMessage(), e);
        }
    }
}
