package com.logicloop.llm;

import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class OllamaLLMClientTest {

    private static final String BASE_URL = "http://ollama.test:11434";

    private MockRestServiceServer server;
    private OllamaLLMClient       client;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        client = new OllamaLLMClient(restTemplate, new ObjectMapper(), BASE_URL, "llama3:8b");
    }

    @Test
    void testGenerateReturnsResponseField() {
        server.expect(requestTo(BASE_URL + "/api/generate"))
              .andExpect(method(HttpMethod.POST))
              .andExpect(jsonPath("$.model").value("llama3:8b"))
              .andExpect(jsonPath("$.stream").value(false))
              .andExpect(jsonPath("$.options.temperature").value(0.7))
              .andRespond(withSuccess("{\"response\": \"Answer: B\", \"done\": true}", MediaType.APPLICATION_JSON));

        String text = client.generateWithRole(GeneratorRole.REFINER, "Improve it", 0.7);

        assertEquals("Answer: B", text);
        server.verify();
    }

    @Test
    void testServerErrorIsRaised() {
        server.expect(requestTo(BASE_URL + "/api/generate"))
              .andRespond(withServerError());

        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> client.generateWithRole(GeneratorRole.JUDGE, "Compare", 0.0));
        assertTrue(e.getMessage().startsWith("Ollama LLM call failed"));
    }

    @Test
    void testMissingResponseFieldGivesEmptyText() {
        server.expect(requestTo(BASE_URL + "/api/generate"))
              .andRespond(withSuccess("{\"done\": true}", MediaType.APPLICATION_JSON));

        assertEquals("", client.generateWithRole(GeneratorRole.FORMALIZER, "Translate", 0.0));
    }
}
