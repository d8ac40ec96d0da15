package com.codemend.llm;

import com.codemend.core.cancel.CancellationToken;
import com.codemend.core.cancel.OperationCancelledException;
import com.codemend.core.context.GenerationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Profile;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.function.Consumer;

/**
 * OllamaGenerationClient: production GenerationClient backed by a local
 * Ollama server, streaming {@code /api/generate}.
 *
 * Streaming keeps cancellation responsive: the token is checked after every
 * chunk and the connection is abandoned as soon as it is cancelled.
 *
 * Error mapping:
 *   connect/read timeout, I/O          → TransientGenerationException
 *   HTTP 429, 502, 503, 504            → TransientGenerationException
 *   any other HTTP or client error     → GenerationException
 */
@Component
@Profile("!mock")
public class OllamaGenerationClient implements GenerationClient {

    private static final Logger log = LoggerFactory.getLogger(OllamaGenerationClient.class);

    private static final String CODE_SYSTEM_PROMPT = """
            You are a precise software engineer editing a single source file.
            Output ONLY the complete file content. No explanations, no markdown fences.
            """;

    private static final String PLAN_SYSTEM_PROMPT = """
            You are a precise repair planner.
            Output ONLY a valid JSON object with "planDescription" and "steps".
            No prose outside the JSON object.
            """;

    private final String       baseUrl;
    private final String       model;
    private final double       codeTemperature;
    private final double       planTemperature;
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public OllamaGenerationClient(
            @Value("${ollama.base-url:http://localhost:11434}") String baseUrl,
            @Value("${ollama.model:llama3:8b}") String model,
            @Value("${ollama.temperature.code:0.1}") double codeTemperature,
            @Value("${ollama.temperature.plan:0.2}") double planTemperature,
            @Value("${ollama.timeout-seconds:300}") long timeoutSeconds,
            RestTemplateBuilder restTemplateBuilder
    ) {
        this.baseUrl         = baseUrl;
        this.model           = model;
        this.codeTemperature = codeTemperature;
        this.planTemperature = planTemperature;
        this.restTemplate    = restTemplateBuilder
                .setConnectTimeout(Duration.ofSeconds(10))
                .setReadTimeout(Duration.ofSeconds(timeoutSeconds))
                .build();
    }

    // =========================================================================
    // GenerationClient contract
    // =========================================================================

    @Override
    public String generate(String instructions, GenerationContext context,
                           Consumer<String> onChunk, CancellationToken token) {
        log.debug("[Ollama] generate promptLen={}", instructions.length());
        return stream(CODE_SYSTEM_PROMPT + "\n\n" + instructions, codeTemperature, onChunk, token);
    }

    @Override
    public String generatePlan(String instructions, GenerationContext context,
                               Consumer<String> onChunk, CancellationToken token) {
        log.debug("[Ollama] generatePlan promptLen={}", instructions.length());
        return stream(PLAN_SYSTEM_PROMPT + "\n\n" + instructions, planTemperature, onChunk, token);
    }

    // =========================================================================
    // HTTP client
    // =========================================================================

    private String stream(String prompt, double temperature, Consumer<String> onChunk, CancellationToken token) {
        token.throwIfCancelled();

        Map<String, Object> options = new HashMap<>();
        options.put("temperature", temperature);

        Map<String, Object> body = new HashMap<>();
        body.put("model",   model);
        body.put("prompt",  prompt);
        body.put("stream",  true);
        body.put("options", options);

        String url = baseUrl + "/api/generate";
        try {
            String result = restTemplate.execute(url, HttpMethod.POST,
                    request -> {
                        request.getHeaders().setContentType(MediaType.APPLICATION_JSON);
                        objectMapper.writeValue(request.getBody(), body);
                    },
                    response -> {
                        StringBuilder full = new StringBuilder();
                        try (BufferedReader reader = new BufferedReader(
                                new InputStreamReader(response.getBody(), StandardCharsets.UTF_8))) {
                            String line;
                            while ((line = reader.readLine()) != null) {
                                token.throwIfCancelled();
                                if (line.isBlank()) continue;
                                JsonNode node = objectMapper.readTree(line);
                                if (node.has("error")) {
                                    throw new GenerationException("Ollama error: " + node.get("error").asText());
                                }
                                String chunk = node.path("response").asText("");
                                if (!chunk.isEmpty()) {
                                    full.append(chunk);
                                    onChunk.accept(chunk);
                                }
                                if (node.path("done").asBoolean(false)) break;
                            }
                        }
                        return full.toString();
                    });

            log.debug("[Ollama] responseLen={}", result != null ? result.length() : 0);
            return result != null ? result : "";

        } catch (OperationCancelledException | GenerationException e) {
            throw e;
        } catch (HttpStatusCodeException e) {
            throw mapStatus(e);
        } catch (ResourceAccessException e) {
            log.warn("[Ollama] Network failure: {}", e.getMessage());
            throw new TransientGenerationException("Model server unreachable or timed out: " + e.getMessage(), e);
        } catch (RestClientException e) {
            log.error("[Ollama] Call failed: {}", e.getMessage());
            throw new GenerationException("Ollama call failed: " + e.getMessage(), e);
        }
    }

    private GenerationException mapStatus(HttpStatusCodeException e) {
        int status = e.getStatusCode().value();
        if (status == HttpStatus.TOO_MANY_REQUESTS.value()
                || status == HttpStatus.BAD_GATEWAY.value()
                || status == HttpStatus.SERVICE_UNAVAILABLE.value()
                || status == HttpStatus.GATEWAY_TIMEOUT.value()) {
            log.warn("[Ollama] Transient HTTP {}", status);
            return new TransientGenerationException("Model server returned HTTP " + status, e);
        }
        log.error("[Ollama] HTTP {}: {}", status, e.getResponseBodyAsString());
        return new GenerationException("Model server returned HTTP " + status, e);
    }
}
