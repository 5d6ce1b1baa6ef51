package com.payment.observability.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.payment.observability.core.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Calls one model behind an OpenAI-compatible {@code /chat/completions} endpoint.
 * Requests are deterministic (temperature 0) and ask for a JSON object answer.
 * Transport errors surface as Spring {@code RestClientException}s.
 */
@Slf4j
public class ChatModelClient {

    private final String modelName;
    private final String endpoint;
    private final String apiKey;
    private final RestTemplate restTemplate;

    public ChatModelClient(String baseUrl, String apiKey, String modelName, Duration timeout) {
        this(baseUrl, apiKey, modelName, timedRestTemplate(timeout));
    }

    public ChatModelClient(String baseUrl, String apiKey, String modelName, RestTemplate restTemplate) {
        String trimmed = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.endpoint = trimmed + "/chat/completions";
        this.apiKey = apiKey;
        this.modelName = modelName;
        this.restTemplate = restTemplate;
    }

    private static RestTemplate timedRestTemplate(Duration timeout) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) timeout.toMillis());
        factory.setReadTimeout((int) timeout.toMillis());
        return new RestTemplate(factory);
    }

    public String getModelName() {
        return modelName;
    }

    /**
     * Sends the system prompt and user content, returns the text of the first choice.
     *
     * @throws ValidationException when the model answers without any content
     */
    public String complete(String systemPrompt, String userContent) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", modelName);
        body.put("temperature", 0);
        body.put("response_format", Map.of("type", "json_object"));
        body.put("messages", List.of(
                Map.of("role", "system", "content", systemPrompt),
                Map.of("role", "user", "content", userContent)
        ));

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (apiKey != null && !apiKey.isBlank()) {
            headers.setBearerAuth(apiKey);
        }

        log.debug("Calling model={} endpoint={}", modelName, endpoint);
        JsonNode response = restTemplate.postForObject(endpoint, new HttpEntity<>(body, headers), JsonNode.class);
        JsonNode content = response == null
                ? null
                : response.path("choices").path(0).path("message").path("content");
        if (content == null || content.isMissingNode() || content.isNull() || content.asText().isBlank()) {
            throw new ValidationException("Model " + modelName + " returned an empty completion");
        }
        return content.asText();
    }
}
