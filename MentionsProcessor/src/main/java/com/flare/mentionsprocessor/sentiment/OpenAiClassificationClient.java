package com.flare.mentionsprocessor.sentiment;

import com.fasterxml.jackson.databind.JsonNode;
import com.flare.mentionsprocessor.config.MentionsProcessorProperties;
import com.flare.mentionsprocessor.exception.ClassificationProviderException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Classification client for an OpenAI-compatible chat completions endpoint.
 */
@Component
@Slf4j
public class OpenAiClassificationClient implements ClassificationClient {

    private final RestTemplate restTemplate;
    private final MentionsProcessorProperties.Sentiment config;

    public OpenAiClassificationClient(RestTemplate sentimentRestTemplate, MentionsProcessorProperties properties) {
        this.restTemplate = sentimentRestTemplate;
        this.config = properties.getSentiment();
    }

    @Override
    public boolean isConfigured() {
        return config.isConfigured();
    }

    @Override
    public String complete(ClassificationRequest request) {
        String url = config.getBaseUrl() + "/chat/completions";

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        HttpEntity<Map<String, Object>> entity = new HttpEntity<>(buildBody(request), headers);

        try {
            ResponseEntity<JsonNode> response = restTemplate.postForEntity(url, entity, JsonNode.class);
            return extractContent(response.getBody());
        } catch (HttpStatusCodeException e) {
            int status = e.getStatusCode().value();
            log.warn("Classification provider returned HTTP {}: {}", status, e.getResponseBodyAsString());
            throw new ClassificationProviderException("Provider returned HTTP " + status, status, e);
        } catch (RestClientException e) {
            throw new ClassificationProviderException("Provider request failed: " + e.getMessage(), e);
        }
    }

    Map<String, Object> buildBody(ClassificationRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", config.getModel());
        body.put("messages", List.of(
                Map.of("role", "system", "content", request.systemPrompt()),
                Map.of("role", "user", "content", request.text())));
        body.put("response_format", request.responseFormat());
        body.put("max_tokens", request.maxTokens());
        body.put("temperature", 0);
        return body;
    }

    private String extractContent(JsonNode body) {
        if (body == null) {
            return null;
        }
        JsonNode content = body.path("choices").path(0).path("message").path("content");
        if (content.isMissingNode() || content.isNull()) {
            log.debug("Completion without message content: {}", body);
            return null;
        }
        return content.asText();
    }
}
