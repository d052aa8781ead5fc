package com.flare.mentionsprocessor.sentiment;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flare.mentionsprocessor.config.MentionsProcessorProperties;
import com.flare.mentionsprocessor.exception.ClassificationProviderException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Classifies the sentiment of article text through the configured provider.
 *
 * <p>Never throws: every provider or parsing fault is turned into an
 * ERROR_* result with score 0.0 so that the mention can still be persisted.</p>
 */
@Service
@Slf4j
public class SentimentClassifier {

    static final String SYSTEM_PROMPT =
            "You are a sentiment analysis assistant for news articles. "
            + "Classify the sentiment of the user text as POSITIVE, NEGATIVE or NEUTRAL "
            + "and give a confidence score between 0 and 1. "
            + "Answer only with a JSON object containing \"label\" and \"score\".";

    static final Map<String, Object> RESPONSE_FORMAT = Map.of(
            "type", "json_schema",
            "json_schema", Map.of(
                    "name", "sentiment",
                    "strict", true,
                    "schema", Map.of(
                            "type", "object",
                            "properties", Map.of(
                                    "label", Map.of(
                                            "type", "string",
                                            "enum", List.of("POSITIVE", "NEGATIVE", "NEUTRAL")),
                                    "score", Map.of("type", "number")),
                            "required", List.of("label", "score"),
                            "additionalProperties", false)));

    private final ClassificationClient client;
    private final ObjectMapper objectMapper;
    private final int maxInputChars;
    private final int maxTokens;

    public SentimentClassifier(ClassificationClient client,
                               ObjectMapper objectMapper,
                               MentionsProcessorProperties properties) {
        this.client = client;
        this.objectMapper = objectMapper;
        this.maxInputChars = properties.getSentiment().getMaxInputChars();
        this.maxTokens = properties.getSentiment().getMaxTokens();
    }

    public SentimentResult classify(String text) {
        if (!client.isConfigured()) {
            log.debug("Sentiment provider not configured, defaulting to NEUTRAL");
            return SentimentResult.of(SentimentLabel.NEUTRAL, 0.5);
        }
        if (text == null || text.isBlank()) {
            return SentimentResult.of(SentimentLabel.NEUTRAL, 0.0);
        }

        String truncated = truncate(text, maxInputChars);

        try {
            String content = client.complete(new ClassificationRequest(SYSTEM_PROMPT, truncated, RESPONSE_FORMAT, maxTokens));
            if (content == null || content.isBlank()) {
                log.warn("Sentiment provider response carried no content");
                return SentimentResult.degraded(SentimentLabel.ERROR_PARSING, "empty completion content");
            }
            JsonNode node = objectMapper.readTree(content);
            if (!node.isObject()) {
                log.warn("Sentiment provider content is not a JSON object: {}", content);
                return SentimentResult.degraded(SentimentLabel.ERROR_JSON_DECODE, "content is not a JSON object");
            }
            return normalize(node);

        } catch (JsonProcessingException e) {
            log.warn("Could not decode sentiment provider content: {}", e.getOriginalMessage());
            return SentimentResult.degraded(SentimentLabel.ERROR_JSON_DECODE, e.getOriginalMessage());
        } catch (ClassificationProviderException e) {
            if (e.hasHttpStatus()) {
                return SentimentResult.degraded(SentimentLabel.ERROR_HTTP, "HTTP " + e.getHttpStatus());
            }
            log.warn("Sentiment provider request failed: {}", e.getMessage());
            return SentimentResult.degraded(SentimentLabel.ERROR_API, e.getMessage());
        } catch (Exception e) {
            log.error("Unexpected error during sentiment classification: {}", e.getMessage(), e);
            return SentimentResult.degraded(SentimentLabel.ERROR_UNKNOWN, e.getClass().getSimpleName());
        }
    }

    /**
     * Cuts at a character boundary so a surrogate pair is never split.
     */
    static String truncate(String text, int maxChars) {
        if (text.codePointCount(0, text.length()) <= maxChars) {
            return text;
        }
        return text.substring(0, text.offsetByCodePoints(0, maxChars));
    }

    /**
     * Corrects label and score independently; a bad field never fails the whole result.
     */
    SentimentResult normalize(JsonNode node) {
        JsonNode labelNode = node.get("label");
        SentimentLabel label = SentimentLabel.fromProvider(
                labelNode != null && labelNode.isTextual() ? labelNode.asText() : null);
        if (label == SentimentLabel.UNKNOWN) {
            log.warn("Unrecognized sentiment label from provider: {}", labelNode);
        }

        JsonNode scoreNode = node.get("score");
        double score = 0.0;
        if (scoreNode != null && scoreNode.isNumber()) {
            double value = scoreNode.asDouble();
            if (value >= 0.0 && value <= 1.0) {
                score = value;
            } else {
                log.warn("Sentiment score out of range: {}", value);
            }
        } else {
            log.warn("Sentiment score missing or not numeric: {}", scoreNode);
        }

        return SentimentResult.of(label, score);
    }
}
