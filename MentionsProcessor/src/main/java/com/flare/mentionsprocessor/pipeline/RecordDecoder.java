package com.flare.mentionsprocessor.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.flare.mentionsprocessor.dto.ArticleRecord;
import com.flare.mentionsprocessor.dto.StreamEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Turns a stream payload into an {@link ArticleRecord}.
 *
 * <p>Two payload shapes are accepted: a plain field map (what the ingest side
 * writes with XADD) or a single field whose value is a JSON-encoded object.
 * Anything else is a decode failure, reported as an empty result.</p>
 */
@Component
@Slf4j
public class RecordDecoder {

    public static final String TITLE = "title";
    public static final String DESCRIPTION = "description";
    public static final String SOURCE = "source";
    public static final String AUTHOR = "author";
    public static final String URL = "url";
    public static final String URL_TO_IMAGE = "urlToImage";
    public static final String PUBLISHED_AT = "publishedAt";
    public static final String CONTENT = "content";
    public static final String SEARCH_KEYWORD = "search_keyword";

    private static final Set<String> ARTICLE_FIELDS = Set.of(
            TITLE, DESCRIPTION, SOURCE, AUTHOR, URL, URL_TO_IMAGE, PUBLISHED_AT, CONTENT, SEARCH_KEYWORD);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;
    private final ObjectReader stringLiteralReader;

    public RecordDecoder(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.stringLiteralReader = objectMapper.readerFor(String.class)
                .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public Optional<ArticleRecord> decode(StreamEntry entry) {
        Map<String, String> payload = entry.payload();

        if (isEncodedEnvelope(payload)) {
            Map.Entry<String, String> envelope = payload.entrySet().iterator().next();
            Map<String, Object> fields = parseEnvelope(entry.id(), envelope.getKey(), envelope.getValue());
            if (fields == null) {
                return Optional.empty();
            }
            return Optional.of(toRecord(fields, fields));
        }

        return Optional.of(toRecord(unwrapStringLiterals(payload), new LinkedHashMap<>(payload)));
    }

    /**
     * A lone field that is not itself an article field carries the whole article encoded.
     */
    private boolean isEncodedEnvelope(Map<String, String> payload) {
        return payload.size() == 1 && !ARTICLE_FIELDS.contains(payload.keySet().iterator().next());
    }

    private Map<String, Object> parseEnvelope(String messageId, String field, String encoded) {
        if (encoded == null || encoded.isBlank()) {
            log.warn("Empty encoded payload in field '{}', messageId={}", field, messageId);
            return null;
        }
        try {
            JsonNode node = objectMapper.readTree(unwrapStringLiteral(encoded.trim()));
            if (!node.isObject()) {
                log.warn("Encoded payload in field '{}' is not a JSON object, messageId={}", field, messageId);
                return null;
            }
            return objectMapper.convertValue(node, MAP_TYPE);
        } catch (Exception e) {
            log.warn("Could not decode payload field '{}', messageId={}: {}", field, messageId, e.getMessage());
            return null;
        }
    }

    /**
     * @param fields  decoded article fields
     * @param rawData payload as it arrived, kept for the audit column
     */
    private ArticleRecord toRecord(Map<String, Object> fields, Map<String, Object> rawData) {
        return ArticleRecord.builder()
                .title(getString(fields, TITLE))
                .description(getString(fields, DESCRIPTION))
                .source(decodeSource(fields.get(SOURCE)))
                .author(getString(fields, AUTHOR))
                .url(getString(fields, URL))
                .imageUrl(getString(fields, URL_TO_IMAGE))
                .publishedAt(getString(fields, PUBLISHED_AT))
                .content(getString(fields, CONTENT))
                .searchKeyword(getString(fields, SEARCH_KEYWORD))
                .rawData(rawData)
                .build();
    }

    /**
     * Source arrives either as a name or as a {"id", "name"} structure, possibly JSON-encoded.
     */
    private Object decodeSource(Object value) {
        if (value instanceof String) {
            String text = ((String) value).trim();
            if (text.startsWith("{")) {
                try {
                    return objectMapper.readValue(text, MAP_TYPE);
                } catch (Exception e) {
                    log.debug("Source looks like JSON but does not parse, keeping it as a name: {}", text);
                }
            }
        }
        return value;
    }

    private String getString(Map<String, Object> fields, String key) {
        Object value = fields.get(key);
        return value != null ? value.toString() : null;
    }

    /**
     * Unwraps values that some producers serialize a second time as JSON string
     * literals. A value is unwrapped only when the whole of it is one valid literal,
     * so text that merely starts and ends with a quote is kept as is.
     */
    private Map<String, Object> unwrapStringLiterals(Map<String, String> rawPayload) {
        Map<String, Object> fields = new LinkedHashMap<>();

        for (Map.Entry<String, String> entry : rawPayload.entrySet()) {
            fields.put(entry.getKey(), unwrapStringLiteral(entry.getValue()));
        }

        return fields;
    }

    private String unwrapStringLiteral(String value) {
        if (value == null || value.length() < 2 || !value.startsWith("\"") || !value.endsWith("\"")) {
            return value;
        }
        try {
            return stringLiteralReader.readValue(value);
        } catch (JsonProcessingException e) {
            log.trace("Value is quoted but not a JSON string literal, keeping it: {}", e.getOriginalMessage());
            return value;
        }
    }
}
