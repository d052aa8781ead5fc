package com.flare.mentionsprocessor.pipeline;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flare.mentionsprocessor.dto.ArticleRecord;
import com.flare.mentionsprocessor.dto.StreamEntry;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RecordDecoderTest {

    private final RecordDecoder decoder = new RecordDecoder(new ObjectMapper());

    @Test
    void decodesPlainFieldMap() {
        Map<String, String> payload = new LinkedHashMap<>();
        payload.put("title", "Flare ships a new release");
        payload.put("description", "The release focuses on faster ingestion");
        payload.put("source", "TechDaily");
        payload.put("author", "J. Doe");
        payload.put("url", "https://news.example/flare");
        payload.put("urlToImage", "https://news.example/flare.png");
        payload.put("publishedAt", "2024-05-01T10:00:00Z");
        payload.put("content", "Full body");
        payload.put("search_keyword", "flare");

        ArticleRecord record = decoder.decode(new StreamEntry("1-0", payload)).orElseThrow();

        assertEquals("Flare ships a new release", record.getTitle());
        assertEquals("The release focuses on faster ingestion", record.getDescription());
        assertEquals("TechDaily", record.getSourceName());
        assertEquals("J. Doe", record.getAuthor());
        assertEquals("https://news.example/flare.png", record.getImageUrl());
        assertEquals("2024-05-01T10:00:00Z", record.getPublishedAt());
        assertEquals("flare", record.getSearchKeyword());
        assertEquals(payload, record.getRawData());
    }

    @Test
    void missingFieldsDecodeAsNull() {
        ArticleRecord record = decoder.decode(new StreamEntry("1-0", Map.of("title", "Only a title here"))).orElseThrow();

        assertEquals("Only a title here", record.getTitle());
        assertNull(record.getDescription());
        assertNull(record.getSourceName());
        assertNull(record.getContent());
    }

    @Test
    void stripsRedundantJsonQuotes() {
        Map<String, String> payload = Map.of(
                "title", "\"Quoted \\\"title\\\" value\"",
                "description", "plain");

        ArticleRecord record = decoder.decode(new StreamEntry("1-0", payload)).orElseThrow();

        assertEquals("Quoted \"title\" value", record.getTitle());
        assertEquals("plain", record.getDescription());
    }

    @Test
    void keepsHeadlineThatOnlyLooksQuoted() {
        String headline = "\"Markets rally\" says \"analyst\"";
        Map<String, String> payload = Map.of(
                "title", headline,
                "description", "Stocks closed higher on Friday");

        ArticleRecord record = decoder.decode(new StreamEntry("1-0", payload)).orElseThrow();

        assertEquals(headline, record.getTitle());
        assertEquals(headline, record.getRawData().get("title"));
    }

    @Test
    void rawDataIsPayloadAsReceived() {
        Map<String, String> payload = new LinkedHashMap<>();
        payload.put("title", "\"Double encoded title\"");
        payload.put("source", "{\"id\":\"wire\",\"name\":\"Wire\"}");

        ArticleRecord record = decoder.decode(new StreamEntry("1-0", payload)).orElseThrow();

        assertEquals("Double encoded title", record.getTitle());
        assertEquals("Wire", record.getSourceName());
        assertEquals(payload, record.getRawData());
    }

    @Test
    void decodesStructuredSourceEncodedAsJson() {
        Map<String, String> payload = Map.of(
                "title", "Some article title",
                "source", "{\"id\":\"tech-daily\",\"name\":\"TechDaily\"}");

        ArticleRecord record = decoder.decode(new StreamEntry("1-0", payload)).orElseThrow();

        assertEquals("TechDaily", record.getSourceName());
    }

    @Test
    void decodesEncodedEnvelope() {
        String json = "{\"title\":\"Envelope title\",\"description\":\"Envelope description text\","
                + "\"source\":{\"id\":null,\"name\":\"Wire\"},\"urlToImage\":\"https://img\"}";

        ArticleRecord record = decoder.decode(new StreamEntry("2-0", Map.of("data", json))).orElseThrow();

        assertEquals("Envelope title", record.getTitle());
        assertEquals("Envelope description text", record.getDescription());
        assertEquals("Wire", record.getSourceName());
        assertEquals("https://img", record.getImageUrl());
    }

    @Test
    void decodesEnvelopeSerializedAsJsonString() {
        String json = "\"{\\\"title\\\":\\\"Double encoded\\\"}\"";

        ArticleRecord record = decoder.decode(new StreamEntry("2-0", Map.of("payload", json))).orElseThrow();

        assertEquals("Double encoded", record.getTitle());
    }

    @Test
    void malformedEnvelopeIsDecodeFailure() {
        Optional<ArticleRecord> record = decoder.decode(new StreamEntry("3-0", Map.of("data", "{not json")));

        assertTrue(record.isEmpty());
    }

    @Test
    void envelopeThatIsNotAnObjectIsDecodeFailure() {
        assertTrue(decoder.decode(new StreamEntry("3-0", Map.of("data", "[1,2,3]"))).isEmpty());
        assertTrue(decoder.decode(new StreamEntry("3-1", Map.of("data", "  "))).isEmpty());
    }

    @Test
    void emptyPayloadDecodesToEmptyRecord() {
        ArticleRecord record = decoder.decode(new StreamEntry("4-0", Map.of())).orElseThrow();

        assertNull(record.getTitle());
        assertEquals("", record.getSentimentText());
    }
}
