package com.flare.mentionsprocessor.dto;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class ArticleRecordTest {

    @Test
    void sentimentTextPrefersDescriptionThenTitle() {
        assertEquals("desc", ArticleRecord.builder().title("title").description("desc").build().getSentimentText());
        assertEquals("title", ArticleRecord.builder().title("title").description("").build().getSentimentText());
        assertEquals("", ArticleRecord.builder().build().getSentimentText());
    }

    @Test
    void sourceNameFlattensStructuredSource() {
        Map<String, Object> source = new HashMap<>();
        source.put("id", null);
        source.put("name", "Reuters");

        assertEquals("Reuters", ArticleRecord.builder().source(source).build().getSourceName());
        assertEquals("BBC", ArticleRecord.builder().source("BBC").build().getSourceName());
        assertNull(ArticleRecord.builder().source(Map.of("id", "x")).build().getSourceName());
        assertNull(ArticleRecord.builder().build().getSourceName());
    }

    @Test
    void streamEntryPayloadIsImmutableCopy() {
        Map<String, String> fields = new HashMap<>();
        fields.put("title", "a");
        StreamEntry entry = new StreamEntry("1-0", fields);
        fields.put("title", "b");

        assertEquals("a", entry.payload().get("title"));
        assertEquals(Map.of(), new StreamEntry("2-0", null).payload());
    }
}
