package com.flare.mentionsprocessor.dto;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Decoded view of a stream payload. Every field is optional.
 */
@Value
@Builder
public class ArticleRecord {

    String title;
    String description;

    /**
     * Either a plain source name or a structure such as {"id": ..., "name": ...}.
     */
    Object source;

    String author;
    String url;
    String imageUrl;
    String publishedAt;
    String content;
    String searchKeyword;

    /**
     * Field map the record was decoded from, kept for the raw_data audit column.
     */
    Map<String, Object> rawData;

    /**
     * Flattens {@link #source} into a single name.
     */
    public String getSourceName() {
        if (source == null) {
            return null;
        }
        if (source instanceof Map) {
            Object name = ((Map<?, ?>) source).get("name");
            return name != null ? name.toString() : null;
        }
        return source.toString();
    }

    /**
     * Text submitted for sentiment classification: description, then title.
     */
    public String getSentimentText() {
        if (description != null && !description.isEmpty()) {
            return description;
        }
        if (title != null && !title.isEmpty()) {
            return title;
        }
        return "";
    }
}
