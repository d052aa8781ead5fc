package com.flare.mentionsprocessor.pipeline;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flare.mentionsprocessor.dto.ArticleRecord;
import com.flare.mentionsprocessor.dto.EnrichedMention;
import com.flare.mentionsprocessor.sentiment.SentimentResult;
import com.flare.mentionsprocessor.store.InsertResult;
import com.flare.mentionsprocessor.store.MentionRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.sql.Timestamp;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps an {@link EnrichedMention} to a mentions row and inserts it.
 *
 * <p>Every row is a plain insert. A redelivered entry produces a second row;
 * deduplication, if needed, happens downstream.</p>
 */
@Service
@Slf4j
public class MentionPersister {

    static final int CONTENT_PREVIEW_LENGTH = 255;

    private final MentionRepository mentionRepository;
    private final ObjectMapper objectMapper;

    public MentionPersister(MentionRepository mentionRepository, ObjectMapper objectMapper) {
        this.mentionRepository = mentionRepository;
        this.objectMapper = objectMapper;
    }

    /**
     * Never throws; a store fault is logged and reported in the result.
     */
    public PersistResult persist(EnrichedMention mention) {
        try {
            Map<String, Object> row = toRow(mention);
            InsertResult result = mentionRepository.insert(row);

            if (!result.isSuccess()) {
                log.error("Mention insert rejected: messageId={}, title={}, error={}",
                        mention.getEntryId(), mention.getArticle().getTitle(), result.error());
                return PersistResult.failed(result.error());
            }

            log.info("Persisted mention: id={}, messageId={}, sentiment={}",
                    result.id(), mention.getEntryId(), mention.getSentiment().label());
            return PersistResult.persisted(result.id());

        } catch (Exception e) {
            log.error("Error inserting mention: messageId={}, error={}", mention.getEntryId(), e.getMessage(), e);
            return PersistResult.failed(e.getMessage());
        }
    }

    Map<String, Object> toRow(EnrichedMention mention) {
        ArticleRecord article = mention.getArticle();
        SentimentResult sentiment = mention.getSentiment();

        Map<String, Object> row = new LinkedHashMap<>();
        row.put("source", article.getSourceName());
        row.put("author", article.getAuthor());
        row.put("title", article.getTitle());
        row.put("description", article.getDescription());
        row.put("url", article.getUrl());
        row.put("image_url", article.getImageUrl());
        row.put("published_at", parseTimestamp(article.getPublishedAt()));
        row.put("content_preview", preview(article.getContent()));
        row.put("sentiment_label", sentiment.label().name());
        row.put("sentiment_score", sentiment.score());
        row.put("raw_data", toJson(article.getRawData()));
        row.put("search_keyword", mention.getSearchKeyword());
        return row;
    }

    private String preview(String content) {
        if (content == null) {
            return "";
        }
        if (content.codePointCount(0, content.length()) <= CONTENT_PREVIEW_LENGTH) {
            return content;
        }
        return content.substring(0, content.offsetByCodePoints(0, CONTENT_PREVIEW_LENGTH));
    }

    private Timestamp parseTimestamp(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return Timestamp.from(Instant.parse(value));
        } catch (DateTimeParseException e) {
            try {
                return Timestamp.from(OffsetDateTime.parse(value).toInstant());
            } catch (DateTimeParseException inner) {
                log.warn("Could not parse published_at, storing null: {}", value);
                return null;
            }
        }
    }

    private String toJson(Map<String, Object> rawData) {
        if (rawData == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(rawData);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize raw_data: {}", e.getOriginalMessage());
            return null;
        }
    }
}
