package com.flare.mentionsprocessor.dto;

import com.flare.mentionsprocessor.sentiment.SentimentResult;
import lombok.Builder;
import lombok.Value;

/**
 * An article that passed the noise filter, joined with its sentiment.
 */
@Value
@Builder
public class EnrichedMention {

    /** Stream id the mention was read from, used for log correlation only. */
    String entryId;

    ArticleRecord article;

    SentimentResult sentiment;

    public String getSearchKeyword() {
        return article.getSearchKeyword();
    }
}
