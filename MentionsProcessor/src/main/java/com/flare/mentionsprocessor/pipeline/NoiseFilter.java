package com.flare.mentionsprocessor.pipeline;

import com.flare.mentionsprocessor.dto.ArticleRecord;
import org.springframework.stereotype.Component;

/**
 * Drops articles too thin to be worth classifying.
 */
@Component
public class NoiseFilter {

    static final int MIN_TITLE_LENGTH = 10;
    static final int MIN_DESCRIPTION_LENGTH = 20;

    /**
     * @return true when the title is missing or under 10 characters,
     *         or the description is missing or under 20 characters
     */
    public boolean isNoise(ArticleRecord record) {
        return isShorterThan(record.getTitle(), MIN_TITLE_LENGTH)
                || isShorterThan(record.getDescription(), MIN_DESCRIPTION_LENGTH);
    }

    private boolean isShorterThan(String value, int minLength) {
        return value == null || value.codePointCount(0, value.length()) < minLength;
    }
}
