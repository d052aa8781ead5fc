package com.flare.mentionsprocessor.sentiment;

/**
 * Labels stored in mentions.sentiment_label. The ERROR_* values mark a
 * classification that degraded instead of failing the pipeline.
 */
public enum SentimentLabel {

    POSITIVE,
    NEGATIVE,
    NEUTRAL,
    UNKNOWN,
    ERROR_JSON_DECODE,
    ERROR_PARSING,
    ERROR_API,
    ERROR_HTTP,
    ERROR_UNKNOWN;

    /**
     * Labels the provider is allowed to return.
     */
    public boolean isProviderLabel() {
        return this == POSITIVE || this == NEGATIVE || this == NEUTRAL;
    }

    public boolean isError() {
        return name().startsWith("ERROR_");
    }

    /**
     * Maps a provider label to its enum value. Anything outside
     * POSITIVE/NEGATIVE/NEUTRAL becomes UNKNOWN.
     */
    public static SentimentLabel fromProvider(String value) {
        if (value == null) {
            return UNKNOWN;
        }
        for (SentimentLabel label : values()) {
            if (label.isProviderLabel() && label.name().equals(value)) {
                return label;
            }
        }
        return UNKNOWN;
    }
}
