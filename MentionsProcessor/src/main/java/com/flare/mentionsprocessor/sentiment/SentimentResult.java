package com.flare.mentionsprocessor.sentiment;

/**
 * Outcome of a sentiment classification.
 *
 * @param label       classification label, ERROR_* when degraded
 * @param score       confidence in [0.0, 1.0]; any other value is stored as 0.0
 * @param faultReason why the classification degraded, null for a clean result
 */
public record SentimentResult(SentimentLabel label, double score, String faultReason) {

    public SentimentResult {
        if (label == null) {
            label = SentimentLabel.UNKNOWN;
        }
        if (Double.isNaN(score) || score < 0.0 || score > 1.0) {
            score = 0.0;
        }
    }

    public static SentimentResult of(SentimentLabel label, double score) {
        return new SentimentResult(label, score, null);
    }

    public static SentimentResult degraded(SentimentLabel label, String faultReason) {
        return new SentimentResult(label, 0.0, faultReason);
    }

    public boolean isDegraded() {
        return faultReason != null || label.isError();
    }
}
