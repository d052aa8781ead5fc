package com.flare.mentionsprocessor.pipeline;

/**
 * Terminal state reached by one pass of {@link MentionPipeline}.
 */
public enum PipelineOutcome {

    /** Payload could not be decoded; retrying cannot help. */
    DECODE_FAILED(false, false),

    /** Classified as noise and skipped. */
    FILTERED(true, false),

    PERSISTED(true, false),

    /** The insert failed; a later attempt may succeed. */
    PERSIST_FAILED(false, true);

    private final boolean successful;
    private final boolean retryable;

    PipelineOutcome(boolean successful, boolean retryable) {
        this.successful = successful;
        this.retryable = retryable;
    }

    public boolean isSuccessful() {
        return successful;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
