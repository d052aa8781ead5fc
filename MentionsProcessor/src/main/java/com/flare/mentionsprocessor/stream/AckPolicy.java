package com.flare.mentionsprocessor.stream;

import com.flare.mentionsprocessor.pipeline.PipelineOutcome;

/**
 * When a delivered entry is acknowledged.
 */
public enum AckPolicy {

    /**
     * Acknowledge whenever the pipeline returns, whatever its outcome.
     * Favors forward progress: failed entries are dropped, never redelivered.
     */
    ALWAYS {
        @Override
        public boolean shouldAcknowledge(PipelineOutcome outcome) {
            return true;
        }

        @Override
        public boolean retries() {
            return false;
        }
    },

    /**
     * Retry retryable outcomes a bounded number of times and acknowledge only
     * successful ones. Entries that still fail stay in the pending entries list.
     */
    ON_SUCCESS {
        @Override
        public boolean shouldAcknowledge(PipelineOutcome outcome) {
            return outcome.isSuccessful();
        }

        @Override
        public boolean retries() {
            return true;
        }
    };

    public abstract boolean shouldAcknowledge(PipelineOutcome outcome);

    public abstract boolean retries();
}
