package com.flare.mentionsprocessor.sentiment;

import com.flare.mentionsprocessor.exception.ClassificationProviderException;

/**
 * Request/response surface of the sentiment classification provider.
 */
public interface ClassificationClient {

    /** False when no credentials are configured; no call must be made then. */
    boolean isConfigured();

    /**
     * Sends one classification request.
     *
     * @return the primary content of the response (expected to be a JSON object
     *         with label and score), or null when the response carried none
     * @throws ClassificationProviderException when the provider request fails
     */
    String complete(ClassificationRequest request);

}
