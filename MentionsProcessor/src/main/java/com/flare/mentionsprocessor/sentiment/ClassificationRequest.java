package com.flare.mentionsprocessor.sentiment;

import java.util.Map;

/**
 * One request to the classification provider.
 *
 * @param systemPrompt   instruction sent as the system message
 * @param text           user text, already truncated
 * @param responseFormat response-shape constraint sent verbatim as response_format
 * @param maxTokens      upper bound on generated tokens
 */
public record ClassificationRequest(String systemPrompt,
                                    String text,
                                    Map<String, Object> responseFormat,
                                    int maxTokens) {
}
