package com.flare.mentionsprocessor.dto;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A single entry delivered from the mentions stream.
 *
 * @param id      stream record id (e.g. "1718012345678-0"), unique within the stream
 * @param payload field map as stored in the stream
 */
public record StreamEntry(String id, Map<String, String> payload) {

    public StreamEntry {
        payload = payload != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(payload))
                : Map.of();
    }
}
