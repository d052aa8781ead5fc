package com.flare.mentionsprocessor.store;

import java.util.Map;

/**
 * Insert-only surface of the mentions collection.
 */
public interface MentionRepository {

    /**
     * Inserts one row; keys are column names.
     */
    InsertResult insert(Map<String, Object> row);

}
