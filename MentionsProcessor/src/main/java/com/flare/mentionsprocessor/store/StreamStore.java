package com.flare.mentionsprocessor.store;

import com.flare.mentionsprocessor.dto.StreamEntry;

import java.time.Duration;
import java.util.List;

/**
 * Consumer-group surface of the stream store.
 *
 * <p>Implementations report store faults with Spring's
 * {@link org.springframework.dao.DataAccessException} hierarchy:
 * {@link org.springframework.data.redis.RedisConnectionFailureException} for a broken
 * connection and {@link org.springframework.dao.QueryTimeoutException} for a command timeout.</p>
 */
public interface StreamStore {

    /**
     * Creates the group at the start of the stream, creating the stream if needed.
     *
     * @return true if the group was created, false if it already existed
     */
    boolean createGroupIfAbsent(String stream, String group);

    /**
     * Blocking read of entries never delivered to any consumer of the group.
     *
     * @return delivered entries, empty when the wait elapsed with nothing new
     */
    List<StreamEntry> readNew(String stream, String group, String consumer, int count, Duration block);

    /**
     * Entries already delivered to this consumer and not yet acknowledged, with an id
     * greater than {@code afterId} ("0" for all of them). Does not block.
     */
    List<StreamEntry> readPending(String stream, String group, String consumer, String afterId, int count);

    /**
     * Removes the entry from the group's pending entries list.
     *
     * @return number of entries acknowledged (0 if it was not pending)
     */
    long acknowledge(String stream, String group, String entryId);

    /**
     * Reads from the beginning of the stream without a consumer group; nothing is
     * marked as delivered and nothing needs acknowledging.
     */
    List<StreamEntry> readFromStart(String stream, int count);

}
