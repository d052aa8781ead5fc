package com.flare.mentionsprocessor.store;

import com.flare.mentionsprocessor.dto.StreamEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.stream.Consumer;
import org.springframework.data.redis.connection.stream.MapRecord;
import org.springframework.data.redis.connection.stream.ReadOffset;
import org.springframework.data.redis.connection.stream.StreamOffset;
import org.springframework.data.redis.connection.stream.StreamReadOptions;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.data.redis.core.StreamOperations;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link StreamStore} backed by Valkey streams through Spring Data Redis.
 */
@Component
@Slf4j
public class ValkeyStreamStore implements StreamStore {

    private static final String BUSYGROUP = "BUSYGROUP";

    private final RedisTemplate<String, String> redisTemplate;

    public ValkeyStreamStore(RedisTemplate<String, String> redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public boolean createGroupIfAbsent(String stream, String group) {
        try {
            // XGROUP CREATE <stream> <group> 0 MKSTREAM
            redisTemplate.opsForStream().createGroup(stream, ReadOffset.from("0"), group);
            return true;
        } catch (DataAccessException e) {
            if (isBusyGroup(e)) {
                return false;
            }
            throw e;
        }
    }

    @Override
    @SuppressWarnings("unchecked")
    public List<StreamEntry> readNew(String stream, String group, String consumer, int count, Duration block) {
        StreamOperations<String, String, String> ops = redisTemplate.opsForStream();
        List<MapRecord<String, String, String>> records = ops.read(
                Consumer.from(group, consumer),
                StreamReadOptions.empty().count(count).block(block),
                StreamOffset.create(stream, ReadOffset.lastConsumed()));
        return toEntries(records);
    }

    @Override
    @SuppressWarnings("unchecked")
    public List<StreamEntry> readPending(String stream, String group, String consumer, String afterId, int count) {
        StreamOperations<String, String, String> ops = redisTemplate.opsForStream();
        // XREADGROUP with an explicit id reads this consumer's pending entries list
        List<MapRecord<String, String, String>> records = ops.read(
                Consumer.from(group, consumer),
                StreamReadOptions.empty().count(count),
                StreamOffset.create(stream, ReadOffset.from(afterId)));
        return toEntries(records);
    }

    @Override
    public long acknowledge(String stream, String group, String entryId) {
        Long acked = redisTemplate.opsForStream().acknowledge(stream, group, entryId);
        return acked != null ? acked : 0L;
    }

    @Override
    @SuppressWarnings("unchecked")
    public List<StreamEntry> readFromStart(String stream, int count) {
        StreamOperations<String, String, String> ops = redisTemplate.opsForStream();
        List<MapRecord<String, String, String>> records = ops.read(
                StreamReadOptions.empty().count(count),
                StreamOffset.create(stream, ReadOffset.from("0-0")));
        return toEntries(records);
    }

    private List<StreamEntry> toEntries(List<MapRecord<String, String, String>> records) {
        if (records == null || records.isEmpty()) {
            return List.of();
        }
        List<StreamEntry> entries = new ArrayList<>(records.size());
        for (MapRecord<String, String, String> record : records) {
            entries.add(new StreamEntry(record.getId().getValue(), record.getValue()));
        }
        return entries;
    }

    /**
     * The server answers BUSYGROUP when the group exists; the driver wraps it
     * at varying depths depending on the exception translation in use.
     */
    static boolean isBusyGroup(Throwable e) {
        Throwable current = e;
        while (current != null) {
            String message = current.getMessage();
            if (message != null && message.contains(BUSYGROUP)) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return false;
    }
}
