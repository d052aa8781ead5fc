package com.flare.mentionsprocessor.support;

import com.flare.mentionsprocessor.dto.StreamEntry;
import com.flare.mentionsprocessor.store.StreamStore;
import org.springframework.data.redis.RedisSystemException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Consumer-group stream store kept in memory. Mirrors the server rules the
 * processor relies on: {@code >} reads hand each entry to exactly one consumer
 * of a group, delivered entries stay pending until acknowledged.
 * Blocking reads return immediately.
 */
public class InMemoryStreamStore implements StreamStore {

    private final Map<String, List<StreamEntry>> streams = new HashMap<>();
    private final Map<String, GroupState> groups = new HashMap<>();
    private long sequence;

    public synchronized String append(String stream, Map<String, String> fields) {
        String id = (++sequence) + "-0";
        streams.computeIfAbsent(stream, k -> new ArrayList<>()).add(new StreamEntry(id, fields));
        return id;
    }

    @Override
    public synchronized boolean createGroupIfAbsent(String stream, String group) {
        streams.computeIfAbsent(stream, k -> new ArrayList<>());
        if (groups.containsKey(key(stream, group))) {
            return false;
        }
        groups.put(key(stream, group), new GroupState());
        return true;
    }

    @Override
    public synchronized List<StreamEntry> readNew(String stream, String group, String consumer, int count, Duration block) {
        GroupState state = groups.get(key(stream, group));
        if (state == null) {
            throw new RedisSystemException("NOGROUP No such key '" + stream + "' or consumer group '" + group + "'", null);
        }
        List<StreamEntry> all = streams.getOrDefault(stream, List.of());
        List<StreamEntry> delivered = new ArrayList<>();
        while (delivered.size() < count && state.nextIndex < all.size()) {
            StreamEntry entry = all.get(state.nextIndex++);
            state.pending.put(entry.id(), consumer);
            state.deliveries.computeIfAbsent(consumer, k -> new ArrayList<>()).add(entry.id());
            delivered.add(entry);
        }
        return delivered;
    }

    @Override
    public synchronized List<StreamEntry> readPending(String stream, String group, String consumer, String afterId, int count) {
        GroupState state = groups.get(key(stream, group));
        if (state == null) {
            throw new RedisSystemException("NOGROUP No such key '" + stream + "' or consumer group '" + group + "'", null);
        }
        long after = sequenceOf(afterId);
        List<StreamEntry> pending = new ArrayList<>();
        for (StreamEntry entry : streams.getOrDefault(stream, List.of())) {
            if (pending.size() == count) {
                break;
            }
            if (sequenceOf(entry.id()) > after && consumer.equals(state.pending.get(entry.id()))) {
                pending.add(entry);
            }
        }
        return pending;
    }

    @Override
    public synchronized long acknowledge(String stream, String group, String entryId) {
        GroupState state = groups.get(key(stream, group));
        if (state == null || state.pending.remove(entryId) == null) {
            return 0;
        }
        state.ackCounts.merge(entryId, 1, Integer::sum);
        return 1;
    }

    @Override
    public synchronized List<StreamEntry> readFromStart(String stream, int count) {
        List<StreamEntry> all = streams.getOrDefault(stream, List.of());
        return new ArrayList<>(all.subList(0, Math.min(count, all.size())));
    }

    public synchronized List<String> pendingIds(String stream, String group) {
        return new ArrayList<>(groups.get(key(stream, group)).pending.keySet());
    }

    public synchronized int ackCount(String stream, String group, String entryId) {
        return groups.get(key(stream, group)).ackCounts.getOrDefault(entryId, 0);
    }

    public synchronized List<String> deliveredTo(String stream, String group, String consumer) {
        return new ArrayList<>(groups.get(key(stream, group)).deliveries.getOrDefault(consumer, List.of()));
    }

    private static long sequenceOf(String id) {
        int dash = id.indexOf('-');
        return Long.parseLong(dash < 0 ? id : id.substring(0, dash));
    }

    private static String key(String stream, String group) {
        return stream + "|" + group;
    }

    private static final class GroupState {
        private int nextIndex;
        private final Map<String, String> pending = new LinkedHashMap<>();
        private final Map<String, Integer> ackCounts = new HashMap<>();
        private final Map<String, List<String>> deliveries = new HashMap<>();
    }
}
