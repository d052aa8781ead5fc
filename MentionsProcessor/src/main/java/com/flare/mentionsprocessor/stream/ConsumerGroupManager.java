package com.flare.mentionsprocessor.stream;

import com.flare.mentionsprocessor.config.MentionsProcessorProperties;
import com.flare.mentionsprocessor.dto.StreamEntry;
import com.flare.mentionsprocessor.exception.GroupProvisioningException;
import com.flare.mentionsprocessor.pipeline.MentionPipeline;
import com.flare.mentionsprocessor.pipeline.PipelineOutcome;
import com.flare.mentionsprocessor.store.StreamStore;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.stereotype.Service;

import java.net.InetAddress;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Drives the consumer-group protocol on the mentions stream.
 *
 * <p>Provisions the group once at startup, then a single background thread
 * repeatedly reads at most one new entry, passes it through the
 * {@link MentionPipeline} and acknowledges it according to the configured
 * {@link AckPolicy}. Store connectivity faults are retried with a fixed backoff
 * and the group is provisioned again before reads resume. Under
 * {@link AckPolicy#ON_SUCCESS} the consumer first re-processes its own pending
 * entries left over from an earlier run.</p>
 *
 * <p>Several processes may share the same group; the server decides which
 * consumer receives each entry. Reads always use the "never delivered" cursor
 * ({@code >}), so two consumers never receive the same pending entry.</p>
 */
@Service
@Slf4j
public class ConsumerGroupManager {

    private static final int FETCH_COUNT = 1;

    private final StreamStore streamStore;
    private final MentionPipeline pipeline;
    private final MentionsProcessorProperties.Consumer settings;
    private final MentionsProcessorProperties.Sentiment sentimentSettings;
    private final String streamKey;
    private final String consumerGroup;
    private final String consumerName;

    private volatile boolean stopRequested;
    private volatile boolean running;
    private ExecutorService executor;

    public ConsumerGroupManager(StreamStore streamStore,
                                MentionPipeline pipeline,
                                MentionsProcessorProperties properties) {
        this.streamStore = streamStore;
        this.pipeline = pipeline;
        this.settings = properties.getConsumer();
        this.sentimentSettings = properties.getSentiment();
        this.streamKey = properties.getStream().getKey();
        this.consumerGroup = properties.getStream().getConsumerGroup();
        this.consumerName = resolveConsumerName(properties.getStream());
    }

    @PostConstruct
    public void init() {
        if (!settings.isEnabled()) {
            log.info("Stream consumer disabled (mentions.consumer.enabled=false)");
            return;
        }
        start();
    }

    /**
     * Provisions the group and launches the read loop on a dedicated thread.
     *
     * @throws GroupProvisioningException if the group cannot be provisioned; the consumer is not started
     */
    public synchronized void start() {
        if (executor != null) {
            log.warn("Stream consumer already running");
            return;
        }
        log.info("Starting stream consumer: stream={}, group={}, consumer={}, ackPolicy={}",
                streamKey, consumerGroup, consumerName, settings.getAckPolicy());

        ensureGroup(streamKey, consumerGroup);

        stopRequested = false;
        executor = Executors.newSingleThreadExecutor(runnable -> new Thread(runnable, "mentions-consumer"));
        executor.submit(() -> run(streamKey, consumerGroup, consumerName));
    }

    /**
     * Creates the group at the start of the stream if it does not exist yet.
     * An existing group counts as success.
     */
    public void ensureGroup(String stream, String group) {
        boolean created;
        try {
            created = streamStore.createGroupIfAbsent(stream, group);
        } catch (Exception e) {
            throw new GroupProvisioningException(
                    "Cannot provision consumer group: stream=" + stream + ", group=" + group, e);
        }
        if (created) {
            log.info("Created consumer group: stream={}, group={}", stream, group);
        } else {
            log.debug("Consumer group already exists: stream={}, group={}", stream, group);
        }
    }

    /**
     * Read loop. Returns only when a stop was requested; store faults, including a
     * failed re-provisioning of the group, are retried after a backoff.
     */
    public void run(String stream, String group, String consumer) {
        running = true;
        boolean reprovision = false;
        boolean recoverPending = settings.getAckPolicy().retries();

        while (!stopRequested) {
            try {
                if (reprovision) {
                    ensureGroup(stream, group);
                    reprovision = false;
                }
                if (recoverPending) {
                    recoverPending(stream, group, consumer);
                    recoverPending = false;
                }
                pollOnce(stream, group, consumer);

            } catch (GroupProvisioningException e) {
                if (!backoffOnStoreFault(e.getCause())) {
                    log.error("Cannot provision consumer group, retrying in {} ms: {}",
                            settings.getConnectionBackoff().toMillis(), e.getMessage(), e);
                    sleep(settings.getConnectionBackoff());
                }
            } catch (RuntimeException e) {
                if (!backoffOnStoreFault(e)) {
                    log.error("Error in stream consumer loop: stream={}, error={}", stream, e.getMessage(), e);
                    sleep(settings.getConnectionBackoff());
                }
                // the server may have restarted without the group (NOGROUP)
                reprovision = true;
            }
        }

        running = false;
        log.info("Stream consumer stopped: stream={}, consumer={}", stream, consumer);
    }

    /**
     * Reads at most one new entry and handles it.
     *
     * @return number of entries handled
     */
    int pollOnce(String stream, String group, String consumer) {
        List<StreamEntry> entries = streamStore.readNew(stream, group, consumer, FETCH_COUNT, settings.getBlockTimeout());
        for (StreamEntry entry : entries) {
            handle(stream, group, entry);
        }
        return entries.size();
    }

    /**
     * Runs this consumer's unacknowledged entries through the pipeline again,
     * oldest first. Entries that fail again stay pending and are skipped.
     *
     * @return number of pending entries handled
     */
    int recoverPending(String stream, String group, String consumer) {
        String cursor = "0";
        int handled = 0;

        while (!stopRequested) {
            List<StreamEntry> entries = streamStore.readPending(stream, group, consumer, cursor, FETCH_COUNT);
            if (entries.isEmpty()) {
                break;
            }
            for (StreamEntry entry : entries) {
                handle(stream, group, entry);
                cursor = entry.id();
                handled++;
            }
        }

        if (handled > 0) {
            log.info("Re-processed {} pending messages: stream={}, consumer={}", handled, stream, consumer);
        }
        return handled;
    }

    private void handle(String stream, String group, StreamEntry entry) {
        log.debug("Received message: stream={}, messageId={}", stream, entry.id());

        AckPolicy ackPolicy = settings.getAckPolicy();
        PipelineOutcome outcome = ackPolicy.retries() ? processWithRetry(entry) : pipeline.process(entry);

        if (ackPolicy.shouldAcknowledge(outcome)) {
            long acked = streamStore.acknowledge(stream, group, entry.id());
            if (acked > 0) {
                log.info("Acknowledged message {} ({})", entry.id(), outcome);
            } else {
                log.warn("Message {} was not pending in group {} when acknowledged", entry.id(), group);
            }
        } else {
            log.error("Message {} left pending after outcome {}: stream={}, group={}",
                    entry.id(), outcome, stream, group);
        }
    }

    private PipelineOutcome processWithRetry(StreamEntry entry) {
        int maxAttempts = settings.getMaxAttempts();
        PipelineOutcome outcome = pipeline.process(entry);
        int attempts = 1;

        while (outcome.isRetryable() && attempts < maxAttempts) {
            log.warn("Processing attempt {} failed for messageId={}: {}", attempts, entry.id(), outcome);
            sleep(settings.getRetryDelay());
            outcome = pipeline.process(entry);
            attempts++;
        }
        return outcome;
    }

    /**
     * Sleeps for the backoff matching a store connectivity fault.
     *
     * @return false if the fault is not a connectivity fault
     */
    private boolean backoffOnStoreFault(Throwable fault) {
        if (fault instanceof RedisConnectionFailureException) {
            log.warn("Stream store connection error: {}. Retrying in {} ms",
                    fault.getMessage(), settings.getConnectionBackoff().toMillis());
            sleep(settings.getConnectionBackoff());
            return true;
        }
        if (fault instanceof QueryTimeoutException) {
            log.warn("Stream store command timed out: {}. Retrying in {} ms",
                    fault.getMessage(), settings.getTimeoutBackoff().toMillis());
            sleep(settings.getTimeoutBackoff());
            return true;
        }
        return false;
    }

    private void sleep(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            log.warn("Consumer backoff interrupted, stopping");
            stopRequested = true;
        }
    }

    /**
     * Makes the loop exit after the entry in flight has been handled.
     */
    public void requestStop() {
        stopRequested = true;
    }

    public boolean isRunning() {
        return running;
    }

    public String getConsumerName() {
        return consumerName;
    }

    /**
     * Time shutdown waits for the loop: the configured timeout, raised to cover
     * one blocking read plus every classification attempt of the message in flight.
     */
    Duration shutdownWait() {
        int attempts = settings.getAckPolicy().retries() ? settings.getMaxAttempts() : 1;
        Duration perAttempt = Duration.ofMillis(
                (long) sentimentSettings.getConnectTimeoutMs() + sentimentSettings.getReadTimeoutMs());
        Duration worstCase = settings.getBlockTimeout()
                .plus(perAttempt.multipliedBy(attempts))
                .plus(settings.getRetryDelay().multipliedBy(attempts - 1L));
        return worstCase.compareTo(settings.getShutdownTimeout()) > 0 ? worstCase : settings.getShutdownTimeout();
    }

    @PreDestroy
    public synchronized void stop() {
        requestStop();
        if (executor == null) {
            return;
        }
        log.info("Shutting down stream consumer, waiting for the in-flight message");
        executor.shutdown();
        Duration wait = shutdownWait();
        try {
            if (!executor.awaitTermination(wait.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Stream consumer did not stop within {}", wait);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        executor = null;
    }

    private static String resolveConsumerName(MentionsProcessorProperties.Stream stream) {
        if (stream.getConsumerName() != null && !stream.getConsumerName().isBlank()) {
            return stream.getConsumerName();
        }
        String host;
        try {
            host = InetAddress.getLocalHost().getHostName();
        } catch (Exception e) {
            log.warn("Could not get hostname, using pid only for consumer name");
            host = "local";
        }
        return stream.getConsumerNamePrefix() + host + "_" + ProcessHandle.current().pid();
    }
}
