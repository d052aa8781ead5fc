package com.flare.mentionsprocessor.controller;

import com.flare.mentionsprocessor.config.MentionsProcessorProperties;
import com.flare.mentionsprocessor.dto.StreamEntry;
import com.flare.mentionsprocessor.pipeline.MentionPipeline;
import com.flare.mentionsprocessor.pipeline.PipelineOutcome;
import com.flare.mentionsprocessor.store.StreamStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Liveness endpoint and a manual trigger that runs the first stream entry
 * through the pipeline outside the consumer group.
 */
@RestController
@Slf4j
public class WorkerController {

    private final StreamStore streamStore;
    private final MentionPipeline pipeline;
    private final String streamKey;

    public WorkerController(StreamStore streamStore,
                            MentionPipeline pipeline,
                            MentionsProcessorProperties properties) {
        this.streamStore = streamStore;
        this.pipeline = pipeline;
        this.streamKey = properties.getStream().getKey();
    }

    @GetMapping("/")
    public Map<String, String> root() {
        return Map.of("message", "Mentions Processor Worker is running.");
    }

    /**
     * Processes the oldest entry of the stream once. The entry is neither claimed
     * nor acknowledged, so the consumer group will still deliver it.
     */
    @PostMapping("/trigger-process/")
    public ResponseEntity<Map<String, Object>> triggerProcessing() {
        List<StreamEntry> entries;
        try {
            entries = streamStore.readFromStart(streamKey, 1);
        } catch (DataAccessException e) {
            log.error("Manual trigger could not read stream {}: {}", streamKey, e.getMessage());
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body(Map.of("detail", "Stream store not available."));
        }

        if (entries.isEmpty()) {
            return ResponseEntity.ok(Map.of("message", "No messages in stream to process right now."));
        }

        StreamEntry entry = entries.get(0);
        PipelineOutcome outcome = pipeline.process(entry);
        log.info("Manual trigger processed message {}: {}", entry.id(), outcome);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "Processed one message from stream (for testing).");
        body.put("processed_id", entry.id());
        body.put("outcome", outcome.name());
        return ResponseEntity.ok(body);
    }
}
