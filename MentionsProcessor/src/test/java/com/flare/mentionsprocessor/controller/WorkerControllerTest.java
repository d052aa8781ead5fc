package com.flare.mentionsprocessor.controller;

import com.flare.mentionsprocessor.dto.StreamEntry;
import com.flare.mentionsprocessor.pipeline.MentionPipeline;
import com.flare.mentionsprocessor.pipeline.PipelineOutcome;
import com.flare.mentionsprocessor.store.StreamStore;
import com.flare.mentionsprocessor.support.TestProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class WorkerControllerTest {

    private StreamStore streamStore;
    private MentionPipeline pipeline;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        streamStore = mock(StreamStore.class);
        pipeline = mock(MentionPipeline.class);
        mockMvc = MockMvcBuilders
                .standaloneSetup(new WorkerController(streamStore, pipeline, TestProperties.fast()))
                .build();
    }

    @Test
    void rootReportsLiveness() throws Exception {
        mockMvc.perform(get("/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Mentions Processor Worker is running."));
    }

    @Test
    void triggerProcessesOldestEntryWithoutAcknowledging() throws Exception {
        StreamEntry entry = new StreamEntry("1718012345678-0", Map.of("title", "Some article title"));
        when(streamStore.readFromStart(TestProperties.STREAM, 1)).thenReturn(List.of(entry));
        when(pipeline.process(entry)).thenReturn(PipelineOutcome.PERSISTED);

        mockMvc.perform(post("/trigger-process/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Processed one message from stream (for testing)."))
                .andExpect(jsonPath("$.processed_id").value("1718012345678-0"))
                .andExpect(jsonPath("$.outcome").value("PERSISTED"));

        verify(streamStore, never()).acknowledge(anyString(), anyString(), anyString());
    }

    @Test
    void triggerOnEmptyStream() throws Exception {
        when(streamStore.readFromStart(TestProperties.STREAM, 1)).thenReturn(List.of());

        mockMvc.perform(post("/trigger-process/"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("No messages in stream to process right now."));

        verifyNoInteractions(pipeline);
    }

    @Test
    void triggerWithStoreDown() throws Exception {
        when(streamStore.readFromStart(TestProperties.STREAM, 1))
                .thenThrow(new RedisConnectionFailureException("Connection refused"));

        mockMvc.perform(post("/trigger-process/"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.detail").value("Stream store not available."));
    }
}
