package com.flare.mentionsprocessor.config;

import com.flare.mentionsprocessor.stream.AckPolicy;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Typed binding for all mentions.* configuration.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "mentions")
public class MentionsProcessorProperties {

    @Valid
    private Stream stream = new Stream();

    @Valid
    private Consumer consumer = new Consumer();

    @Valid
    private Sentiment sentiment = new Sentiment();

    @Data
    public static class Stream {

        /** Valkey stream key the ingest side appends articles to. */
        @NotBlank
        private String key = "mentions_stream";

        @NotBlank
        private String consumerGroup = "mentions_processor_group";

        /** Prefix for the generated consumer name (prefix + hostname + pid). */
        private String consumerNamePrefix = "consumer_";

        /** Explicit consumer name; overrides the generated one when set. */
        private String consumerName;
    }

    @Data
    public static class Consumer {

        /** Starts the background read loop on application startup. */
        private boolean enabled = true;

        /** Upper bound on a single blocking read. */
        private Duration blockTimeout = Duration.ofSeconds(10);

        /** Pause after a broken connection to the stream store. */
        private Duration connectionBackoff = Duration.ofSeconds(5);

        /** Pause after a command timeout reported by the stream store. */
        private Duration timeoutBackoff = Duration.ofSeconds(1);

        private AckPolicy ackPolicy = AckPolicy.ALWAYS;

        /** Pipeline attempts per entry under ON_SUCCESS. */
        @Min(1)
        private int maxAttempts = 3;

        private Duration retryDelay = Duration.ofSeconds(2);

        /** How long shutdown waits for the in-flight message to be acknowledged. */
        private Duration shutdownTimeout = Duration.ofSeconds(15);
    }

    @Data
    public static class Sentiment {

        /** Blank means the provider is not configured and every text is NEUTRAL/0.5. */
        private String apiKey;

        private String baseUrl = "https://api.openai.com/v1";

        private String model = "gpt-4o-mini";

        @Min(1)
        private int maxTokens = 50;

        @Min(1)
        private int maxInputChars = 2000;

        private int connectTimeoutMs = 5000;

        private int readTimeoutMs = 20000;

        public boolean isConfigured() {
            return apiKey != null && !apiKey.isBlank();
        }
    }
}
