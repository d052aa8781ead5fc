package com.flare.mentionsprocessor.pipeline;

import com.flare.mentionsprocessor.dto.ArticleRecord;
import com.flare.mentionsprocessor.dto.EnrichedMention;
import com.flare.mentionsprocessor.dto.StreamEntry;
import com.flare.mentionsprocessor.sentiment.SentimentClassifier;
import com.flare.mentionsprocessor.sentiment.SentimentResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Runs one stream entry through decode, noise filter, sentiment and persistence.
 * Stage failures are absorbed and reported through the returned outcome.
 */
@Service
@Slf4j
public class MentionPipeline {

    private final RecordDecoder recordDecoder;
    private final NoiseFilter noiseFilter;
    private final SentimentClassifier sentimentClassifier;
    private final MentionPersister mentionPersister;

    public MentionPipeline(RecordDecoder recordDecoder,
                           NoiseFilter noiseFilter,
                           SentimentClassifier sentimentClassifier,
                           MentionPersister mentionPersister) {
        this.recordDecoder = recordDecoder;
        this.noiseFilter = noiseFilter;
        this.sentimentClassifier = sentimentClassifier;
        this.mentionPersister = mentionPersister;
    }

    public PipelineOutcome process(StreamEntry entry) {
        Optional<ArticleRecord> decoded = recordDecoder.decode(entry);
        if (decoded.isEmpty()) {
            log.warn("Dropping undecodable message: messageId={}", entry.id());
            return PipelineOutcome.DECODE_FAILED;
        }

        ArticleRecord article = decoded.get();
        log.debug("Processing message {}: {}", entry.id(), article.getTitle());

        if (noiseFilter.isNoise(article)) {
            log.info("Article '{}' filtered out as noise, messageId={}", article.getTitle(), entry.id());
            return PipelineOutcome.FILTERED;
        }

        SentimentResult sentiment = sentimentClassifier.classify(article.getSentimentText());
        if (sentiment.isDegraded()) {
            log.warn("Sentiment degraded for messageId={}: label={}, reason={}",
                    entry.id(), sentiment.label(), sentiment.faultReason());
        } else {
            log.debug("Sentiment for '{}': {} ({})", article.getTitle(), sentiment.label(), sentiment.score());
        }

        EnrichedMention mention = EnrichedMention.builder()
                .entryId(entry.id())
                .article(article)
                .sentiment(sentiment)
                .build();

        PersistResult result = mentionPersister.persist(mention);
        return result.isPersisted() ? PipelineOutcome.PERSISTED : PipelineOutcome.PERSIST_FAILED;
    }
}
