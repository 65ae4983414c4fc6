package io.ainavigator.ingestion.api.service;

import io.ainavigator.ingestion.api.dto.IngestionReport;
import io.ainavigator.ingestion.api.dto.kafka.ArticleIngestedEvent;
import io.ainavigator.ingestion.api.dto.kafka.BatchProcessedEvent;
import io.ainavigator.ingestion.config.KafkaProperties;
import io.ainavigator.ingestion.model.Article;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Service;

import java.util.concurrent.CompletableFuture;

/**
 * Announces new articles to downstream consumers (categorization, notifications).
 * Publishing is best-effort and never fails ingestion.
 */
@Service
public class EventPublisherService {

    private static final Logger logger = LoggerFactory.getLogger(EventPublisherService.class);

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final KafkaProperties topics;

    public EventPublisherService(KafkaTemplate<String, Object> kafkaTemplate, KafkaProperties topics) {
        this.kafkaTemplate = kafkaTemplate;
        this.topics = topics;
    }

    public void publishArticleIngested(Article article) {
        try {
            ArticleIngestedEvent event = ArticleIngestedEvent.create(article);

            CompletableFuture<SendResult<String, Object>> future =
                    kafkaTemplate.send(topics.articleIngested(), article.id(), event);

            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    logger.debug("Sent article ingested event: {} to partition: {}",
                            article.id(), result.getRecordMetadata().partition());
                } else {
                    logger.error("Failed to send article ingested event: {}", article.id(), ex);
                }
            });

        } catch (Exception e) {
            logger.error("Error publishing article ingested event for article: {}", article.id(), e);
        }
    }

    public void publishBatchProcessed(IngestionReport report) {
        try {
            BatchProcessedEvent event = BatchProcessedEvent.create(report);

            CompletableFuture<SendResult<String, Object>> future =
                    kafkaTemplate.send(topics.batchProcessed(), event.batchId(), event);

            future.whenComplete((result, ex) -> {
                if (ex == null) {
                    logger.info("Sent batch processed event: {} ({} new articles from {} sources)",
                            event.batchId(), event.newArticles(), event.sources());
                } else {
                    logger.error("Failed to send batch processed event: {}", event.batchId(), ex);
                }
            });

        } catch (Exception e) {
            logger.error("Error publishing batch processed event for run: {}", report.runId(), e);
        }
    }
}
