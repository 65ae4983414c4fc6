package io.ainavigator.ingestion.api.service;

import io.ainavigator.ingestion.api.dto.IngestionReport;
import io.ainavigator.ingestion.api.dto.SourceOutcome;
import io.ainavigator.ingestion.api.dto.kafka.ArticleIngestedEvent;
import io.ainavigator.ingestion.api.dto.kafka.BatchProcessedEvent;
import io.ainavigator.ingestion.config.KafkaProperties;
import io.ainavigator.ingestion.model.Article;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.kafka.core.KafkaTemplate;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static io.ainavigator.ingestion.model.ArticleFixtures.article;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EventPublisherServiceTest {

    @Mock
    private KafkaTemplate<String, Object> kafkaTemplate;

    private EventPublisherService service;

    @BeforeEach
    void setUp() {
        var topics = new KafkaProperties("test-article-ingested", "test-batch-processed");
        service = new EventPublisherService(kafkaTemplate, topics);
    }

    @Test
    void shouldPublishArticleIngestedEvent() {
        when(kafkaTemplate.send(anyString(), anyString(), any())).thenReturn(new CompletableFuture<>());
        Article article = article("123", Instant.parse("2024-05-06T10:00:00Z"));

        service.publishArticleIngested(article);

        ArgumentCaptor<Object> event = ArgumentCaptor.forClass(Object.class);
        verify(kafkaTemplate).send(eq("test-article-ingested"), eq("123"), event.capture());
        assertThat(event.getValue()).isInstanceOfSatisfying(ArticleIngestedEvent.class, e -> {
            assertThat(e.articleId()).isEqualTo("123");
            assertThat(e.url()).isEqualTo("https://example.com/123");
        });
    }

    @Test
    void shouldPublishBatchProcessedEvent() {
        when(kafkaTemplate.send(anyString(), anyString(), any())).thenReturn(new CompletableFuture<>());
        IngestionReport report = new IngestionReport("abc12345", Instant.now(), 1200, List.of(
                new SourceOutcome("s1", "One", 10, 4, 6, null),
                SourceOutcome.failed("s2", "Two", "timeout")
        ), 3, false);

        service.publishBatchProcessed(report);

        ArgumentCaptor<Object> event = ArgumentCaptor.forClass(Object.class);
        verify(kafkaTemplate).send(eq("test-batch-processed"), eq("BATCH-abc12345"), event.capture());
        assertThat(event.getValue()).isInstanceOfSatisfying(BatchProcessedEvent.class, e -> {
            assertThat(e.sources()).isEqualTo(2);
            assertThat(e.failedSources()).isEqualTo(1);
            assertThat(e.totalArticles()).isEqualTo(10);
            assertThat(e.newArticles()).isEqualTo(4);
            assertThat(e.trendingMarked()).isEqualTo(3);
        });
    }

    @Test
    void shouldNotFailWhenBrokerUnavailable() {
        when(kafkaTemplate.send(anyString(), anyString(), any())).thenThrow(new IllegalStateException("no broker"));

        assertThatCode(() -> service.publishArticleIngested(article("1", Instant.now())))
                .doesNotThrowAnyException();
    }
}
