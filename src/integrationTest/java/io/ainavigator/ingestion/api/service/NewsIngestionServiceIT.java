package io.ainavigator.ingestion.api.service;

import com.github.tomakehurst.wiremock.junit5.WireMockExtension;
import io.ainavigator.ingestion.api.dto.ArticleQuery;
import io.ainavigator.ingestion.api.dto.IngestionReport;
import io.ainavigator.ingestion.api.dto.SourceOutcome;
import io.ainavigator.ingestion.config.KafkaProperties;
import io.ainavigator.ingestion.model.Article;
import io.ainavigator.ingestion.model.NewsSource;
import io.ainavigator.ingestion.model.SummaryStatus;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.RegisterExtension;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.KafkaContainer;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import java.util.UUID;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathMatching;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.wireMockConfig;
import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class NewsIngestionServiceIT {

    @Container
    static MongoDBContainer mongo = new MongoDBContainer(DockerImageName.parse("mongo:7.0"));

    @Container
    static KafkaContainer kafka = new KafkaContainer(DockerImageName.parse("confluentinc/cp-kafka:7.4.0"));

    @Container
    static GenericContainer<?> redis = new GenericContainer<>(DockerImageName.parse("redis:7-alpine"))
            .withExposedPorts(6379);

    @RegisterExtension
    static WireMockExtension wireMock = WireMockExtension.newInstance()
            .options(wireMockConfig().dynamicPort())
            .build();

    @Autowired
    private NewsIngestionService ingestionService;

    @Autowired
    private ArticleStore store;

    @Autowired
    private MongoTemplate mongoTemplate;

    @Autowired
    private KafkaProperties topics;

    private KafkaConsumer<String, String> testConsumer;

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.data.mongodb.uri", () -> mongo.getReplicaSetUrl("ai_navigator_it"));
        registry.add("spring.kafka.bootstrap-servers", kafka::getBootstrapServers);
        registry.add("spring.data.redis.host", redis::getHost);
        registry.add("spring.data.redis.port", () -> redis.getMappedPort(6379));

        registry.add("news.ingestion.enable-scheduling", () -> "false");
        registry.add("news.summarizer.base-url", wireMock::baseUrl);
        registry.add("news.summarizer.api-key", () -> "test-key");

        registry.add("news.sources[0].id", () -> "lab-blog");
        registry.add("news.sources[0].name", () -> "Lab Blog");
        registry.add("news.sources[0].url", wireMock::baseUrl);
        registry.add("news.sources[0].feed-url", () -> wireMock.baseUrl() + "/lab/feed");
        registry.add("news.sources[0].category", () -> "AI Research");
        registry.add("news.sources[0].enabled", () -> "true");

        registry.add("news.sources[1].id", () -> "broken");
        registry.add("news.sources[1].name", () -> "Broken Feed");
        registry.add("news.sources[1].url", wireMock::baseUrl);
        registry.add("news.sources[1].feed-url", () -> wireMock.baseUrl() + "/broken/feed");
        registry.add("news.sources[1].enabled", () -> "true");

        registry.add("news.sources[2].id", () -> "homepage");
        registry.add("news.sources[2].name", () -> "Homepage Only");
        registry.add("news.sources[2].url", wireMock::baseUrl);
        registry.add("news.sources[2].enabled", () -> "true");
    }

    @BeforeEach
    void setUp() {
        mongoTemplate.dropCollection(Article.class);

        Properties props = new Properties();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, kafka.getBootstrapServers());
        props.put(ConsumerConfig.GROUP_ID_CONFIG, "it-" + UUID.randomUUID());
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        testConsumer = new KafkaConsumer<>(props);

        String base = wireMock.baseUrl();
        wireMock.stubFor(get(urlEqualTo("/lab/feed")).willReturn(aResponse()
                .withStatus(200)
                .withHeader("Content-Type", "application/rss+xml")
                .withBody("""
                        <?xml version="1.0" encoding="UTF-8"?>
                        <rss version="2.0"><channel><title>Lab</title>
                        <item><title>Sparse experts</title><link>%1$s/posts/1</link>
                        <pubDate>Mon, 06 May 2024 10:00:00 GMT</pubDate><description>MoE news</description></item>
                        <item><title>Agents in the wild</title><link>%1$s/posts/2</link>
                        <pubDate>Mon, 06 May 2024 11:00:00 GMT</pubDate><description>Agent news</description></item>
                        <item><title>Vanished post</title><link>%1$s/posts/404</link>
                        <description>Only the feed knows</description></item>
                        </channel></rss>
                        """.formatted(base))));
        wireMock.stubFor(get(urlEqualTo("/broken/feed")).willReturn(aResponse().withStatus(404)));
        wireMock.stubFor(get(urlPathMatching("/posts/[12]")).willReturn(aResponse()
                .withStatus(200)
                .withHeader("Content-Type", "text/html")
                .withBody("<html><body><img class='hero-image' src='/img/lead.jpg'>"
                        + "<p>Long form article text.</p><script>x()</script></body></html>")));
        wireMock.stubFor(post(urlPathMatching("/v1beta/models/.*")).willReturn(aResponse()
                .withStatus(200)
                .withHeader("Content-Type", "application/json")
                .withBody("{\"candidates\":[{\"content\":{\"parts\":[{\"text\":\"Generated summary.\"}]}}]}")));
    }

    @AfterEach
    void tearDown() {
        if (testConsumer != null) {
            testConsumer.close();
        }
    }

    @Test
    @DisplayName("Should ingest feed end-to-end and stay idempotent on the next run")
    void shouldIngestEndToEnd() {
        assertThat(store.findAllSources()).extracting(NewsSource::id)
                .contains("lab-blog", "broken", "homepage");

        testConsumer.subscribe(List.of(topics.articleIngested(), topics.batchProcessed()));

        IngestionReport first = ingestionService.runIngestionCycle();

        assertThat(first.sources()).hasSize(2);
        assertThat(first.totalInserted()).isEqualTo(3);
        assertThat(first.trendingMarked()).isEqualTo(3);

        List<Article> stored = store.findArticles(new ArticleQuery(List.of(), null, 0, 20));
        assertThat(stored).hasSize(3);
        assertThat(stored).allSatisfy(article -> {
            assertThat(article.sourceId()).isEqualTo("lab-blog");
            assertThat(article.trending()).isTrue();
            assertThat(article.summaryStatus()).isEqualTo(SummaryStatus.GENERATED);
        });
        Article full = stored.stream().filter(a -> a.title().equals("Agents in the wild")).findFirst().orElseThrow();
        assertThat(full.content()).isEqualTo("Long form article text.");
        assertThat(full.imageUrl()).isEqualTo("/img/lead.jpg");
        Article degraded = stored.stream().filter(a -> a.title().equals("Vanished post")).findFirst().orElseThrow();
        assertThat(degraded.content()).isEqualTo("Only the feed knows");
        assertThat(degraded.imageUrl()).isNull();

        IngestionReport second = ingestionService.runIngestionCycle();
        assertThat(second.totalInserted()).isZero();
        assertThat(store.findRecentArticles(first.startedAt().minus(Duration.ofMinutes(1)))).hasSize(3);

        List<String> storedIds = stored.stream().map(Article::id).toList();
        List<ConsumerRecord<String, String>> records = new ArrayList<>();
        long deadline = System.currentTimeMillis() + 15000;
        while (!receivedAll(records, storedIds) && System.currentTimeMillis() < deadline) {
            ConsumerRecords<String, String> batch = testConsumer.poll(Duration.ofMillis(500));
            batch.forEach(records::add);
        }
        assertThat(records).filteredOn(r -> r.topic().equals(topics.articleIngested()))
                .extracting(ConsumerRecord::key)
                .containsAll(storedIds);
        assertThat(records).filteredOn(r -> r.topic().equals(topics.batchProcessed()))
                .extracting(ConsumerRecord::key)
                .contains("BATCH-" + first.runId(), "BATCH-" + second.runId());
    }

    private boolean receivedAll(List<ConsumerRecord<String, String>> records, List<String> articleIds) {
        List<String> keys = records.stream().map(ConsumerRecord::key).toList();
        return keys.containsAll(articleIds) && keys.stream().filter(key -> key.startsWith("BATCH-")).count() >= 2;
    }

    @Test
    @DisplayName("Disabling a source should keep it out of the next cycle")
    void shouldRespectDisabledSource() {
        assertThat(store.setSourceEnabled("lab-blog", false)).isTrue();
        try {
            IngestionReport report = ingestionService.runIngestionCycle();

            assertThat(report.sources()).extracting(SourceOutcome::sourceId).containsExactly("broken");
            assertThat(report.totalInserted()).isZero();
        } finally {
            store.setSourceEnabled("lab-blog", true);
        }
    }
}
