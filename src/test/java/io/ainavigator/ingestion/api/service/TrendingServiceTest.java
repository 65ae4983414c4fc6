package io.ainavigator.ingestion.api.service;

import io.ainavigator.ingestion.model.Article;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.List;

import static io.ainavigator.ingestion.model.ArticleFixtures.article;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TrendingServiceTest {

    private static final Instant SINCE = Instant.parse("2024-05-03T00:00:00Z");

    @Mock
    private ArticleStore store;

    private TrendingService service;

    @BeforeEach
    void setUp() {
        service = new TrendingService(store, new TrendMarker(3));
    }

    @Test
    @DisplayName("Should persist only newly flagged articles")
    void shouldPersistNewFlags() {
        List<Article> recent = List.of(
                article("a", SINCE.plusSeconds(40)).withTrending(true),
                article("b", SINCE.plusSeconds(30)),
                article("c", SINCE.plusSeconds(20)),
                article("d", SINCE.plusSeconds(10))
        );
        when(store.findRecentArticles(SINCE)).thenReturn(recent);
        when(store.markTrending(List.of("b", "c"))).thenReturn(2L);

        long marked = service.refreshTrending(SINCE);

        assertThat(marked).isEqualTo(2);
        verify(store).markTrending(List.of("b", "c"));
    }

    @Test
    @DisplayName("Should not write when nothing changes")
    void shouldSkipWriteWhenUnchanged() {
        when(store.findRecentArticles(SINCE)).thenReturn(List.of(article("a", SINCE).withTrending(true)));

        assertThat(service.refreshTrending(SINCE)).isZero();
        verify(store, never()).markTrending(any());
    }
}
