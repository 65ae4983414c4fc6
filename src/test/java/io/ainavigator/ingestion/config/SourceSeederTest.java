package io.ainavigator.ingestion.config;

import io.ainavigator.ingestion.api.service.ArticleStore;
import io.ainavigator.ingestion.model.NewsSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SourceSeederTest {

    @Mock
    private ArticleStore store;

    @Captor
    private ArgumentCaptor<List<NewsSource>> captor;

    private final NewsConfig config = new NewsConfig(List.of(
            new SourceSeed("vb", "VentureBeat AI", "https://venturebeat.com/category/ai/",
                    "https://venturebeat.com/category/ai/feed/", "AI News", true),
            new SourceSeed(null, "Homepage only", "https://example.com", null, null, false)
    ), null, null, null);

    @Test
    @DisplayName("Should seed configured sources into an empty store")
    void shouldSeedEmptyStore() {
        when(store.countSources()).thenReturn(0L);

        int seeded = new SourceSeeder(store, config).seed();

        assertThat(seeded).isEqualTo(2);
        verify(store).insertSources(captor.capture());
        assertThat(captor.getValue()).extracting(NewsSource::name)
                .containsExactly("VentureBeat AI", "Homepage only");
        assertThat(captor.getValue().get(0).id()).isEqualTo("vb");
        assertThat(captor.getValue().get(1).id()).isNotBlank();
        assertThat(captor.getValue().get(1).hasFeed()).isFalse();
    }

    @Test
    @DisplayName("Should leave a populated store untouched")
    void shouldNotReseed() {
        when(store.countSources()).thenReturn(4L);

        assertThat(new SourceSeeder(store, config).seed()).isZero();
        verify(store, never()).insertSources(any());
    }
}
