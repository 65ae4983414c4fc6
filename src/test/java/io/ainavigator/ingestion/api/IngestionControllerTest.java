package io.ainavigator.ingestion.api;

import io.ainavigator.ingestion.api.dto.IngestionReport;
import io.ainavigator.ingestion.api.dto.SourceOutcome;
import io.ainavigator.ingestion.api.exception.GlobalExceptionHandler;
import io.ainavigator.ingestion.api.service.ArticleStore;
import io.ainavigator.ingestion.api.service.IngestionScheduler;
import io.ainavigator.ingestion.api.service.NewsIngestionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class IngestionControllerTest {

    @Mock
    private IngestionScheduler scheduler;

    @Mock
    private NewsIngestionService ingestionService;

    @Mock
    private ArticleStore store;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders
                .standaloneSetup(new IngestionController(scheduler, ingestionService), new SourceController(store))
                .setControllerAdvice(new GlobalExceptionHandler())
                .setMessageConverters(new MappingJackson2HttpMessageConverter(Jackson2ObjectMapperBuilder.json().build()))
                .build();
    }

    @Test
    void shouldAcceptManualRun() throws Exception {
        when(scheduler.triggerNow()).thenReturn(true);

        mockMvc.perform(post("/api/v1/ingestion/run")).andExpect(status().isAccepted());
    }

    @Test
    void shouldRefuseRunWhileCycleActive() throws Exception {
        when(scheduler.triggerNow()).thenReturn(false);

        mockMvc.perform(post("/api/v1/ingestion/run")).andExpect(status().isConflict());
    }

    @Test
    void shouldReportLastRun() throws Exception {
        when(scheduler.isCycleRunning()).thenReturn(false);
        when(ingestionService.getLastReport()).thenReturn(Optional.of(new IngestionReport(
                "run1", Instant.parse("2024-05-06T09:00:00Z"), 4200,
                List.of(new SourceOutcome("s1", "One", 10, 3, 7, null)), 3, false)));

        mockMvc.perform(get("/api/v1/ingestion/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.cycleRunning").value(false))
                .andExpect(jsonPath("$.lastRun.inserted").value(3))
                .andExpect(jsonPath("$.lastRun.fetched").value(10));
    }

    @Test
    void shouldToggleSource() throws Exception {
        when(store.setSourceEnabled("s1", false)).thenReturn(true);

        mockMvc.perform(patch("/api/v1/sources/s1").param("enabled", "false"))
                .andExpect(status().isNoContent());

        verify(store).setSourceEnabled("s1", false);
    }

    @Test
    void shouldReturnNotFoundForUnknownSource() throws Exception {
        when(store.setSourceEnabled("nope", true)).thenReturn(false);

        mockMvc.perform(patch("/api/v1/sources/nope").param("enabled", "true"))
                .andExpect(status().isNotFound());
    }
}
