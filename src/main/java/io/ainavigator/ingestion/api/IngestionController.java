package io.ainavigator.ingestion.api;

import io.ainavigator.ingestion.api.service.IngestionScheduler;
import io.ainavigator.ingestion.api.service.NewsIngestionService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/ingestion")
public class IngestionController {

    private final IngestionScheduler scheduler;
    private final NewsIngestionService ingestionService;

    public IngestionController(IngestionScheduler scheduler, NewsIngestionService ingestionService) {
        this.scheduler = scheduler;
        this.ingestionService = ingestionService;
    }

    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("service", "AI Navigator Ingestion Service");
        status.put("timestamp", Instant.now());
        status.put("cycleRunning", scheduler.isCycleRunning());
        ingestionService.getLastReport().ifPresent(report -> status.put("lastRun", Map.of(
                "runId", report.runId(),
                "startedAt", report.startedAt(),
                "durationMs", report.durationMs(),
                "fetched", report.totalFetched(),
                "inserted", report.totalInserted(),
                "failedSources", report.failedSources(),
                "trendingMarked", report.trendingMarked(),
                "cancelled", report.cancelled()
        )));
        return ResponseEntity.ok(status);
    }

    @PostMapping("/run")
    public ResponseEntity<Map<String, Object>> run() {
        if (scheduler.triggerNow()) {
            return ResponseEntity.accepted().body(Map.of("message", "Ingestion cycle triggered"));
        }
        return ResponseEntity.status(HttpStatus.CONFLICT)
                .body(Map.of("message", "Ingestion cycle already running or scheduler stopped"));
    }
}
