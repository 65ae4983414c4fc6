package io.ainavigator.ingestion.config;

import io.ainavigator.ingestion.api.service.KnowledgeLevel;

import java.time.Duration;

public record IngestionSettings(
        Boolean enableScheduling,
        String cron,
        Boolean runOnStartup,
        Integer maxEntriesPerFeed,
        Duration dedupWindow,
        Integer trendingCount,
        Integer maxConcurrentSources,
        KnowledgeLevel defaultKnowledgeLevel,
        Duration lockTtl,
        Duration shutdownGrace
) {
    public static final String DEFAULT_CRON = "0 0 */3 * * *";

    public IngestionSettings {
        enableScheduling = enableScheduling == null || enableScheduling;
        cron = cron == null || cron.isBlank() ? DEFAULT_CRON : cron;
        runOnStartup = runOnStartup == null || runOnStartup;
        maxEntriesPerFeed = maxEntriesPerFeed == null ? 10 : maxEntriesPerFeed;
        dedupWindow = dedupWindow == null ? Duration.ofDays(3) : dedupWindow;
        trendingCount = trendingCount == null ? 3 : trendingCount;
        maxConcurrentSources = maxConcurrentSources == null ? 4 : Math.max(1, maxConcurrentSources);
        defaultKnowledgeLevel = defaultKnowledgeLevel == null ? KnowledgeLevel.INTERMEDIATE : defaultKnowledgeLevel;
        lockTtl = lockTtl == null ? Duration.ofHours(2) : lockTtl;
        shutdownGrace = shutdownGrace == null ? Duration.ofSeconds(30) : shutdownGrace;
    }

    public static IngestionSettings defaults() {
        return new IngestionSettings(null, null, null, null, null, null, null, null, null, null);
    }
}
