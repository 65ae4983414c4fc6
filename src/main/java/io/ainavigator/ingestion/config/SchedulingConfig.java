package io.ainavigator.ingestion.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Thread pools owned by the ingestion pipeline. The trigger pool has a spare thread so an
 * overlapping trigger reaches the skip-if-running guard instead of queueing behind the cycle.
 */
@Configuration
public class SchedulingConfig {

    @Bean
    public ThreadPoolTaskScheduler ingestionTaskScheduler(NewsConfig newsConfig) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("ingestion-trigger-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationMillis(newsConfig.ingestion().shutdownGrace().toMillis());
        return scheduler;
    }

    @Bean
    public ThreadPoolTaskExecutor ingestionExecutor(NewsConfig newsConfig) {
        int workers = newsConfig.ingestion().maxConcurrentSources();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("ingestion-source-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationMillis(newsConfig.ingestion().shutdownGrace().toMillis());
        return executor;
    }
}
