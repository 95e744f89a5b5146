package com.flaretrack.insights.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.time.ZoneId;
import java.util.concurrent.ThreadPoolExecutor;

@Configuration
public class InsightsConfiguration {

    @Bean
    public Clock insightsClock() {
        return Clock.systemUTC();
    }

    // day-of-week bucketing only; monthly trend buckets always use UTC
    @Bean
    public ZoneId insightsZone(@Value("${insights.zone:UTC}") String zone) {
        return ZoneId.of(zone);
    }

    @Bean(name = "insightsReadExecutor")
    public ThreadPoolTaskExecutor insightsReadExecutor(@Value("${insights.read-fanout.core-pool-size:4}") int corePoolSize,
                                                       @Value("${insights.read-fanout.max-pool-size:8}") int maxPoolSize,
                                                       @Value("${insights.read-fanout.queue-capacity:256}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("insights-read-");
        // a saturated pool runs the read on the caller instead of rejecting it
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }

    @Bean(name = "insightsRecomputeScheduler")
    public ThreadPoolTaskScheduler insightsRecomputeScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("insights-recompute-");
        scheduler.initialize();
        return scheduler;
    }
}
