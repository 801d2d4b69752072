package com.z254.butterfly.sentinel.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.z254.butterfly.sentinel.dedup.AlertClusterer;
import com.z254.butterfly.sentinel.dedup.FeatureHashClusterer;
import com.z254.butterfly.sentinel.escalation.LoggingNotificationDispatcher;
import com.z254.butterfly.sentinel.escalation.NotificationDispatcher;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

/**
 * Infrastructure beans shared by the engines.
 */
@Configuration
public class SentinelConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(name = "escalationTaskScheduler")
    public TaskScheduler escalationTaskScheduler(SentinelProperties properties) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(properties.getEscalation().getSchedulerPoolSize());
        scheduler.setThreadNamePrefix("sentinel-escalation-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.initialize();
        return scheduler;
    }

    /**
     * Bounded pool for clusterer calls. A full queue rejects the task and deduplication falls
     * back to similarity matching.
     */
    @Bean(name = "clusteringTaskExecutor")
    public ThreadPoolTaskExecutor clusteringTaskExecutor(SentinelProperties properties) {
        SentinelProperties.Deduplication config = properties.getDeduplication();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(config.getClusteringThreads());
        executor.setMaxPoolSize(config.getClusteringThreads());
        executor.setQueueCapacity(config.getClusteringQueueCapacity());
        executor.setThreadNamePrefix("sentinel-clustering-");
        executor.setDaemon(true);
        executor.initialize();
        return executor;
    }

    @Bean(name = "enrichmentTaskExecutor")
    public ThreadPoolTaskExecutor enrichmentTaskExecutor(SentinelProperties properties) {
        SentinelProperties.Enrichment config = properties.getEnrichment();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(config.getMaxConcurrentEnrichments());
        executor.setMaxPoolSize(config.getMaxConcurrentEnrichments());
        executor.setQueueCapacity(config.getQueueCapacity());
        executor.setThreadNamePrefix("sentinel-enrichment-");
        executor.setDaemon(true);
        executor.initialize();
        return executor;
    }

    @Bean
    @ConditionalOnMissingBean
    public AlertClusterer alertClusterer() {
        return new FeatureHashClusterer();
    }

    @Bean
    @ConditionalOnMissingBean
    public NotificationDispatcher notificationDispatcher() {
        return new LoggingNotificationDispatcher();
    }

    /**
     * Mapper used for analytics exports.
     */
    public static ObjectMapper exportObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }
}
