package com.wpanther.documentsigning.config;

import java.security.SecureRandom;
import java.time.Clock;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Shared execution resources: the bounded pool that runs timestamp issuance,
 * the random source for OTPs, tokens and keys, and the clock.
 */
@Configuration
public class ExecutionConfig {

    @Value("${app.tsa.executor.core-pool-size:4}")
    private int corePoolSize;

    @Value("${app.tsa.executor.max-pool-size:16}")
    private int maxPoolSize;

    @Value("${app.tsa.executor.queue-capacity:2000}")
    private int queueCapacity;

    @Value("${app.tsa.executor.thread-name-prefix:tsa-}")
    private String threadNamePrefix;

    /**
     * Pool for timestamp issuance so callers can wait with a deadline.
     * A saturated pool rejects work instead of running it on the caller.
     */
    @Bean(name = "tsaExecutor")
    public ThreadPoolTaskExecutor tsaExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix(threadNamePrefix);
        executor.initialize();
        return executor;
    }

    @Bean
    public SecureRandom secureRandom() {
        return new SecureRandom();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
