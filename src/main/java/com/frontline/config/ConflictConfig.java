package com.frontline.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

/**
 * Infrastructure beans for the conflict engine.
 */
@Configuration
public class ConflictConfig {

    /**
     * Time source for cooldowns and push progress; tests swap in a controllable clock.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Executor that delivers broadcast events so ticks and requests never wait on observers.
     */
    @Bean(name = "broadcastExecutor")
    public ThreadPoolTaskExecutor broadcastExecutor(
            @Value("${game.broadcast.pool-size:4}") int poolSize,
            @Value("${game.broadcast.queue-capacity:10000}") int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("broadcast-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }
}
