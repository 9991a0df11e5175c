package net.tilefetch.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pools used by the tile pipeline
 *
 * Features:
 * - Dedicated pool for per-layer fan-out fetches, which spend their time blocked on network I/O
 * - Single-threaded notification channel so lifecycle events leave the fetching thread in order
 * - Descriptive thread naming for monitoring
 */
@Configuration
public class AsyncConfig {

    /**
     * Pool for fan-out layer fetches. Sized for I/O-bound work rather than CPU count.
     * No queue: every layer gets a thread straight away, up to the maximum, so one tile's
     * layers never wait behind another tile's network I/O. Beyond that tasks are rejected.
     */
    @Bean("tileFanOutExecutor")
    public ThreadPoolTaskExecutor tileFanOutExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(16);
        executor.setMaxPoolSize(64);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("tile-fanout-");
        executor.initialize();
        return executor;
    }

    @Bean("tileNotificationExecutor")
    public ThreadPoolTaskExecutor tileNotificationExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(10_000);
        executor.setThreadNamePrefix("tile-events-");
        executor.initialize();
        return executor;
    }
}
