package me.jling.gpstime.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Worker pool for reconciling files in parallel. Files are independent, so the
 * pool only bounds how many are decoded at once.
 */
@Configuration
public class ScanExecutorConfig {

    @Value("${gpstime.scan.threads:4}")
    private int threads;

    @Value("${gpstime.scan.queue-capacity:64}")
    private int queueCapacity;

    /**
     * When the queue is full the walking thread reconciles the file itself
     * ({@link ThreadPoolExecutor.CallerRunsPolicy}).
     */
    @Bean(name = "scanExecutor")
    public ThreadPoolTaskExecutor scanExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(Math.max(1, threads));
        executor.setMaxPoolSize(Math.max(1, threads));
        executor.setQueueCapacity(Math.max(0, queueCapacity));
        executor.setThreadNamePrefix("scan-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
