package com.kotsin.forecast.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * AsyncConfig - Thread pool for model adapters.
 *
 * Each adapter trains on its own immutable copy of the input, so independent
 * model families run side by side. The pipeline joins them before reporting.
 */
@Configuration
@Slf4j
public class AsyncConfig {

    /**
     * Executor for model training and prediction.
     *
     * Uses CallerRunsPolicy: if the queue is full the submitting thread trains the model,
     * so no adapter attempt is ever dropped.
     */
    @Bean(name = "modelExecutor")
    public ThreadPoolTaskExecutor modelExecutor(ForecastConfig config) {
        ForecastConfig.ExecutorConfig settings = config.getExecutor();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        executor.setCorePoolSize(settings.getPoolSize());
        executor.setMaxPoolSize(settings.getPoolSize());
        executor.setQueueCapacity(settings.getQueueCapacity());
        executor.setThreadNamePrefix(settings.getThreadPrefix());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());

        executor.setAllowCoreThreadTimeOut(true);
        executor.setKeepAliveSeconds(60);

        // Let a running evaluation finish on shutdown
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);

        executor.initialize();

        log.info("[MODEL-EXECUTOR] Initialized: poolSize={}, queueCapacity={}, threadPrefix={}",
                settings.getPoolSize(), settings.getQueueCapacity(), settings.getThreadPrefix());
        return executor;
    }
}
