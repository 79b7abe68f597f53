package com.example.footprint.config;

import com.example.footprint.exception.EngineUnavailableException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Пулы потоков воркеров и политика повторов вызова движка.
 */
@Configuration
@RequiredArgsConstructor
public class WorkerConfig {

    private final PipelineConfig config;

    /**
     * Потоки циклов воркеров: по одному на воркера.
     */
    @Bean
    public ThreadPoolTaskExecutor workerExecutor() {
        int count = config.getWorkers().getCount();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(count);
        executor.setMaxPoolSize(count);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("footprint-worker-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds((int) config.getWorkers().getShutdownTimeout().toSeconds());
        return executor;
    }

    /**
     * Потоки вызовов движка, ограниченные по времени {@link TimeLimiter}.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService engineCallExecutor() {
        return Executors.newFixedThreadPool(config.getWorkers().getCount(),
                new CustomizableThreadFactory("engine-call-"));
    }

    @Bean
    public Retry engineRetry() {
        PipelineConfig.Retry retry = config.getRetry();
        RetryConfig retryConfig = RetryConfig.custom()
                .maxAttempts(retry.getMaxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialRandomBackoff(
                        retry.getInitialBackoff(),
                        retry.getMultiplier(),
                        retry.getRandomizationFactor()))
                .retryOnException(e -> e instanceof EngineUnavailableException)
                .build();
        return Retry.of("lci-engine", retryConfig);
    }

    @Bean
    public TimeLimiter engineTimeLimiter() {
        return TimeLimiter.of("lci-engine", TimeLimiterConfig.custom()
                .timeoutDuration(config.getRetry().getAttemptTimeout())
                .cancelRunningFuture(true)
                .build());
    }
}
