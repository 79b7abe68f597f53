package com.example.footprint.metrics;

import com.example.footprint.service.queue.JobQueue;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Метрики конвейера расчётов.
 */
@Component
public class PipelineMetrics {

    private final MeterRegistry meterRegistry;
    private final Timer jobDuration;
    private final Counter completedTotal;
    private final Counter failedTotal;
    private final Counter cancelledTotal;
    private final Counter degradedTotal;
    private final Counter cacheHits;
    private final Counter cacheMisses;
    private final Counter cacheErrors;
    private final Counter engineRetries;
    private final Counter singleFlightJoined;
    private final AtomicInteger activeJobs;

    public PipelineMetrics(MeterRegistry meterRegistry, JobQueue jobQueue) {
        this.meterRegistry = meterRegistry;

        this.jobDuration = Timer.builder("footprint.job.duration")
            .description("Duration of job execution by a worker")
            .register(meterRegistry);

        this.completedTotal = Counter.builder("footprint.jobs.completed.total")
            .description("Total number of completed jobs")
            .register(meterRegistry);

        this.failedTotal = Counter.builder("footprint.jobs.failed.total")
            .description("Total number of failed jobs")
            .register(meterRegistry);

        this.cancelledTotal = Counter.builder("footprint.jobs.cancelled.total")
            .description("Total number of jobs stopped after cancellation")
            .register(meterRegistry);

        this.degradedTotal = Counter.builder("footprint.jobs.degraded.total")
            .description("Total number of jobs completed with fallback estimation")
            .register(meterRegistry);

        this.cacheHits = Counter.builder("footprint.cache.hits.total")
            .description("Total number of footprint cache hits")
            .register(meterRegistry);

        this.cacheMisses = Counter.builder("footprint.cache.misses.total")
            .description("Total number of footprint cache misses")
            .register(meterRegistry);

        this.cacheErrors = Counter.builder("footprint.cache.errors.total")
            .description("Total number of bypassed cache operations")
            .register(meterRegistry);

        this.engineRetries = Counter.builder("footprint.engine.retries.total")
            .description("Total number of retried engine calls")
            .register(meterRegistry);

        this.singleFlightJoined = Counter.builder("footprint.singleflight.joined.total")
            .description("Total number of jobs that waited for an in-flight engine call")
            .register(meterRegistry);

        this.activeJobs = new AtomicInteger(0);
        Gauge.builder("footprint.jobs.active", activeJobs, AtomicInteger::get)
            .description("Number of jobs being executed")
            .register(meterRegistry);

        Gauge.builder("footprint.queue.depth", jobQueue, JobQueue::size)
            .description("Number of queued messages waiting for a worker")
            .register(meterRegistry);
    }

    public Timer.Sample startTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordJobDuration(Timer.Sample sample) {
        sample.stop(jobDuration);
    }

    /**
     * Записывает время выполнения этапа задачи.
     */
    public void recordStepDuration(Timer.Sample sample, String stepName) {
        Timer stepTimer = Timer.builder("footprint.step.duration")
            .tag("step", stepName)
            .description("Duration of job execution step")
            .register(meterRegistry);
        sample.stop(stepTimer);
    }

    public void incrementActiveJobs() {
        activeJobs.incrementAndGet();
    }

    public void decrementActiveJobs() {
        activeJobs.decrementAndGet();
    }

    public void recordCompleted(boolean degraded) {
        completedTotal.increment();
        if (degraded) {
            degradedTotal.increment();
        }
    }

    public void recordFailed() {
        failedTotal.increment();
    }

    public void recordCancelled() {
        cancelledTotal.increment();
    }

    public void recordCacheHit() {
        cacheHits.increment();
    }

    public void recordCacheMiss() {
        cacheMisses.increment();
    }

    public void recordCacheError() {
        cacheErrors.increment();
    }

    public void recordEngineRetry() {
        engineRetries.increment();
    }

    public void recordSingleFlightJoined() {
        singleFlightJoined.increment();
    }
}
