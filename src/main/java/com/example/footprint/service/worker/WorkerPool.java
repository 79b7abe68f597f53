package com.example.footprint.service.worker;

import com.example.footprint.config.PipelineConfig;
import com.example.footprint.exception.QueueUnavailableException;
import com.example.footprint.service.queue.JobQueue;
import com.example.footprint.service.queue.QueuedJob;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Пул воркеров фиксированного размера. Каждый воркер в цикле забирает сообщение из очереди,
 * выбирает функцию выполнения по типу нагрузки и подтверждает сообщение.
 */
@Slf4j
@Component
public class WorkerPool implements SmartLifecycle {

    private final JobQueue jobQueue;
    private final CalculationJobExecutor calculationExecutor;
    private final PipelineConfig config;
    private final ThreadPoolTaskExecutor workerExecutor;
    private final AtomicInteger activeWorkers = new AtomicInteger();

    private volatile boolean running;

    public WorkerPool(JobQueue jobQueue,
                      CalculationJobExecutor calculationExecutor,
                      PipelineConfig config,
                      @Qualifier("workerExecutor") ThreadPoolTaskExecutor workerExecutor) {
        this.jobQueue = jobQueue;
        this.calculationExecutor = calculationExecutor;
        this.config = config;
        this.workerExecutor = workerExecutor;
    }

    @Override
    public void start() {
        if (running) {
            return;
        }
        running = true;
        int count = config.getWorkers().getCount();
        String instanceId = config.getBackend().getInstanceId();
        String prefix = StringUtils.hasText(instanceId) ? instanceId + "/" : "";
        for (int i = 1; i <= count; i++) {
            String workerId = prefix + "worker-" + i;
            workerExecutor.execute(() -> loop(workerId));
        }
        log.info("Started {} workers on {} queue", count, jobQueue.backendName());
    }

    @Override
    public void stop() {
        if (!running) {
            return;
        }
        running = false;
        log.info("Stopping workers, waiting for {} running loop(s)", activeWorkers.get());
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    @Override
    public boolean isAutoStartup() {
        return config.getWorkers().isAutoStart();
    }

    /**
     * Число циклов воркеров, которые ещё не завершились.
     */
    public int activeWorkers() {
        return activeWorkers.get();
    }

    private void loop(String workerId) {
        activeWorkers.incrementAndGet();
        Duration pollTimeout = config.getWorkers().getPollTimeout();
        try {
            while (running && !Thread.currentThread().isInterrupted()) {
                try {
                    Optional<QueuedJob> next = jobQueue.dequeue(pollTimeout);
                    next.ifPresent(job -> dispatch(workerId, job));
                } catch (QueueUnavailableException e) {
                    log.warn("Worker {} cannot reach queue: {}", workerId, e.getMessage());
                    pause(pollTimeout);
                } catch (RuntimeException e) {
                    log.error("Worker {} loop error: {}", workerId, e.getMessage(), e);
                }
            }
        } finally {
            activeWorkers.decrementAndGet();
            log.debug("Worker {} stopped", workerId);
        }
    }

    void dispatch(String workerId, QueuedJob job) {
        try {
            Runnable execution = switch (job.getPayload().kind()) {
                case CALCULATION -> () -> calculationExecutor.execute(job.getJobId(), workerId);
            };
            execution.run();
        } finally {
            jobQueue.ack(job);
        }
    }

    private void pause(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
