package com.example.footprint.service.queue;

import com.example.footprint.exception.QueueUnavailableException;
import com.example.footprint.model.JobPayload;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Распределённая очередь с откатом на локальную.
 * <p>
 * При сбое основного бэкенда сообщения принимаются локальной очередью, основной
 * бэкенд повторно проверяется не чаще раза в {@code recheckInterval}.
 * Локальные сообщения выдаются в первую очередь.
 */
@Slf4j
public class FailoverJobQueue implements JobQueue {

    private final JobQueue primary;
    private final JobQueue fallback;
    private final Duration recheckInterval;
    private final Clock clock;

    private volatile Instant primaryRetryAt;

    public FailoverJobQueue(JobQueue primary, JobQueue fallback, Duration recheckInterval, Clock clock) {
        this.primary = primary;
        this.fallback = fallback;
        this.recheckInterval = recheckInterval;
        this.clock = clock;
    }

    @Override
    public void enqueue(String jobId, JobPayload payload) {
        if (isPrimaryAvailable()) {
            try {
                primary.enqueue(jobId, payload);
                markPrimaryUp();
                return;
            } catch (QueueUnavailableException e) {
                markPrimaryDown(e);
            }
        }
        log.warn("Job {} enqueued to local fallback queue", jobId);
        fallback.enqueue(jobId, payload);
    }

    @Override
    public Optional<QueuedJob> dequeue(Duration timeout) {
        Optional<QueuedJob> local = fallback.dequeue(Duration.ZERO);
        if (local.isPresent()) {
            return local;
        }
        if (isPrimaryAvailable()) {
            try {
                Optional<QueuedJob> next = primary.dequeue(timeout);
                markPrimaryUp();
                return next;
            } catch (QueueUnavailableException e) {
                markPrimaryDown(e);
            }
        }
        return fallback.dequeue(timeout);
    }

    @Override
    public void ack(QueuedJob job) {
        if (!primary.backendName().equals(job.getSource())) {
            fallback.ack(job);
            return;
        }
        try {
            primary.ack(job);
        } catch (QueueUnavailableException e) {
            // сообщение будет доставлено повторно, повторный захват задачи отклонит хранилище
            log.warn("Failed to acknowledge job {} on {}: {}", job.getJobId(), primary.backendName(), e.getMessage());
            markPrimaryDown(e);
        }
    }

    @Override
    public long size() {
        long size = fallback.size();
        if (isPrimaryAvailable()) {
            try {
                size += primary.size();
            } catch (QueueUnavailableException e) {
                markPrimaryDown(e);
            }
        }
        return size;
    }

    @Override
    public String backendName() {
        return isPrimaryAvailable() ? primary.backendName() : fallback.backendName();
    }

    public boolean isPrimaryAvailable() {
        Instant retryAt = primaryRetryAt;
        return retryAt == null || !clock.instant().isBefore(retryAt);
    }

    private void markPrimaryUp() {
        if (primaryRetryAt != null) {
            log.info("Queue backend {} is available again", primary.backendName());
            primaryRetryAt = null;
        }
    }

    private void markPrimaryDown(QueueUnavailableException e) {
        Instant retryAt = clock.instant().plus(recheckInterval);
        if (primaryRetryAt == null) {
            log.warn("Queue backend {} unavailable, switching to {} until {}: {}",
                    primary.backendName(), fallback.backendName(), retryAt, e.getMessage());
        }
        primaryRetryAt = retryAt;
    }
}
