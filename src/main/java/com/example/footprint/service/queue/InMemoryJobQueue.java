package com.example.footprint.service.queue;

import com.example.footprint.model.JobPayload;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Локальная очередь в памяти процесса (FIFO).
 * Используется, когда распределённый бэкенд недоступен; сообщения не переживают перезапуск.
 */
public class InMemoryJobQueue implements JobQueue {
    public static final String NAME = "memory";

    private final BlockingQueue<QueuedJob> queue = new LinkedBlockingQueue<>();

    @Override
    public void enqueue(String jobId, JobPayload payload) {
        queue.offer(QueuedJob.builder()
                .jobId(jobId)
                .payload(payload)
                .source(NAME)
                .build());
    }

    @Override
    public Optional<QueuedJob> dequeue(Duration timeout) {
        try {
            return Optional.ofNullable(queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        }
    }

    @Override
    public void ack(QueuedJob job) {
        // сообщение удалено из очереди при выдаче
    }

    @Override
    public long size() {
        return queue.size();
    }

    @Override
    public String backendName() {
        return NAME;
    }
}
