package com.example.footprint.service.queue;

import com.example.footprint.model.JobPayload;

import java.time.Duration;
import java.util.Optional;

/**
 * Очередь задач с доставкой не менее одного раза.
 * Реализации взаимозаменяемы для пула воркеров.
 */
public interface JobQueue {

    /**
     * Ставит задачу в очередь.
     *
     * @throws com.example.footprint.exception.QueueUnavailableException бэкенд недоступен
     */
    void enqueue(String jobId, JobPayload payload);

    /**
     * Забирает следующую задачу, ожидая не дольше {@code timeout}.
     * Сообщение остаётся «в обработке» до вызова {@link #ack(QueuedJob)}.
     */
    Optional<QueuedJob> dequeue(Duration timeout);

    /**
     * Подтверждает обработку сообщения.
     */
    void ack(QueuedJob job);

    /**
     * Количество сообщений, ожидающих обработки.
     */
    long size();

    String backendName();
}
