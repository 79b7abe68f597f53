package com.example.footprint.service.queue;

import com.example.footprint.exception.QueueUnavailableException;
import com.example.footprint.model.JobPayload;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Распределённая очередь на списках Redis.
 * <p>
 * Сообщение атомарно перекладывается из {@code {prefix}:queue:pending} в список
 * {@code {prefix}:queue:processing:{instanceId}} и удаляется оттуда при подтверждении.
 * Неподтверждённые сообщения экземпляра возвращаются в очередь при старте.
 */
@Slf4j
public class RedisJobQueue implements JobQueue {
    public static final String NAME = "redis";

    private final StringRedisTemplate redis;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String pendingKey;
    private final String processingKey;

    public RedisJobQueue(StringRedisTemplate redis,
                         ObjectMapper objectMapper,
                         Clock clock,
                         String keyPrefix,
                         String instanceId) {
        this.redis = redis;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.pendingKey = keyPrefix + ":queue:pending";
        this.processingKey = keyPrefix + ":queue:processing:" + instanceId;
    }

    @Override
    public void enqueue(String jobId, JobPayload payload) {
        String message = write(QueueMessage.builder()
                .jobId(jobId)
                .payload(payload)
                .enqueuedAt(clock.instant())
                .build());
        try {
            redis.opsForList().leftPush(pendingKey, message);
        } catch (DataAccessException e) {
            throw new QueueUnavailableException("Failed to enqueue job " + jobId + ": " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<QueuedJob> dequeue(Duration timeout) {
        String raw;
        try {
            raw = redis.opsForList().rightPopAndLeftPush(pendingKey, processingKey, timeout);
        } catch (DataAccessException e) {
            throw new QueueUnavailableException("Failed to dequeue: " + e.getMessage(), e);
        }
        if (raw == null) {
            return Optional.empty();
        }
        try {
            QueueMessage message = objectMapper.readValue(raw, QueueMessage.class);
            return Optional.of(QueuedJob.builder()
                    .jobId(message.getJobId())
                    .payload(message.getPayload())
                    .source(NAME)
                    .receipt(raw)
                    .build());
        } catch (JsonProcessingException e) {
            log.error("Dropping malformed queue message: {}", e.getOriginalMessage());
            remove(raw);
            return Optional.empty();
        }
    }

    @Override
    public void ack(QueuedJob job) {
        if (job.getReceipt() == null) {
            return;
        }
        remove(job.getReceipt());
    }

    /**
     * Возвращает в очередь сообщения, оставшиеся неподтверждёнными после прошлого запуска экземпляра.
     *
     * @return количество возвращённых сообщений
     */
    public int recoverUnacknowledged() {
        int recovered = 0;
        try {
            while (redis.opsForList().rightPopAndLeftPush(processingKey, pendingKey) != null) {
                recovered++;
            }
        } catch (DataAccessException e) {
            throw new QueueUnavailableException("Failed to recover unacknowledged messages: " + e.getMessage(), e);
        }
        if (recovered > 0) {
            log.warn("Re-queued {} unacknowledged message(s) from {}", recovered, processingKey);
        }
        return recovered;
    }

    @Override
    public long size() {
        try {
            Long size = redis.opsForList().size(pendingKey);
            return size != null ? size : 0;
        } catch (DataAccessException e) {
            throw new QueueUnavailableException("Failed to read queue size: " + e.getMessage(), e);
        }
    }

    @Override
    public String backendName() {
        return NAME;
    }

    private void remove(String raw) {
        try {
            redis.opsForList().remove(processingKey, 1, raw);
        } catch (DataAccessException e) {
            throw new QueueUnavailableException("Failed to acknowledge message: " + e.getMessage(), e);
        }
    }

    private String write(QueueMessage message) {
        try {
            return objectMapper.writeValueAsString(message);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize queue message for job " + message.getJobId(), e);
        }
    }
}
