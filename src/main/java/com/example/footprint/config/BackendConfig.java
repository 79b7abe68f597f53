package com.example.footprint.config;

import com.example.footprint.exception.QueueUnavailableException;
import com.example.footprint.service.cache.CaffeineFootprintCache;
import com.example.footprint.service.cache.FootprintCache;
import com.example.footprint.service.cache.RedisFootprintCache;
import com.example.footprint.service.queue.FailoverJobQueue;
import com.example.footprint.service.queue.InMemoryJobQueue;
import com.example.footprint.service.queue.JobQueue;
import com.example.footprint.service.queue.RedisJobQueue;
import com.example.footprint.service.store.InMemoryJobStore;
import com.example.footprint.service.store.JobStore;
import com.example.footprint.service.store.RedisJobStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.util.StringUtils;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Clock;
import java.util.UUID;

/**
 * Выбор бэкендов хранилища задач, очереди и кэша при старте.
 * <p>
 * В режиме AUTO Redis проверяется один раз командой PING; если он недоступен,
 * все компоненты работают в памяти процесса.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class BackendConfig {

    private final PipelineConfig config;
    private final ObjectProvider<StringRedisTemplate> redisTemplate;

    private Boolean redisReachable;

    /**
     * Фиксирует идентификатор экземпляра: он задаёт список сообщений в обработке
     * и владельца аренды задач, поэтому должен переживать перезапуск.
     */
    @PostConstruct
    void resolveInstanceId() {
        PipelineConfig.Backend backend = config.getBackend();
        if (!StringUtils.hasText(backend.getInstanceId())) {
            backend.setInstanceId(hostName());
        }
        log.info("Instance id: {}", backend.getInstanceId());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public JobStore jobStore(ObjectMapper objectMapper, Clock clock) {
        PipelineConfig.Backend backend = config.getBackend();
        if (useRedis(backend.getStore())) {
            log.info("Job store backend: redis");
            return new RedisJobStore(redisTemplate.getObject(), objectMapper, backend.getKeyPrefix(),
                    clock, config.getStore().getLeaseTimeout());
        }
        log.info("Job store backend: memory");
        return new InMemoryJobStore(clock, config.getStore().getLeaseTimeout());
    }

    @Bean
    public JobQueue jobQueue(ObjectMapper objectMapper, Clock clock) {
        PipelineConfig.Backend backend = config.getBackend();
        if (!useRedis(backend.getQueue())) {
            log.info("Queue backend: memory");
            return new InMemoryJobQueue();
        }

        String instanceId = backend.getInstanceId();
        RedisJobQueue redisQueue = new RedisJobQueue(redisTemplate.getObject(), objectMapper, clock,
                backend.getKeyPrefix(), instanceId);
        try {
            redisQueue.recoverUnacknowledged();
        } catch (QueueUnavailableException e) {
            log.warn("Could not recover unacknowledged messages of instance {}: {}", instanceId, e.getMessage());
        }
        log.info("Queue backend: redis (instance {}) with in-memory failover", instanceId);
        return new FailoverJobQueue(redisQueue, new InMemoryJobQueue(), backend.getFailoverRecheckInterval(), clock);
    }

    @Bean
    public FootprintCache footprintCache(ObjectMapper objectMapper, Clock clock) {
        PipelineConfig.Backend backend = config.getBackend();
        if (useRedis(backend.getCache())) {
            log.info("Cache backend: redis");
            return new RedisFootprintCache(redisTemplate.getObject(), objectMapper, backend.getKeyPrefix(),
                    backend.getCacheTtl(), clock);
        }
        log.info("Cache backend: caffeine");
        return new CaffeineFootprintCache(backend.getCacheMaxEntries(), backend.getCacheTtl(), clock);
    }

    private synchronized boolean useRedis(PipelineConfig.BackendMode mode) {
        switch (mode) {
            case MEMORY:
                return false;
            case REDIS:
                return true;
            default:
                if (redisReachable == null) {
                    redisReachable = ping();
                    if (!redisReachable) {
                        log.warn("Redis is unreachable, falling back to in-process backends");
                    }
                }
                return redisReachable;
        }
    }

    private boolean ping() {
        StringRedisTemplate template = redisTemplate.getIfAvailable();
        if (template == null) {
            return false;
        }
        try {
            String pong = template.execute((RedisCallback<String>) connection -> connection.ping());
            return "PONG".equalsIgnoreCase(pong);
        } catch (RuntimeException e) {
            log.warn("Redis health check failed: {}", e.getMessage());
            return false;
        }
    }

    private static String hostName() {
        try {
            return InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            String generated = UUID.randomUUID().toString();
            log.warn("Cannot resolve host name, using generated instance id {}", generated);
            return generated;
        }
    }
}
