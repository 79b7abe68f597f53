package com.example.footprint.service.store;

import com.example.footprint.exception.PersistenceException;
import com.example.footprint.model.CalculationJob;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.StringRedisTemplate;

import java.time.Clock;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Хранилище задач в Redis.
 * <p>
 * Раскладка ключей:
 * <ul>
 *   <li>{@code {prefix}:job:{id}} - JSON снимок задачи</li>
 *   <li>{@code {prefix}:jobs} - множество всех ID</li>
 *   <li>{@code {prefix}:subject:{subjectRef}} - ID задач по объекту оценки</li>
 * </ul>
 * Изменение снимка выполняется оптимистично через WATCH/MULTI/EXEC.
 */
@Slf4j
public class RedisJobStore extends AbstractJobStore {
    private static final int MAX_WRITE_ATTEMPTS = 10;

    private final StringRedisTemplate redis;
    private final ObjectMapper objectMapper;
    private final String keyPrefix;

    public RedisJobStore(StringRedisTemplate redis,
                         ObjectMapper objectMapper,
                         String keyPrefix,
                         Clock clock,
                         Duration leaseTimeout) {
        super(clock, leaseTimeout);
        this.redis = redis;
        this.objectMapper = objectMapper;
        this.keyPrefix = keyPrefix;
    }

    @Override
    protected void insert(CalculationJob job) {
        try {
            redis.opsForValue().set(jobKey(job.getId()), write(job));
            redis.opsForSet().add(indexKey(), job.getId());
            redis.opsForSet().add(subjectKey(job.getSubjectRef()), job.getId());
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to create job " + job.getId() + ": " + e.getMessage(), e);
        }
    }

    @Override
    protected Optional<CalculationJob> load(String jobId) {
        try {
            return Optional.ofNullable(redis.opsForValue().get(jobKey(jobId))).map(this::read);
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to read job " + jobId + ": " + e.getMessage(), e);
        }
    }

    @Override
    protected Optional<CalculationJob> upsert(String jobId, UnaryOperator<CalculationJob> mutation) {
        String key = jobKey(jobId);
        for (int attempt = 1; attempt <= MAX_WRITE_ATTEMPTS; attempt++) {
            WriteOutcome outcome;
            try {
                outcome = redis.execute(new JobUpdate(key, mutation));
            } catch (DataAccessException e) {
                throw new PersistenceException("Failed to update job " + jobId + ": " + e.getMessage(), e);
            }
            if (outcome == null || !outcome.settled) {
                log.debug("Job {} changed concurrently, retrying update (attempt {})", jobId, attempt);
                continue;
            }
            return Optional.ofNullable(outcome.job);
        }
        throw new PersistenceException("Job " + jobId + " update did not settle after "
                + MAX_WRITE_ATTEMPTS + " attempts", null);
    }

    @Override
    protected Stream<CalculationJob> all() {
        return loadAll(members(indexKey()));
    }

    @Override
    protected Stream<CalculationJob> bySubject(String subjectRef) {
        return loadAll(members(subjectKey(subjectRef)));
    }

    @Override
    public String backendName() {
        return "redis";
    }

    private Set<String> members(String key) {
        try {
            Set<String> ids = redis.opsForSet().members(key);
            return ids != null ? ids : Set.of();
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to read job index " + key + ": " + e.getMessage(), e);
        }
    }

    private Stream<CalculationJob> loadAll(Collection<String> ids) {
        if (ids.isEmpty()) {
            return Stream.empty();
        }
        List<String> keys = ids.stream().map(this::jobKey).collect(Collectors.toList());
        try {
            List<String> values = redis.opsForValue().multiGet(keys);
            if (values == null) {
                return Stream.empty();
            }
            return values.stream().filter(Objects::nonNull).map(this::read);
        } catch (DataAccessException e) {
            throw new PersistenceException("Failed to read jobs: " + e.getMessage(), e);
        }
    }

    private String jobKey(String jobId) {
        return keyPrefix + ":job:" + jobId;
    }

    private String indexKey() {
        return keyPrefix + ":jobs";
    }

    private String subjectKey(String subjectRef) {
        return keyPrefix + ":subject:" + subjectRef;
    }

    private CalculationJob read(String json) {
        try {
            return objectMapper.readValue(json, CalculationJob.class);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Corrupted job record: " + e.getOriginalMessage(), e);
        }
    }

    private String write(CalculationJob job) {
        try {
            return objectMapper.writeValueAsString(job);
        } catch (JsonProcessingException e) {
            throw new PersistenceException("Failed to serialize job " + job.getId(), e);
        }
    }

    private static final class WriteOutcome {
        private static final WriteOutcome MISSING = new WriteOutcome(null, true);

        private final CalculationJob job;
        private final boolean settled;

        private WriteOutcome(CalculationJob job, boolean settled) {
            this.job = job;
            this.settled = settled;
        }
    }

    private final class JobUpdate implements SessionCallback<WriteOutcome> {
        private final String key;
        private final UnaryOperator<CalculationJob> mutation;

        private JobUpdate(String key, UnaryOperator<CalculationJob> mutation) {
            this.key = key;
            this.mutation = mutation;
        }

        @Override
        @SuppressWarnings("unchecked")
        public <K, V> WriteOutcome execute(RedisOperations<K, V> operations) throws DataAccessException {
            RedisOperations<String, String> ops = (RedisOperations<String, String>) operations;
            ops.watch(key);
            String json = ops.opsForValue().get(key);
            if (json == null) {
                ops.unwatch();
                return WriteOutcome.MISSING;
            }
            CalculationJob current = read(json);
            CalculationJob next = mutation.apply(current);
            if (next == current) {
                ops.unwatch();
                return new WriteOutcome(current, true);
            }
            ops.multi();
            ops.opsForValue().set(key, write(next));
            List<Object> results = ops.exec();
            return new WriteOutcome(next, results != null && !results.isEmpty());
        }
    }
}
