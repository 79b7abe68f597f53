package com.example.footprint.service.store;

import com.example.footprint.model.CalculationJob;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;
import java.util.stream.Stream;

/**
 * Хранилище задач в памяти процесса. Изменения выполняются через
 * {@link ConcurrentHashMap#computeIfPresent}, то есть атомарно по ключу.
 */
public class InMemoryJobStore extends AbstractJobStore {
    private final Map<String, CalculationJob> jobs = new ConcurrentHashMap<>();

    public InMemoryJobStore(Clock clock, Duration leaseTimeout) {
        super(clock, leaseTimeout);
    }

    @Override
    protected void insert(CalculationJob job) {
        jobs.put(job.getId(), job);
    }

    @Override
    protected Optional<CalculationJob> load(String jobId) {
        return Optional.ofNullable(jobs.get(jobId));
    }

    @Override
    protected Optional<CalculationJob> upsert(String jobId, UnaryOperator<CalculationJob> mutation) {
        return Optional.ofNullable(jobs.computeIfPresent(jobId, (id, job) -> mutation.apply(job)));
    }

    @Override
    protected Stream<CalculationJob> all() {
        return jobs.values().stream();
    }

    @Override
    protected Stream<CalculationJob> bySubject(String subjectRef) {
        return all().filter(job -> subjectRef.equals(job.getSubjectRef()));
    }

    @Override
    public String backendName() {
        return "memory";
    }
}
