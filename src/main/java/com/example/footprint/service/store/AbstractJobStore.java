package com.example.footprint.service.store;

import com.example.footprint.model.CalculationJob;
import com.example.footprint.model.CalculationOptions;
import com.example.footprint.model.ExecutionStage;
import com.example.footprint.model.FootprintResult;
import com.example.footprint.model.InventoryFlow;
import com.example.footprint.model.JobStatus;
import com.example.footprint.model.PayloadKind;
import com.example.footprint.model.ProductInputs;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Правила переходов задачи, общие для всех бэкендов хранилища.
 * Бэкенд обеспечивает только атомарную замену снимка по ключу.
 */
@Slf4j
public abstract class AbstractJobStore implements JobStore {

    protected final Clock clock;
    private final Duration leaseTimeout;

    protected AbstractJobStore(Clock clock, Duration leaseTimeout) {
        this.clock = clock;
        this.leaseTimeout = leaseTimeout;
    }

    protected abstract void insert(CalculationJob job);

    protected abstract Optional<CalculationJob> load(String jobId);

    /**
     * Атомарно заменяет снимок задачи результатом {@code mutation}.
     * Если функция вернула тот же экземпляр, запись не выполняется.
     * Функция может вызываться несколько раз при конфликте записи.
     *
     * @return снимок после изменения или пусто, если задачи нет
     */
    protected abstract Optional<CalculationJob> upsert(String jobId, UnaryOperator<CalculationJob> mutation);

    protected abstract Stream<CalculationJob> all();

    protected abstract Stream<CalculationJob> bySubject(String subjectRef);

    @Override
    public String create(String subjectRef, PayloadKind kind, ProductInputs inputs, CalculationOptions options) {
        Instant now = clock.instant();
        CalculationJob job = CalculationJob.builder()
                .id(UUID.randomUUID().toString())
                .subjectRef(subjectRef)
                .payloadKind(kind)
                .status(JobStatus.PENDING)
                .stage(ExecutionStage.QUEUED)
                .progress(ExecutionStage.QUEUED.getProgress())
                .inputsSnapshot(inputs)
                .options(options)
                .attempt(0)
                .createdAt(now)
                .updatedAt(now)
                .build();
        insert(job);
        log.debug("Job {} created for subject {}", job.getId(), subjectRef);
        return job.getId();
    }

    @Override
    public Optional<CalculationJob> get(String jobId) {
        return load(jobId);
    }

    @Override
    public Optional<CalculationJob> claim(String jobId, String workerId) {
        AtomicBoolean claimed = new AtomicBoolean(false);
        Optional<CalculationJob> result = upsert(jobId, job -> {
            claimed.set(false);
            Instant now = clock.instant();
            if (!isClaimable(job, workerId, now)) {
                return job;
            }
            claimed.set(true);
            if (job.getStatus() == JobStatus.PROCESSING) {
                log.warn("Job {} lease of worker {} taken over by {}", jobId, job.getWorkerId(), workerId);
            }
            return job.toBuilder()
                    .status(JobStatus.PROCESSING)
                    .workerId(workerId)
                    .stage(maxStage(job, ExecutionStage.CLAIMED))
                    .progress(Math.max(job.getProgress(), ExecutionStage.CLAIMED.getProgress()))
                    .startedAt(job.getStartedAt() != null ? job.getStartedAt() : now)
                    .updatedAt(now)
                    .build();
        });
        return claimed.get() ? result : Optional.empty();
    }

    private boolean isClaimable(CalculationJob job, String workerId, Instant now) {
        if (job.getStatus() == JobStatus.PENDING) {
            return true;
        }
        if (job.getStatus() != JobStatus.PROCESSING) {
            return false;
        }
        // Аренда принадлежит экземпляру: после перезапуска он забирает свои задачи сразу
        return ownerInstance(job.getWorkerId()).equals(ownerInstance(workerId))
                || job.getUpdatedAt().plus(leaseTimeout).isBefore(now);
    }

    /**
     * Экземпляр, к которому относится воркер ({@code instanceId/worker-N}).
     * Идентификатор без экземпляра считается экземпляром сам по себе.
     */
    static String ownerInstance(String workerId) {
        if (workerId == null) {
            return "";
        }
        int separator = workerId.lastIndexOf('/');
        return separator < 0 ? workerId : workerId.substring(0, separator);
    }

    @Override
    public void updateProgress(String jobId, ExecutionStage stage) {
        upsert(jobId, job -> {
            if (job.getStatus() != JobStatus.PROCESSING) {
                return job;
            }
            return job.toBuilder()
                    .stage(maxStage(job, stage))
                    .progress(Math.max(job.getProgress(), stage.getProgress()))
                    .updatedAt(clock.instant())
                    .build();
        });
    }

    @Override
    public void recordInventory(String jobId, List<InventoryFlow> inventory) {
        List<InventoryFlow> snapshot = List.copyOf(inventory);
        upsert(jobId, job -> {
            if (job.getStatus() != JobStatus.PROCESSING) {
                return job;
            }
            return job.toBuilder()
                    .inventory(snapshot)
                    .stage(maxStage(job, ExecutionStage.INVENTORY_RECEIVED))
                    .progress(Math.max(job.getProgress(), ExecutionStage.INVENTORY_RECEIVED.getProgress()))
                    .updatedAt(clock.instant())
                    .build();
        });
    }

    @Override
    public int incrementAttempt(String jobId) {
        return upsert(jobId, job -> {
            if (job.getStatus() != JobStatus.PROCESSING) {
                return job;
            }
            return job.toBuilder()
                    .attempt(job.getAttempt() + 1)
                    .updatedAt(clock.instant())
                    .build();
        }).map(CalculationJob::getAttempt).orElse(0);
    }

    @Override
    public boolean complete(String jobId, FootprintResult result) {
        AtomicBoolean written = new AtomicBoolean(false);
        upsert(jobId, job -> {
            if (job.getStatus() == JobStatus.COMPLETED) {
                written.set(true);
                return job;
            }
            if (!job.getStatus().canTransitionTo(JobStatus.COMPLETED)) {
                written.set(false);
                return job;
            }
            written.set(true);
            Instant now = clock.instant();
            return job.toBuilder()
                    .status(JobStatus.COMPLETED)
                    .stage(ExecutionStage.DONE)
                    .progress(ExecutionStage.DONE.getProgress())
                    .result(result)
                    .errorMessage(null)
                    .errorReconcilable(false)
                    .completedAt(now)
                    .updatedAt(now)
                    .build();
        });
        return written.get();
    }

    @Override
    public boolean fail(String jobId, String errorMessage, boolean reconcilable) {
        AtomicBoolean failed = new AtomicBoolean(false);
        upsert(jobId, job -> {
            failed.set(job.getStatus().canTransitionTo(JobStatus.FAILED));
            return failed.get() ? failed(job, errorMessage, reconcilable) : job;
        });
        return failed.get();
    }

    @Override
    public boolean abandon(String jobId, String errorMessage) {
        AtomicBoolean abandoned = new AtomicBoolean(false);
        upsert(jobId, job -> {
            abandoned.set(job.getStatus().canBeAbandoned());
            return abandoned.get() ? failed(job, errorMessage, true) : job;
        });
        return abandoned.get();
    }

    @Override
    public boolean markCancelled(String jobId) {
        AtomicBoolean cancelled = new AtomicBoolean(false);
        upsert(jobId, job -> {
            cancelled.set(job.getStatus().canTransitionTo(JobStatus.CANCELLED));
            if (!cancelled.get()) {
                return job;
            }
            Instant now = clock.instant();
            return job.toBuilder()
                    .status(JobStatus.CANCELLED)
                    .completedAt(now)
                    .updatedAt(now)
                    .build();
        });
        return cancelled.get();
    }

    @Override
    public boolean isCancelled(String jobId) {
        return load(jobId)
                .map(job -> job.getStatus() == JobStatus.CANCELLED)
                .orElse(false);
    }

    @Override
    public List<CalculationJob> findBySubject(String subjectRef) {
        return bySubject(subjectRef)
                .sorted(Comparator.comparing(CalculationJob::getCreatedAt))
                .collect(Collectors.toList());
    }

    @Override
    public List<CalculationJob> findStale(JobStatus status, Instant updatedBefore) {
        return all()
                .filter(job -> isStale(job, status, updatedBefore))
                .collect(Collectors.toList());
    }

    @Override
    public int failStale(JobStatus status, Instant updatedBefore, String errorMessage) {
        int count = 0;
        for (CalculationJob candidate : findStale(status, updatedBefore)) {
            AtomicBoolean failed = new AtomicBoolean(false);
            upsert(candidate.getId(), job -> {
                failed.set(isStale(job, status, updatedBefore));
                return failed.get() ? failed(job, errorMessage, true) : job;
            });
            if (failed.get()) {
                log.warn("Job {} force-failed: stuck in {} since {}", candidate.getId(), status, candidate.getUpdatedAt());
                count++;
            }
        }
        return count;
    }

    @Override
    public Map<JobStatus, Long> countByStatus() {
        Map<JobStatus, Long> counts = new EnumMap<>(JobStatus.class);
        for (JobStatus status : JobStatus.values()) {
            counts.put(status, 0L);
        }
        all().forEach(job -> counts.merge(job.getStatus(), 1L, Long::sum));
        return counts;
    }

    private static boolean isStale(CalculationJob job, JobStatus status, Instant updatedBefore) {
        return job.getStatus() == status && job.getStatus().canBeAbandoned()
                && job.getUpdatedAt().isBefore(updatedBefore);
    }

    private CalculationJob failed(CalculationJob job, String errorMessage, boolean reconcilable) {
        Instant now = clock.instant();
        return job.toBuilder()
                .status(JobStatus.FAILED)
                .result(null)
                .errorMessage(errorMessage)
                .errorReconcilable(reconcilable)
                .completedAt(now)
                .updatedAt(now)
                .build();
    }

    private static ExecutionStage maxStage(CalculationJob job, ExecutionStage stage) {
        ExecutionStage current = job.getStage();
        return current == null || stage.getProgress() >= current.getProgress() ? stage : current;
    }
}
