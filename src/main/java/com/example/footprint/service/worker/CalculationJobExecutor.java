package com.example.footprint.service.worker;

import com.example.footprint.exception.CacheException;
import com.example.footprint.exception.EngineDataException;
import com.example.footprint.exception.EngineUnavailableException;
import com.example.footprint.exception.JobCancelledException;
import com.example.footprint.exception.PersistenceException;
import com.example.footprint.metrics.PipelineMetrics;
import com.example.footprint.model.CalculationJob;
import com.example.footprint.model.ExecutionStage;
import com.example.footprint.model.FootprintResult;
import com.example.footprint.model.InventoryFlow;
import com.example.footprint.model.JobStatus;
import com.example.footprint.service.cache.CacheKeyGenerator;
import com.example.footprint.service.cache.FootprintCache;
import com.example.footprint.service.cache.SingleFlight;
import com.example.footprint.service.calculation.CalculationCore;
import com.example.footprint.service.calculation.FallbackEstimator;
import com.example.footprint.service.calculation.GwpFactorSource;
import com.example.footprint.service.calculation.GwpFactorTable;
import com.example.footprint.service.engine.LciEngineClient;
import com.example.footprint.service.engine.ProductSystemDescriptor;
import com.example.footprint.service.store.JobStore;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Выполняет одну задачу расчёта как последовательность этапов.
 * <p>
 * Каждый этап фиксируется в хранилище задач до перехода к следующему. Инвентаризация,
 * полученная от движка, сохраняется в задаче, поэтому повторно захваченная задача
 * продолжает с агрегации. Отмена проверяется после захвата, перед вызовом движка,
 * после ответа движка и перед записью результата.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CalculationJobExecutor {

    private final JobStore jobStore;
    private final FootprintCache cache;
    private final CacheKeyGenerator keyGenerator;
    private final LciEngineClient engineClient;
    private final GwpFactorSource factorSource;
    private final CalculationCore calculationCore;
    private final FallbackEstimator fallbackEstimator;
    private final EngineCallPolicy engineCallPolicy;
    private final PipelineMetrics metrics;
    private final Clock clock;

    private final SingleFlight<EngineOutcome> singleFlight = new SingleFlight<>();

    /**
     * Задачи, выполняемые в этом процессе. Аренда общая для воркеров экземпляра,
     * поэтому повторная доставка уже выполняемой задачи отсекается здесь.
     */
    private final Set<String> runningJobs = ConcurrentHashMap.newKeySet();

    /**
     * Захватывает и выполняет задачу. Все ошибки фиксируются в задаче.
     *
     * @param jobId    ID задачи
     * @param workerId идентификатор воркера
     */
    public void execute(String jobId, String workerId) {
        if (!runningJobs.add(jobId)) {
            log.info("Job {} is already running in this instance, skipping duplicate delivery to {}", jobId, workerId);
            return;
        }
        try {
            claimAndRun(jobId, workerId);
        } finally {
            runningJobs.remove(jobId);
        }
    }

    private void claimAndRun(String jobId, String workerId) {
        Optional<CalculationJob> claimed;
        try {
            claimed = jobStore.claim(jobId, workerId);
        } catch (PersistenceException e) {
            log.error("Job {} could not be claimed by {}, leaving it to the stuck job sweep: {}",
                    jobId, workerId, e.getMessage());
            return;
        }
        if (claimed.isEmpty()) {
            log.info("Job {} is not claimable (terminal, cancelled or leased by another instance), skipping", jobId);
            return;
        }

        CalculationJob job = claimed.get();
        log.info("Job {} claimed by {} at stage {}", jobId, workerId, job.getStage());

        Timer.Sample totalSample = metrics.startTimer();
        metrics.incrementActiveJobs();
        try {
            FootprintResult result = run(job);
            if (jobStore.complete(jobId, result)) {
                metrics.recordCompleted(result.isDegraded());
                log.info("Job {} completed: {} kg CO2e{}", jobId, result.getTotalCo2e(),
                        result.isDegraded() ? " (degraded)" : "");
            } else {
                reportRejectedResult(jobId);
            }
        } catch (JobCancelledException e) {
            metrics.recordCancelled();
            log.info("Job {} cancelled at stage {}, no result written", jobId, e.getStage());
        } catch (EngineDataException e) {
            log.warn("Job {} failed on unusable engine data: {}", jobId, e.getMessage());
            failJob(jobId, "Engine data error: " + e.getMessage(), false);
        } catch (EngineUnavailableException e) {
            log.warn("Job {} failed: engine unavailable and no fallback applies: {}", jobId, e.getMessage());
            failJob(jobId, "External engine unavailable after " + engineCallPolicy.maxAttempts()
                    + " attempts: " + e.getMessage(), false);
        } catch (PersistenceException e) {
            log.error("Job {} failed on job store write: {}", jobId, e.getMessage(), e);
            failJob(jobId, "Job store write failed: " + e.getMessage(), true);
        } catch (RuntimeException e) {
            log.error("Job {} failed: {}", jobId, e.getMessage(), e);
            failJob(jobId, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(), false);
        } finally {
            metrics.decrementActiveJobs();
            metrics.recordJobDuration(totalSample);
        }
    }

    private FootprintResult run(CalculationJob job) {
        String jobId = job.getId();
        checkCancelled(jobId, ExecutionStage.CLAIMED);

        String key = keyGenerator.key(job.getInputsSnapshot(), job.getOptions(), job.getOptions().getFactorVersion());

        // 1. Кэш
        advance(jobId, ExecutionStage.CACHE_LOOKUP);
        Timer.Sample lookupSample = metrics.startTimer();
        Optional<FootprintResult> cached = lookup(jobId, key);
        metrics.recordStepDuration(lookupSample, "cache_lookup");
        if (cached.isPresent()) {
            metrics.recordCacheHit();
            log.info("Job {} served from cache entry {}", jobId, key);
            return beforeWrite(jobId, cached.get());
        }
        metrics.recordCacheMiss();

        // 2. Продолжение после падения воркера
        if (job.getInventory() != null) {
            log.info("Job {} resumes from committed inventory of {} flows", jobId, job.getInventory().size());
            FootprintResult result = aggregate(job, job.getInventory(), 0L);
            store(jobId, key, result);
            advance(jobId, ExecutionStage.AGGREGATED);
            return beforeWrite(jobId, result);
        }

        // 3. Внешний движок
        checkCancelled(jobId, ExecutionStage.ENGINE_CALL);
        advance(jobId, ExecutionStage.ENGINE_CALL);
        AtomicBoolean joined = new AtomicBoolean(false);
        EngineOutcome outcome;
        try {
            outcome = singleFlight.execute(key, () -> computeFromEngine(job, key), () -> {
                joined.set(true);
                metrics.recordSingleFlightJoined();
            });
        } catch (EngineUnavailableException e) {
            if (joined.get()) {
                inheritAttempts(jobId, engineCallPolicy.maxAttempts());
            }
            if (!fallbackEstimator.isApplicable(job.getInputsSnapshot(), job.getOptions())) {
                throw e;
            }
            return estimateWithFallback(job, e);
        }
        if (joined.get()) {
            inheritAttempts(jobId, outcome.getAttempts());
        }

        // 4. Фиксация инвентаризации и агрегация
        checkCancelled(jobId, ExecutionStage.INVENTORY_RECEIVED);
        if (outcome.getInventory() != null) {
            jobStore.recordInventory(jobId, outcome.getInventory());
        }
        advance(jobId, ExecutionStage.AGGREGATED);
        return beforeWrite(jobId, outcome.getResult());
    }

    /**
     * Общая для задач с одинаковым ключом работа: вызов движка, агрегация и запись в кэш.
     * Выполняется внутри single-flight, поэтому не проверяет отмену конкретной задачи.
     */
    private EngineOutcome computeFromEngine(CalculationJob job, String key) {
        Optional<FootprintResult> cached = lookup(job.getId(), key);
        if (cached.isPresent()) {
            log.info("Job {} found cache entry {} written by a concurrent job", job.getId(), key);
            return new EngineOutcome(null, cached.get(), 0);
        }

        long started = clock.millis();
        Timer.Sample engineSample = metrics.startTimer();
        ProductSystemDescriptor descriptor = ProductSystemDescriptor.from(job);
        AtomicInteger attempts = new AtomicInteger();
        List<InventoryFlow> flows = engineCallPolicy.call(
                job.getId(),
                () -> engineClient.calculateInventory(descriptor),
                attempt -> {
                    attempts.set(attempt);
                    onEngineAttempt(job.getId(), attempt);
                });
        metrics.recordStepDuration(engineSample, "engine");

        FootprintResult result = aggregate(job, flows, clock.millis() - started);
        store(job.getId(), key, result);
        return new EngineOutcome(flows, result, attempts.get());
    }

    private FootprintResult aggregate(CalculationJob job, List<InventoryFlow> flows, long durationMs) {
        Timer.Sample aggregateSample = metrics.startTimer();
        GwpFactorTable factors = factorSource.table(job.getOptions().getFactorVersion());
        FootprintResult result = calculationCore.calculate(
                flows, factors, job.getOptions(), engineClient.engineVersion(), durationMs);
        metrics.recordStepDuration(aggregateSample, "aggregate");
        if (!result.getMetadata().getExcludedGases().isEmpty()) {
            log.warn("Job {}: gases without {} factor excluded: {}",
                    job.getId(), factors.getVersion(), result.getMetadata().getExcludedGases());
        }
        return result;
    }

    private FootprintResult estimateWithFallback(CalculationJob job, EngineUnavailableException cause) {
        String jobId = job.getId();
        checkCancelled(jobId, ExecutionStage.FALLBACK_ESTIMATION);
        log.warn("Job {}: engine unavailable after {} attempts ({}), using fallback estimation",
                jobId, engineCallPolicy.maxAttempts(), cause.getMessage());
        advance(jobId, ExecutionStage.FALLBACK_ESTIMATION);

        Timer.Sample fallbackSample = metrics.startTimer();
        long elapsed = job.getStartedAt() != null ? clock.millis() - job.getStartedAt().toEpochMilli() : 0L;
        FootprintResult result = fallbackEstimator.estimate(job.getInputsSnapshot(), elapsed);
        metrics.recordStepDuration(fallbackSample, "fallback");
        return beforeWrite(jobId, result);
    }

    private FootprintResult beforeWrite(String jobId, FootprintResult result) {
        checkCancelled(jobId, ExecutionStage.RESULT_WRITE);
        advance(jobId, ExecutionStage.RESULT_WRITE);
        return result;
    }

    private Optional<FootprintResult> lookup(String jobId, String key) {
        try {
            return cache.get(key);
        } catch (CacheException e) {
            metrics.recordCacheError();
            log.warn("Job {}: cache lookup bypassed: {}", jobId, e.getMessage());
            return Optional.empty();
        }
    }

    private void store(String jobId, String key, FootprintResult result) {
        if (result.isDegraded()) {
            return;
        }
        try {
            cache.put(key, result);
        } catch (CacheException e) {
            metrics.recordCacheError();
            log.warn("Job {}: cache write skipped: {}", jobId, e.getMessage());
        }
    }

    private void onEngineAttempt(String jobId, int attempt) {
        jobStore.incrementAttempt(jobId);
        if (attempt > 1) {
            metrics.recordEngineRetry();
        }
    }

    /**
     * Задача, присоединившаяся к чужому вызову движка, получает его число попыток.
     */
    private void inheritAttempts(String jobId, int attempts) {
        for (int i = 0; i < attempts; i++) {
            jobStore.incrementAttempt(jobId);
        }
    }

    private void reportRejectedResult(String jobId) {
        JobStatus status = jobStore.get(jobId).map(CalculationJob::getStatus).orElse(null);
        if (status == JobStatus.CANCELLED) {
            metrics.recordCancelled();
            log.info("Job {} was cancelled before its result was written", jobId);
        } else {
            log.warn("Job {} result discarded: job is {} (failed by the stuck job sweep or removed)", jobId, status);
        }
    }

    private void advance(String jobId, ExecutionStage stage) {
        jobStore.updateProgress(jobId, stage);
        log.debug("Job {}: {}% - {}", jobId, stage.getProgress(), stage.getDescription());
    }

    private void checkCancelled(String jobId, ExecutionStage stage) {
        if (jobStore.isCancelled(jobId)) {
            throw new JobCancelledException(jobId, stage);
        }
    }

    private void failJob(String jobId, String message, boolean reconcilable) {
        try {
            if (jobStore.fail(jobId, message, reconcilable)) {
                metrics.recordFailed();
            }
        } catch (PersistenceException e) {
            log.error("Job {} could not be marked failed, leaving it to the stuck job sweep: {}",
                    jobId, e.getMessage());
        }
    }
}
