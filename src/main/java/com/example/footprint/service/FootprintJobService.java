package com.example.footprint.service;

import com.example.footprint.config.PipelineConfig;
import com.example.footprint.dto.JobStatusResponse;
import com.example.footprint.dto.QueueStats;
import com.example.footprint.exception.JobNotFoundException;
import com.example.footprint.exception.QueueUnavailableException;
import com.example.footprint.model.AllocationMethod;
import com.example.footprint.model.CalculationJob;
import com.example.footprint.model.CalculationMethod;
import com.example.footprint.model.CalculationOptions;
import com.example.footprint.model.CalculationPayload;
import com.example.footprint.model.JobStatus;
import com.example.footprint.model.PayloadKind;
import com.example.footprint.model.ProductInputs;
import com.example.footprint.service.cache.FootprintCache;
import com.example.footprint.service.queue.JobQueue;
import com.example.footprint.service.store.JobStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Единственная точка входа для внешних вызывающих: постановка задач, опрос статуса и отмена.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class FootprintJobService {

    private final JobStore jobStore;
    private final JobQueue jobQueue;
    private final FootprintCache cache;
    private final SubmissionValidator validator;
    private final PipelineConfig config;

    /**
     * Ставит задачу расчёта в очередь.
     *
     * @param subjectRef ссылка на оцениваемый продукт
     * @param inputs     состав и производственные параметры
     * @param options    параметры расчёта, может быть null
     * @return ID задачи
     * @throws com.example.footprint.exception.ValidationException входные данные некорректны, задача не создаётся
     */
    public String submit(String subjectRef, ProductInputs inputs, CalculationOptions options) {
        validator.validate(subjectRef, inputs, options);
        CalculationOptions resolved = resolveOptions(options);

        String jobId = jobStore.create(subjectRef, PayloadKind.CALCULATION, inputs, resolved);
        try {
            jobQueue.enqueue(jobId, CalculationPayload.of(subjectRef));
        } catch (QueueUnavailableException e) {
            log.error("Job {} could not be enqueued: {}", jobId, e.getMessage());
            jobStore.abandon(jobId, "Job could not be enqueued: " + e.getMessage());
            throw e;
        }

        log.info("Job {} submitted for subject {} (method={}, factorVersion={})",
                jobId, subjectRef, resolved.getMethod(), resolved.getFactorVersion());
        return jobId;
    }

    /**
     * Возвращает статус задачи.
     *
     * @throws JobNotFoundException задача не найдена
     */
    public JobStatusResponse getStatus(String jobId) {
        return jobStore.get(jobId)
                .map(FootprintJobService::toResponse)
                .orElseThrow(() -> new JobNotFoundException(jobId));
    }

    /**
     * Запрашивает отмену. Выполняющийся воркер увидит её на ближайшей контрольной точке.
     *
     * @return false, если задача уже в терминальном статусе
     * @throws JobNotFoundException задача не найдена
     */
    public boolean cancel(String jobId) {
        if (jobStore.get(jobId).isEmpty()) {
            throw new JobNotFoundException(jobId);
        }
        boolean cancelled = jobStore.markCancelled(jobId);
        if (cancelled) {
            log.info("Job {} cancellation requested", jobId);
        }
        return cancelled;
    }

    public List<JobStatusResponse> listJobs(String subjectRef) {
        return jobStore.findBySubject(subjectRef).stream()
                .map(FootprintJobService::toResponse)
                .collect(Collectors.toList());
    }

    public QueueStats queueStats() {
        return QueueStats.builder()
                .jobsByStatus(jobStore.countByStatus())
                .queueDepth(jobQueue.size())
                .queueBackend(jobQueue.backendName())
                .cacheBackend(cache.backendName())
                .storeBackend(jobStore.backendName())
                .build();
    }

    private CalculationOptions resolveOptions(CalculationOptions options) {
        CalculationOptions.CalculationOptionsBuilder builder = options != null
                ? options.toBuilder()
                : CalculationOptions.builder();
        if (options == null || options.getMethod() == null) {
            builder.method(CalculationMethod.HYBRID);
        }
        if (options == null || options.getAllocationMethod() == null) {
            builder.allocationMethod(AllocationMethod.MASS);
        }
        if (options == null || options.getFactorVersion() == null) {
            builder.factorVersion(config.getDefaultFactorVersion());
        }
        return builder.build();
    }

    private static JobStatusResponse toResponse(CalculationJob job) {
        JobStatusResponse.JobStatusResponseBuilder builder = JobStatusResponse.builder()
                .jobId(job.getId())
                .subjectRef(job.getSubjectRef())
                .status(job.getStatus())
                .progress(job.getProgress())
                .currentStep(job.getStage() != null ? job.getStage().getDescription() : null)
                .attempt(job.getAttempt())
                .createdAt(job.getCreatedAt())
                .startedAt(job.getStartedAt())
                .completedAt(job.getCompletedAt());

        if (job.getStatus() == JobStatus.COMPLETED && job.getResult() != null) {
            builder.result(job.getResult())
                    .degraded(job.getResult().isDegraded());
        }
        if (job.getStatus() == JobStatus.FAILED) {
            builder.errorMessage(job.getErrorMessage())
                    .reconcilable(job.isErrorReconcilable());
        }
        if (job.getStatus() == JobStatus.CANCELLED) {
            builder.currentStep("Cancelled");
        }
        return builder.build();
    }
}
