package com.example.footprint.service.store;

import com.example.footprint.config.PipelineConfig;
import com.example.footprint.exception.PersistenceException;
import com.example.footprint.model.JobStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * Фоновая сверка: принудительно завершает задачи, зависшие в PROCESSING (упавший воркер)
 * или в PENDING (потерянное сообщение очереди).
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StuckJobSweeper {

    private final JobStore jobStore;
    private final PipelineConfig config;
    private final Clock clock;

    @Scheduled(fixedDelayString = "${pipeline.store.sweep-interval:PT30S}",
            initialDelayString = "${pipeline.store.sweep-interval:PT30S}")
    public void sweep() {
        try {
            int swept = sweepOnce();
            if (swept > 0) {
                log.warn("Stuck job sweep force-failed {} job(s)", swept);
            }
        } catch (PersistenceException e) {
            log.error("Stuck job sweep failed, will retry on next run: {}", e.getMessage(), e);
        }
    }

    /**
     * Выполняет один проход сверки.
     *
     * @return количество принудительно завершённых задач
     */
    public int sweepOnce() {
        PipelineConfig.Store store = config.getStore();
        Instant now = clock.instant();

        int stuck = jobStore.failStale(
                JobStatus.PROCESSING,
                now.minus(store.getProcessingTimeout()),
                "Job exceeded processing timeout of " + store.getProcessingTimeout()
                        + " without progress; force-failed for reconciliation");

        int orphaned = jobStore.failStale(
                JobStatus.PENDING,
                now.minus(store.getPendingTimeout()),
                "Job was not picked up within " + store.getPendingTimeout()
                        + "; force-failed for reconciliation");

        return stuck + orphaned;
    }
}
