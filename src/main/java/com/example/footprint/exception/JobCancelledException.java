package com.example.footprint.exception;

import com.example.footprint.model.ExecutionStage;
import lombok.Getter;

/**
 * Прерывает выполнение задачи на контрольной точке после запроса отмены.
 * Используется только внутри воркера.
 */
@Getter
public class JobCancelledException extends FootprintException {
    private final String jobId;
    private final ExecutionStage stage;

    public JobCancelledException(String jobId, ExecutionStage stage) {
        super("Job " + jobId + " cancelled at stage " + stage);
        this.jobId = jobId;
        this.stage = stage;
    }
}
