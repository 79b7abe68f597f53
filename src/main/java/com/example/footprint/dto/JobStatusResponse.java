package com.example.footprint.dto;

import com.example.footprint.model.FootprintResult;
import com.example.footprint.model.JobStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Статус задачи для внешних вызывающих.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class JobStatusResponse {
    private String jobId;
    private String subjectRef;
    private JobStatus status;
    private int progress;
    private String currentStep;
    private int attempt;

    /**
     * Присутствует только для COMPLETED
     */
    private FootprintResult result;

    /**
     * Результат получен оценкой по категориям, а не внешним движком
     */
    private boolean degraded;

    /**
     * Присутствует только для FAILED
     */
    private String errorMessage;

    private boolean reconcilable;
    private Instant createdAt;
    private Instant startedAt;
    private Instant completedAt;
}
