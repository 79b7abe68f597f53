package com.example.footprint.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;

/**
 * Снимок состояния задачи расчёта.
 * <p>
 * Экземпляры неизменяемы: хранилище задач заменяет снимок целиком при каждом изменении.
 * {@code result} присутствует только в статусе COMPLETED, {@code errorMessage} только в FAILED.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class CalculationJob {
    String id;
    String subjectRef;
    PayloadKind payloadKind;
    JobStatus status;
    ExecutionStage stage;
    int progress;
    ProductInputs inputsSnapshot;
    CalculationOptions options;

    /**
     * Инвентаризация, зафиксированная после ответа движка. Позволяет продолжить
     * задачу с агрегации без повторного вызова движка.
     */
    List<InventoryFlow> inventory;

    FootprintResult result;
    String errorMessage;

    /**
     * Ошибка допускает сверку (сбой хранилища или зависшая задача), а не отказ по данным.
     */
    boolean errorReconcilable;

    int attempt;
    String workerId;
    Instant createdAt;
    Instant startedAt;
    Instant completedAt;

    /**
     * Время последнего изменения, используется как heartbeat аренды воркера.
     */
    Instant updatedAt;
}
