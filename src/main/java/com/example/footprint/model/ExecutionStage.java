package com.example.footprint.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Этапы выполнения задачи. Каждый этап фиксируется в хранилище задач
 * до перехода к следующему, прогресс этапа не убывает.
 */
@Getter
@RequiredArgsConstructor
public enum ExecutionStage {
    QUEUED(0, "Queued"),
    CLAIMED(5, "Claimed by worker"),
    CACHE_LOOKUP(10, "Looking up cached result"),
    ENGINE_CALL(30, "Calculating inventory with external engine"),
    INVENTORY_RECEIVED(60, "Inventory received"),
    FALLBACK_ESTIMATION(70, "Estimating footprint with fallback multipliers"),
    AGGREGATED(80, "Greenhouse gases aggregated"),
    RESULT_WRITE(95, "Writing result"),
    DONE(100, "Completed");

    private final int progress;
    private final String description;
}
