package com.example.footprint.model;

/**
 * Статус задачи расчёта.
 */
public enum JobStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED,
    CANCELLED;

    /**
     * Терминальные статусы больше не меняются.
     */
    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    /**
     * Проверяет допустимость перехода.
     * <p>
     * PROCESSING → PROCESSING допускается для повторного захвата задачи
     * после истечения аренды упавшего воркера.
     */
    public boolean canTransitionTo(JobStatus next) {
        switch (this) {
            case PENDING:
                return next == PROCESSING || next == CANCELLED;
            case PROCESSING:
                return next == PROCESSING || next == COMPLETED || next == FAILED || next == CANCELLED;
            default:
                return false;
        }
    }

    /**
     * Задачу, потерянную конвейером (не попала в очередь, зависла), можно принудительно
     * завершить ошибкой из любого нетерминального статуса, в том числе из PENDING.
     */
    public boolean canBeAbandoned() {
        return !isTerminal();
    }
}
