package com.example.footprint.model;

/**
 * Метод расчёта.
 */
public enum CalculationMethod {
    /**
     * Только внешний LCI движок; при его недоступности задача завершается ошибкой.
     */
    OPENLCA,
    /**
     * Внешний движок с откатом на оценку по категориям материалов.
     */
    HYBRID;

    public boolean allowsFallback() {
        return this == HYBRID;
    }
}
