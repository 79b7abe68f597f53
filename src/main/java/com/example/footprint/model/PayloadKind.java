package com.example.footprint.model;

/**
 * Тип полезной нагрузки задачи в очереди.
 */
public enum PayloadKind {
    CALCULATION
}
