package com.example.footprint.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Итог расчёта следа продукта.
 * <p>
 * {@code degraded = true} означает, что результат получен оценкой по категориям,
 * а не внешним движком. Такие результаты не кэшируются.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class FootprintResult {
    /**
     * Суммарные выбросы, кг CO2e.
     */
    double totalCo2e;

    /**
     * Вклад отдельных газов в алфавитном порядке.
     */
    @Singular("ghgEntry")
    List<GasContribution> ghgBreakdown;

    double waterFootprintLiters;
    boolean degraded;
    FootprintMetadata metadata;
}
