package com.example.footprint.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * Сведения о происхождении результата расчёта.
 */
@Value
@Builder
@Jacksonized
public class FootprintMetadata {
    String engineVersion;
    String factorVersion;
    long durationMs;
    String calculationMethod;

    /**
     * Газы из инвентаризации, для которых в таблице факторов нет значения.
     */
    @Singular("excludedGas")
    List<String> excludedGases;
}
