package com.example.footprint.service.calculation;

import lombok.Getter;

import java.util.Collections;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.TreeMap;

/**
 * Неизменяемый снимок таблицы GWP100 факторов конкретной версии.
 */
public final class GwpFactorTable {
    @Getter
    private final String version;
    private final Map<String, Double> factors;

    public GwpFactorTable(String version, Map<String, Double> factors) {
        this.version = version;
        this.factors = Collections.unmodifiableMap(new TreeMap<>(factors));
    }

    public OptionalDouble factorFor(String gasFormula) {
        Double factor = factors.get(gasFormula);
        return factor == null ? OptionalDouble.empty() : OptionalDouble.of(factor);
    }

    public Map<String, Double> asMap() {
        return factors;
    }
}
