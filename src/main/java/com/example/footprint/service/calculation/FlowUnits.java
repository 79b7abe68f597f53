package com.example.footprint.service.calculation;

import com.example.footprint.exception.EngineDataException;

import java.util.Locale;
import java.util.Map;

/**
 * Приведение единиц потоков инвентаризации: масса к килограммам, вода к литрам.
 */
public final class FlowUnits {

    private static final Map<String, Double> MASS_TO_KG = Map.of(
            "kg", 1.0,
            "g", 0.001,
            "mg", 0.000001,
            "t", 1000.0,
            "tonne", 1000.0
    );

    private static final Map<String, Double> VOLUME_TO_LITERS = Map.of(
            "l", 1.0,
            "ml", 0.001,
            "m3", 1000.0,
            // вода: 1 кг = 1 л
            "kg", 1.0,
            "t", 1000.0
    );

    private FlowUnits() {
    }

    public static double toKilograms(String flowName, double amount, String unit) {
        return convert(flowName, amount, unit, MASS_TO_KG, "mass");
    }

    public static double toLiters(String flowName, double amount, String unit) {
        return convert(flowName, amount, unit, VOLUME_TO_LITERS, "water");
    }

    private static double convert(String flowName, double amount, String unit,
                                  Map<String, Double> factors, String kind) {
        if (!Double.isFinite(amount)) {
            throw new EngineDataException("Flow '" + flowName + "' has non-finite amount " + amount);
        }
        Double factor = unit == null ? null : factors.get(unit.trim().toLowerCase(Locale.ROOT));
        if (factor == null) {
            throw new EngineDataException("Flow '" + flowName + "' has unsupported " + kind + " unit '" + unit + "'");
        }
        return amount * factor;
    }
}
