package com.example.footprint.model;

import java.util.Locale;

/**
 * Классификация потока инвентаризации по строке категории движка.
 */
public enum FlowCategory {
    AIR_EMISSION,
    WATER_CONSUMPTION,
    OTHER;

    public static FlowCategory classify(String category) {
        if (category == null) {
            return OTHER;
        }
        String normalized = category.trim().toLowerCase(Locale.ROOT);
        if (normalized.equals("air")
                || normalized.startsWith("air/")
                || normalized.contains("emission to air")
                || normalized.contains("emissions to air")) {
            return AIR_EMISSION;
        }
        if (normalized.contains("water consumption")
                || normalized.contains("water use")
                || normalized.contains("resource/in water")) {
            return WATER_CONSUMPTION;
        }
        return OTHER;
    }
}
