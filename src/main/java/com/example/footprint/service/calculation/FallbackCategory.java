package com.example.footprint.service.calculation;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Locale;
import java.util.Optional;

/**
 * Опубликованные множители для оценочного расчёта по категориям материалов.
 * <p>
 * Значения: кг CO2e на кг материала и литры воды на кг материала
 * (упаковка по DEFRA 2024, ингредиенты по ecoinvent 3.8).
 */
@Getter
@RequiredArgsConstructor
public enum FallbackCategory {
    GLASS(0.7, 2.5),
    ALUMINUM(8.2, 15.0),
    PLASTIC(2.3, 8.0),
    STEEL(1.8, 12.0),
    CERAMIC(1.2, 6.0),
    PAPER(1.1, 25.0),
    MOLASSES(0.89, 26.0),
    APPLES(0.53, 822.0);

    /**
     * Версия набора множителей, записываемая в метаданные результата.
     */
    public static final String TABLE_VERSION = "fallback-2024.1";

    private final double co2ePerKg;
    private final double waterLitersPerKg;

    public static Optional<FallbackCategory> of(String category) {
        if (category == null || category.isBlank()) {
            return Optional.empty();
        }
        String normalized = category.trim().toUpperCase(Locale.ROOT).replace(' ', '_').replace('-', '_');
        if (normalized.equals("ALUMINIUM")) {
            normalized = "ALUMINUM";
        }
        for (FallbackCategory value : values()) {
            if (value.name().equals(normalized)) {
                return Optional.of(value);
            }
        }
        return Optional.empty();
    }
}
