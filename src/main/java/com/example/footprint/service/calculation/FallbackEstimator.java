package com.example.footprint.service.calculation;

import com.example.footprint.model.CalculationOptions;
import com.example.footprint.model.FootprintMetadata;
import com.example.footprint.model.FootprintResult;
import com.example.footprint.model.MaterialInput;
import com.example.footprint.model.ProductInputs;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Оценка следа по заявленному составу продукта, когда внешний движок недоступен.
 * <p>
 * totalCo2e = Σ massKg × co2ePerKg(category), waterFootprintLiters = Σ massKg × waterLitersPerKg(category).
 * Результат всегда помечен {@code degraded = true} и не содержит разбивки по газам.
 */
@Component
public class FallbackEstimator {
    public static final String METHOD = "fallback-category-multipliers";

    /**
     * Оценка применима только для метода HYBRID и только если для каждой категории
     * материала есть множитель.
     */
    public boolean isApplicable(ProductInputs inputs, CalculationOptions options) {
        if (options.getMethod() == null || !options.getMethod().allowsFallback()) {
            return false;
        }
        return !inputs.getMaterials().isEmpty()
                && inputs.getMaterials().stream()
                .allMatch(material -> FallbackCategory.of(material.getCategory()).isPresent());
    }

    public FootprintResult estimate(ProductInputs inputs, long durationMs) {
        List<MaterialInput> materials = inputs.getMaterials().stream()
                .sorted(Comparator.comparing(MaterialInput::getName)
                        .thenComparing(MaterialInput::getCategory)
                        .thenComparing(MaterialInput::getMassKg))
                .collect(Collectors.toList());

        double totalCo2e = 0.0;
        double waterLiters = 0.0;
        for (MaterialInput material : materials) {
            FallbackCategory category = FallbackCategory.of(material.getCategory())
                    .orElseThrow(() -> new IllegalArgumentException(
                            "No fallback multiplier for category '" + material.getCategory() + "'"));
            totalCo2e += material.getMassKg() * category.getCo2ePerKg();
            waterLiters += material.getMassKg() * category.getWaterLitersPerKg();
        }

        return FootprintResult.builder()
                .totalCo2e(totalCo2e)
                .waterFootprintLiters(waterLiters)
                .degraded(true)
                .metadata(FootprintMetadata.builder()
                        .engineVersion(null)
                        .factorVersion(FallbackCategory.TABLE_VERSION)
                        .durationMs(durationMs)
                        .calculationMethod(METHOD)
                        .build())
                .build();
    }
}
