package com.example.footprint.service.calculation;

import com.example.footprint.model.CalculationMethod;
import com.example.footprint.model.CalculationOptions;
import com.example.footprint.model.FootprintResult;
import com.example.footprint.model.MaterialInput;
import com.example.footprint.model.ProductInputs;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FallbackEstimatorTest {

    private static final CalculationOptions HYBRID = CalculationOptions.builder()
            .method(CalculationMethod.HYBRID)
            .build();

    private final FallbackEstimator estimator = new FallbackEstimator();

    @Test
    void shouldApplyCategoryMultipliers() {
        // Given: 0.5 кг стекла и 2 кг яблок
        ProductInputs inputs = ProductInputs.builder()
                .productCategory("cider")
                .material(material("Bottle", "glass", 0.5))
                .material(material("Apples", "apples", 2.0))
                .build();

        // When
        FootprintResult result = estimator.estimate(inputs, 15L);

        // Then
        assertEquals(0.5 * 0.7 + 2.0 * 0.53, result.getTotalCo2e(), 1e-9);
        assertEquals(0.5 * 2.5 + 2.0 * 822.0, result.getWaterFootprintLiters(), 1e-9);
        assertTrue(result.isDegraded());
        assertTrue(result.getGhgBreakdown().isEmpty());
        assertEquals(FallbackEstimator.METHOD, result.getMetadata().getCalculationMethod());
        assertEquals(FallbackCategory.TABLE_VERSION, result.getMetadata().getFactorVersion());
        assertEquals(15L, result.getMetadata().getDurationMs());
    }

    @Test
    void shouldBeApplicableOnlyForHybridMethod() {
        ProductInputs inputs = ProductInputs.builder()
                .material(material("Can", "Aluminium", 0.02))
                .build();

        assertTrue(estimator.isApplicable(inputs, HYBRID));
        assertFalse(estimator.isApplicable(inputs, HYBRID.toBuilder().method(CalculationMethod.OPENLCA).build()));
        assertFalse(estimator.isApplicable(inputs, HYBRID.toBuilder().method(null).build()));
    }

    @Test
    void shouldNotBeApplicableWhenCategoryHasNoMultiplier() {
        ProductInputs inputs = ProductInputs.builder()
                .material(material("Bottle", "glass", 0.5))
                .material(material("Stopper", "cork", 0.01))
                .build();

        assertFalse(estimator.isApplicable(inputs, HYBRID));
    }

    @Test
    void shouldNormalizeCategoryNames() {
        assertEquals(FallbackCategory.ALUMINUM, FallbackCategory.of(" aluminium ").orElseThrow());
        assertEquals(FallbackCategory.PLASTIC, FallbackCategory.of("Plastic").orElseThrow());
        assertTrue(FallbackCategory.of("unobtainium").isEmpty());
        assertTrue(FallbackCategory.of(null).isEmpty());
    }

    private static MaterialInput material(String name, String category, double massKg) {
        return MaterialInput.builder()
                .name(name)
                .category(category)
                .massKg(massKg)
                .build();
    }
}
