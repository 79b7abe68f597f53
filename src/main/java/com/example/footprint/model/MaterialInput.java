package com.example.footprint.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Компонент состава продукта (ингредиент или упаковочный материал).
 */
@Value
@Builder
@Jacksonized
public class MaterialInput {
    @NotBlank
    String name;

    /**
     * Категория материала, например glass, aluminum, apples.
     */
    @NotBlank
    String category;

    @NotNull
    @Positive
    Double massKg;
}
