package com.example.footprint.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;

/**
 * Входные данные продукта: состав и производственные параметры.
 * Экземпляр неизменяем и сохраняется в задаче как снимок на момент постановки.
 */
@Value
@Builder
@Jacksonized
public class ProductInputs {
    String productCategory;

    @NotEmpty
    @Singular
    List<@Valid MaterialInput> materials;

    @Singular
    Map<String, Double> productionParameters;
}
