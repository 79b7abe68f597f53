package com.example.footprint.dto;

import com.example.footprint.model.CalculationOptions;
import com.example.footprint.model.ProductInputs;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Запрос на расчёт, читаемый из JSON файла в CLI режиме.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CalculationRequest {
    private String subjectRef;
    private ProductInputs inputs;
    private CalculationOptions options;
}
