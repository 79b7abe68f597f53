package com.example.footprint.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Параметры расчёта. Пустые поля заполняются значениями по умолчанию при постановке задачи.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class CalculationOptions {
    CalculationMethod method;
    AllocationMethod allocationMethod;
    String factorVersion;
}
