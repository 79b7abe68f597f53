package com.example.footprint.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Нагрузка задачи расчёта углеродного и водного следа.
 * Входные данные не передаются через очередь: воркер читает снимок из хранилища задач.
 */
@Value
@Builder
@Jacksonized
public class CalculationPayload implements JobPayload {
    String subjectRef;

    public static CalculationPayload of(String subjectRef) {
        return CalculationPayload.builder().subjectRef(subjectRef).build();
    }

    @Override
    public PayloadKind kind() {
        return PayloadKind.CALCULATION;
    }
}
