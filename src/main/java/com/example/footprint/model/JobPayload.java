package com.example.footprint.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Полезная нагрузка сообщения очереди. Каждый вариант объявляет свой {@link PayloadKind},
 * по которому пул воркеров выбирает функцию выполнения.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = CalculationPayload.class, name = "CALCULATION")
})
public interface JobPayload {

    PayloadKind kind();
}
