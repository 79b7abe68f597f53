package com.example.footprint.service.worker;

import com.example.footprint.model.FootprintResult;
import com.example.footprint.model.InventoryFlow;
import lombok.Value;

import java.util.List;

/**
 * Результат общего для одинаковых задач вычисления: инвентаризация (пусто, если результат
 * взят из кэша), агрегированный след и число попыток вызова движка.
 */
@Value
class EngineOutcome {
    List<InventoryFlow> inventory;
    FootprintResult result;
    int attempts;
}
