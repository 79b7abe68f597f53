package com.example.footprint.model;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Поток инвентаризации жизненного цикла, полученный от внешнего движка.
 */
@Value
@Builder
@Jacksonized
public class InventoryFlow {
    String name;
    String category;
    double amount;
    String unit;

    public FlowCategory flowCategory() {
        return FlowCategory.classify(category);
    }
}
