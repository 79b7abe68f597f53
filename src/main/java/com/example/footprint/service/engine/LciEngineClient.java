package com.example.footprint.service.engine;

import com.example.footprint.model.InventoryFlow;

import java.util.List;

/**
 * Клиент внешнего LCI движка.
 */
public interface LciEngineClient {

    /**
     * Рассчитывает инвентаризацию жизненного цикла описанной производственной системы.
     *
     * @throws com.example.footprint.exception.EngineUnavailableException сеть, таймаут, перегрузка движка
     * @throws com.example.footprint.exception.EngineDataException        ответ получен, но непригоден
     */
    List<InventoryFlow> calculateInventory(ProductSystemDescriptor descriptor);

    /**
     * Версия движка для метаданных результата.
     */
    String engineVersion();
}
