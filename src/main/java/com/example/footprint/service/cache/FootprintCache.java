package com.example.footprint.service.cache;

import com.example.footprint.model.FootprintResult;

import java.util.Optional;

/**
 * Контентно-адресуемый кэш результатов расчёта.
 * Сбой бэкенда сообщается через {@link com.example.footprint.exception.CacheException}.
 */
public interface FootprintCache {

    Optional<FootprintResult> get(String key);

    /**
     * Записывает результат; при повторной записи по тому же ключу побеждает последняя.
     */
    void put(String key, FootprintResult value);

    String backendName();
}
