package com.example.footprint.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Конфигурация внешнего LCI движка (openLCA IPC сервер).
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "lci-engine")
public class LciEngineConfig {
    /**
     * Базовый URL JSON-RPC сервера
     */
    private String baseUrl = "http://localhost:8080";

    /**
     * API ключ (Bearer)
     */
    private String apiKey;

    /**
     * Идентификатор базы данных движка
     */
    private String databaseId;

    /**
     * Таймаут HTTP запроса в секундах
     */
    private int timeoutSeconds = 60;

    /**
     * Версия движка, записываемая в метаданные результата
     */
    private String engineVersion = "openLCA 2.0";
}
