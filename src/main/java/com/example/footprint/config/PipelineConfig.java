package com.example.footprint.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Основная конфигурация конвейера расчётов.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "pipeline")
public class PipelineConfig {
    /**
     * Версия таблицы GWP факторов, если она не указана в задаче
     */
    private String defaultFactorVersion = "AR6";

    private Workers workers = new Workers();
    private Retry retry = new Retry();
    private Store store = new Store();
    private Backend backend = new Backend();

    /**
     * Режим выбора бэкенда: AUTO проверяет доступность Redis при старте.
     */
    public enum BackendMode {
        AUTO,
        REDIS,
        MEMORY
    }

    @Data
    public static class Workers {
        /**
         * Количество параллельных воркеров
         */
        private int count = 4;

        /**
         * Время ожидания сообщения из очереди за одну итерацию
         */
        private Duration pollTimeout = Duration.ofSeconds(1);

        /**
         * Запускать ли воркеры вместе с приложением
         */
        private boolean autoStart = true;

        /**
         * Сколько ждать завершения текущих задач при остановке
         */
        private Duration shutdownTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Retry {
        /**
         * Максимальное число попыток вызова движка (K)
         */
        private int maxAttempts = 3;

        private Duration initialBackoff = Duration.ofSeconds(2);

        private double multiplier = 2.0;

        /**
         * Доля случайного разброса задержки (jitter)
         */
        private double randomizationFactor = 0.5;

        /**
         * Потолок времени одной попытки вызова движка
         */
        private Duration attemptTimeout = Duration.ofSeconds(60);
    }

    @Data
    public static class Store {
        /**
         * Через сколько без heartbeat задача в PROCESSING может быть захвачена другим воркером
         */
        private Duration leaseTimeout = Duration.ofMinutes(5);

        /**
         * Задачи в PROCESSING дольше этого срока принудительно завершаются ошибкой
         */
        private Duration processingTimeout = Duration.ofMinutes(10);

        /**
         * Задачи в PENDING дольше этого срока принудительно завершаются ошибкой
         */
        private Duration pendingTimeout = Duration.ofMinutes(30);

        private Duration sweepInterval = Duration.ofSeconds(30);
    }

    @Data
    public static class Backend {
        private BackendMode store = BackendMode.AUTO;
        private BackendMode queue = BackendMode.AUTO;
        private BackendMode cache = BackendMode.AUTO;

        /**
         * Префикс ключей Redis
         */
        private String keyPrefix = "footprint";

        /**
         * Идентификатор экземпляра для списка сообщений в обработке и владельца аренды задач.
         * Если не задан, берётся имя хоста.
         */
        private String instanceId;

        /**
         * Максимальный размер локального кэша
         */
        private long cacheMaxEntries = 1000;

        /**
         * TTL записей в Redis кэше; ноль означает хранение без срока
         */
        private Duration cacheTtl = Duration.ZERO;

        /**
         * Через сколько повторно пробовать Redis после сбоя очереди
         */
        private Duration failoverRecheckInterval = Duration.ofSeconds(30);
    }
}
