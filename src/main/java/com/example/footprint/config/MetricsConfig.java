package com.example.footprint.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.config.MeterFilter;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Конфигурация метрик Micrometer.
 */
@Configuration
public class MetricsConfig {

    /**
     * Ограничивает число значений тега step у таймера этапов.
     */
    @Bean
    public MeterRegistryCustomizer<MeterRegistry> stepTagLimit() {
        return registry -> registry.config()
                .meterFilter(MeterFilter.maximumAllowableTags("footprint.step.duration", "step", 20, MeterFilter.deny()));
    }
}
