package com.example.footprint.service.calculation;

import com.example.footprint.exception.EngineDataException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.TreeMap;

/**
 * Загружает таблицы факторов из ресурсов {@code gwp/*.json} при старте.
 * <p>
 * Формат файла: {@code {"version": "AR6", "source": "...", "factors": {"CO2": 1.0, ...}}}.
 * Опубликованная версия не изменяется: новые значения оформляются новой версией.
 */
@Slf4j
@Component
public class ClasspathGwpFactorSource implements GwpFactorSource {
    private static final String LOCATION = "classpath*:gwp/*.json";

    private final Map<String, GwpFactorTable> tables;

    public ClasspathGwpFactorSource(ObjectMapper objectMapper) {
        this.tables = Collections.unmodifiableMap(load(objectMapper));
        log.info("Loaded GWP factor tables: {}", tables.keySet());
    }

    @Override
    public OptionalDouble getGwpFactor(String gasFormula, String factorVersion) {
        GwpFactorTable table = tables.get(factorVersion);
        return table == null ? OptionalDouble.empty() : table.factorFor(gasFormula);
    }

    @Override
    public GwpFactorTable table(String factorVersion) {
        GwpFactorTable table = tables.get(factorVersion);
        if (table == null) {
            throw new EngineDataException("Unknown GWP factor version: " + factorVersion);
        }
        return table;
    }

    @Override
    public Set<String> availableVersions() {
        return tables.keySet();
    }

    private static Map<String, GwpFactorTable> load(ObjectMapper objectMapper) {
        Map<String, GwpFactorTable> loaded = new TreeMap<>();
        try {
            Resource[] resources = new PathMatchingResourcePatternResolver().getResources(LOCATION);
            for (Resource resource : resources) {
                try (InputStream in = resource.getInputStream()) {
                    JsonNode root = objectMapper.readTree(in);
                    String version = root.path("version").asText();
                    Map<String, Double> factors = new TreeMap<>();
                    root.path("factors").fields()
                            .forEachRemaining(field -> factors.put(field.getKey(), field.getValue().asDouble()));
                    if (version.isBlank() || factors.isEmpty()) {
                        throw new IllegalStateException("Invalid GWP factor table " + resource.getFilename());
                    }
                    loaded.put(version, new GwpFactorTable(version, factors));
                }
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load GWP factor tables: " + e.getMessage(), e);
        }
        return loaded;
    }
}
