package com.example.footprint.service.cache;

import com.example.footprint.model.CalculationOptions;
import com.example.footprint.model.MaterialInput;
import com.example.footprint.model.ProductInputs;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Вычисляет ключ кэша как SHA-256 от канонического JSON нормализованных входных данных,
 * параметров расчёта и версии таблицы факторов.
 * <p>
 * Нормализация: имена и категории материалов обрезаются и приводятся к нижнему регистру,
 * имена параметров только обрезаются, материалы сортируются, ключи объектов упорядочиваются.
 */
@Component
public class CacheKeyGenerator {
    private static final String PREFIX = "fp-";

    private final ObjectMapper canonicalMapper = JsonMapper.builder()
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .build();

    public String key(ProductInputs inputs, CalculationOptions options, String factorVersion) {
        Map<String, Object> canonical = new TreeMap<>();
        canonical.put("productCategory", normalize(inputs.getProductCategory()));
        canonical.put("materials", canonicalMaterials(inputs.getMaterials()));
        canonical.put("productionParameters", canonicalParameters(inputs.getProductionParameters()));
        canonical.put("method", options.getMethod() != null ? options.getMethod().name() : null);
        canonical.put("allocationMethod", options.getAllocationMethod() != null
                ? options.getAllocationMethod().name() : null);
        canonical.put("factorVersion", factorVersion);

        try {
            return PREFIX + sha256(canonicalMapper.writeValueAsString(canonical));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to build cache key", e);
        }
    }

    private static List<Map<String, Object>> canonicalMaterials(List<MaterialInput> materials) {
        return materials.stream()
                .map(material -> {
                    Map<String, Object> entry = new LinkedHashMap<>();
                    entry.put("category", normalize(material.getCategory()));
                    entry.put("massKg", material.getMassKg());
                    entry.put("name", normalize(material.getName()));
                    return entry;
                })
                .sorted(Comparator.<Map<String, Object>, String>comparing(m -> String.valueOf(m.get("name")))
                        .thenComparing(m -> String.valueOf(m.get("category")))
                        .thenComparingDouble(m -> (Double) m.get("massKg")))
                .collect(Collectors.toList());
    }

    // Имена параметров передаются движку как есть, поэтому регистр сохраняется
    private static Map<String, Double> canonicalParameters(Map<String, Double> parameters) {
        Map<String, Double> canonical = new TreeMap<>();
        parameters.forEach((name, value) -> canonical.put(name == null ? null : name.trim(), value));
        return canonical;
    }

    private static String normalize(String value) {
        return value == null ? null : value.trim().toLowerCase(Locale.ROOT);
    }

    private static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}
