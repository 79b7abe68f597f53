package com.example.footprint.service;

import com.example.footprint.exception.ValidationException;
import com.example.footprint.model.CalculationOptions;
import com.example.footprint.model.MaterialInput;
import com.example.footprint.model.ProductInputs;
import com.example.footprint.service.calculation.GwpFactorSource;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Структурная проверка входных данных задачи до её создания.
 */
@Component
@RequiredArgsConstructor
public class SubmissionValidator {

    private final Validator validator;
    private final GwpFactorSource factorSource;

    /**
     * @throws ValidationException со списком всех нарушений
     */
    public void validate(String subjectRef, ProductInputs inputs, CalculationOptions options) {
        List<String> violations = new ArrayList<>();

        if (subjectRef == null || subjectRef.isBlank()) {
            violations.add("subjectRef: must not be blank");
        }

        if (inputs == null) {
            violations.add("inputs: must not be null");
        } else {
            validator.validate(inputs).stream()
                    .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
                    .map(SubmissionValidator::describe)
                    .forEach(violations::add);
            checkFiniteValues(inputs, violations);
        }

        if (options != null && options.getFactorVersion() != null
                && !factorSource.availableVersions().contains(options.getFactorVersion())) {
            violations.add("options.factorVersion: unknown version '" + options.getFactorVersion()
                    + "', available " + factorSource.availableVersions());
        }

        if (!violations.isEmpty()) {
            throw new ValidationException(violations);
        }
    }

    private static void checkFiniteValues(ProductInputs inputs, List<String> violations) {
        List<MaterialInput> materials = inputs.getMaterials();
        for (int i = 0; i < materials.size(); i++) {
            MaterialInput material = materials.get(i);
            if (material == null) {
                violations.add("materials[" + i + "]: must not be null");
            } else if (material.getMassKg() != null && !Double.isFinite(material.getMassKg())) {
                violations.add("materials[" + i + "].massKg: must be a finite number");
            }
        }
        Set<String> trimmedNames = new HashSet<>();
        for (Map.Entry<String, Double> parameter : inputs.getProductionParameters().entrySet()) {
            if (parameter.getKey() == null || parameter.getKey().isBlank()) {
                violations.add("productionParameters: parameter name must not be blank");
            } else if (!trimmedNames.add(parameter.getKey().trim())) {
                violations.add("productionParameters." + parameter.getKey().trim()
                        + ": duplicate parameter name (names differ only by surrounding whitespace)");
            } else if (parameter.getValue() == null || !Double.isFinite(parameter.getValue())) {
                violations.add("productionParameters." + parameter.getKey() + ": must be a finite number");
            }
        }
    }

    private static String describe(ConstraintViolation<ProductInputs> violation) {
        return violation.getPropertyPath() + ": " + violation.getMessage();
    }
}
