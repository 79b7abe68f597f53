package com.example.footprint.exception;

import lombok.Getter;

import java.util.List;

/**
 * Некорректные входные данные задачи. Задача при этом не создаётся.
 */
@Getter
public class ValidationException extends FootprintException {
    private final List<String> violations;

    public ValidationException(List<String> violations) {
        super("Invalid submission: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }
}
