package com.example.footprint.exception;

/**
 * Движок ответил, но данные непригодны для расчёта. Не повторяется.
 */
public class EngineDataException extends FootprintException {

    public EngineDataException(String message) {
        super(message);
    }

    public EngineDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
