package com.example.footprint.exception;

/**
 * Базовое исключение конвейера расчёта.
 */
public class FootprintException extends RuntimeException {

    public FootprintException(String message) {
        super(message);
    }

    public FootprintException(String message, Throwable cause) {
        super(message, cause);
    }
}
