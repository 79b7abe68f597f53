package com.example.footprint.exception;

/**
 * Внешний LCI движок недоступен (сеть, таймаут, 5xx). Ошибка считается временной и повторяется.
 */
public class EngineUnavailableException extends FootprintException {

    public EngineUnavailableException(String message) {
        super(message);
    }

    public EngineUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
