package com.example.footprint.exception;

/**
 * Недоступен бэкенд кэша. Не фатально: задача продолжается без кэширования.
 */
public class CacheException extends FootprintException {

    public CacheException(String message, Throwable cause) {
        super(message, cause);
    }
}
