package com.example.footprint.exception;

/**
 * Сбой записи в хранилище задач. Фатален для задачи.
 */
public class PersistenceException extends FootprintException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
