package com.example.footprint.exception;

public class QueueUnavailableException extends FootprintException {

    public QueueUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
