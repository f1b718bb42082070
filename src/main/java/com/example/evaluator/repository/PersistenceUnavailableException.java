package com.example.evaluator.repository;

/**
 * The persistence gateway cannot be reached. Fatal for the case being processed.
 */
public class PersistenceUnavailableException extends RuntimeException {

    public PersistenceUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
