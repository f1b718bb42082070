package com.example.evaluator.service;

/**
 * A task capability could not produce usable output, e.g. the model kept returning
 * unparseable JSON.
 */
public class TaskExecutionException extends RuntimeException {

    public TaskExecutionException(String message) {
        super(message);
    }

    public TaskExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
