package com.bat.core.agent;

/**
 * Thrown inside an attempt once its cancellation token has been cancelled or its thread interrupted.
 */
public class TaskCancelledException extends RuntimeException {

    public TaskCancelledException(String message) {
        super(message);
    }
}
