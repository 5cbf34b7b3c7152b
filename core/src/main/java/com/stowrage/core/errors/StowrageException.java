package com.stowrage.core.errors;

/**
 * Root of every failure a {@link com.stowrage.core.Stowrage} reports.
 */
public abstract class StowrageException extends RuntimeException {

    protected StowrageException(String message) {
        super(message);
    }

    protected StowrageException(String message, Throwable cause) {
        super(message, cause);
    }
}
