package com.topostat.core.persistence;

/**
 * Raised when a {@link ResultStore} cannot commit a unit of work.
 */
public class PersistenceException extends Exception {

    public PersistenceException(String message) {
        super(message);
    }

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
