package com.mapobserver.core.engine;

/**
 * Thrown when updated rule state could not be written back to the observer.
 *
 * <p>
 * The transaction has been rolled back by the time this is thrown. The
 * cause is the store failure.
 * </p>
 */
public class StatePersistenceException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public StatePersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
