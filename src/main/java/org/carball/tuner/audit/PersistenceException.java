package org.carball.tuner.audit;

/**
 * The audit trail could not be read or written.
 */
public class PersistenceException extends RuntimeException {

    public PersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
