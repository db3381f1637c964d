package com.visualoom.exception;

/**
 * Raised when a catalog or tag file cannot be written. The in-memory state is
 * left as it was before the failed write.
 */
public class CatalogPersistenceException extends RuntimeException {

    public CatalogPersistenceException(String message) {
        super(message);
    }

    public CatalogPersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
