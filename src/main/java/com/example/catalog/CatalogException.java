package com.example.catalog;

/**
 * Root of every error the catalog raises. Unchecked, delivered through Reactor error signals.
 */
public class CatalogException extends RuntimeException {

    public CatalogException(String message) {
        super(message);
    }

    public CatalogException(String message, Throwable cause) {
        super(message, cause);
    }
}
