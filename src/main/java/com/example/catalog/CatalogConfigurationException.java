package com.example.catalog;

/**
 * Invalid wiring: an access policy that does not fit the catalog, a store URI without database, bad settings.
 */
public class CatalogConfigurationException extends CatalogException {

    public CatalogConfigurationException(String message) {
        super(message);
    }

    public CatalogConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
