package com.example.catalog;

public class NotFoundException extends CatalogException {
    private final String key;

    public NotFoundException(String key) {
        super("No entry found for key " + key);
        this.key = key;
    }

    public String key() {
        return key;
    }
}
