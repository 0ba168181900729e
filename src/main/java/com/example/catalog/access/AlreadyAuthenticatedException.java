package com.example.catalog.access;

import com.example.catalog.CatalogException;

public class AlreadyAuthenticatedException extends CatalogException {

    public AlreadyAuthenticatedException(Identity current) {
        super("Already authenticated as " + current);
    }
}
