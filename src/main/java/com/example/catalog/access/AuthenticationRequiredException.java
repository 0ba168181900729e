package com.example.catalog.access;

import com.example.catalog.CatalogException;

public class AuthenticationRequiredException extends CatalogException {

    public AuthenticationRequiredException() {
        super("Access policy is set; bind an identity with authenticatedAs before reading");
    }
}
