package com.example.catalog.tree;

import com.example.catalog.CatalogException;

public class EmptyStreamException extends CatalogException {

    public EmptyStreamException(String runStartUid, String streamName) {
        super("At least one event descriptor is required; stream " + streamName
                + " of run " + runStartUid + " has none");
    }
}
