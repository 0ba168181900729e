package com.example.catalog.remote;

import com.example.catalog.CatalogException;

/**
 * Non-2xx answer from the array service, with the request path that produced it.
 */
public class RemoteApiException extends CatalogException {
    private final int status;
    private final String path;

    public RemoteApiException(int status, String path, String body) {
        super(path + " answered " + status + (body == null || body.isBlank() ? "" : ": " + body));
        this.status = status;
        this.path = path;
    }

    public int status() {
        return status;
    }

    public String path() {
        return path;
    }
}
