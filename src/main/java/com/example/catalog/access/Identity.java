package com.example.catalog.access;

import java.util.Objects;

/**
 * Who a catalog view is bound to. {@link #ADMIN} is never restricted by an access policy and is distinct
 * from any regular identity, whatever its name.
 */
public record Identity(String name, boolean administrative) {
    public static final Identity ADMIN = new Identity("admin", true);

    public Identity {
        Objects.requireNonNull(name, "name");
    }

    public static Identity of(String name) {
        return new Identity(name, false);
    }

    @Override
    public String toString() {
        return administrative ? "<admin>" : name;
    }
}
