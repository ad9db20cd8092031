package com.flagship.inventory_ledger.exception;

/**
 * A referenced entity does not exist. Extends {@link IllegalArgumentException}
 * so callers that only care about bad input can treat it as such.
 */
public class ResourceNotFoundException extends IllegalArgumentException {

    private final String resource;
    private final String id;

    public ResourceNotFoundException(String resource, String id) {
        super(resource + " not found: " + id);
        this.resource = resource;
        this.id = id;
    }

    public String getResource() {
        return resource;
    }

    public String getId() {
        return id;
    }
}
