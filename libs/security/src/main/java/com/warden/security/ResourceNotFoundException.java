package com.warden.security;

/**
 * A tenant-scoped entity does not exist under the given tenant.
 */
public class ResourceNotFoundException extends RuntimeException {

    private final String resourceType;

    public ResourceNotFoundException(String resourceType, Object id) {
        super("%s not found: %s".formatted(resourceType, id));
        this.resourceType = resourceType;
    }

    public String resourceType() {
        return resourceType;
    }
}
