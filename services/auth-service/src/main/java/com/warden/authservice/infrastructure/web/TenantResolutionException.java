package com.warden.authservice.infrastructure.web;

/**
 * The request carries no usable {@code X-Tenant-ID} header. Mapped to 400.
 */
public class TenantResolutionException extends RuntimeException {

    public TenantResolutionException(String message) {
        super(message);
    }
}
