package com.warden.authservice.infrastructure.web;

import com.warden.observability.CorrelationContextHolder;
import com.warden.security.InvalidCredentialsException;
import com.warden.security.tenant.Tenant;
import com.warden.security.tenant.TenantDirectory;
import jakarta.servlet.http.HttpServletRequest;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Resolves the request's tenant from the {@code X-Tenant-ID} header.
 *
 * <p>A missing or malformed header is a client error ({@link TenantResolutionException}); an
 * unknown, suspended or cancelled tenant is reported as {@link InvalidCredentialsException} so the
 * response does not reveal which tenants exist. The result is cached on the request.
 */
@Component
public class TenantResolver {

    public static final String TENANT_HEADER = "X-Tenant-ID";

    private static final Logger log = LoggerFactory.getLogger(TenantResolver.class);
    private static final String ATTRIBUTE = TenantResolver.class.getName() + ".tenantId";

    private final TenantDirectory tenants;

    public TenantResolver(TenantDirectory tenants) {
        this.tenants = tenants;
    }

    public UUID resolve(HttpServletRequest request) {
        Object cached = request.getAttribute(ATTRIBUTE);
        if (cached instanceof UUID tenantId) {
            return tenantId;
        }
        String header = request.getHeader(TENANT_HEADER);
        if (header == null || header.isBlank()) {
            throw new TenantResolutionException(TENANT_HEADER + " header is required");
        }
        UUID tenantId;
        try {
            tenantId = UUID.fromString(header.strip());
        } catch (IllegalArgumentException e) {
            throw new TenantResolutionException(TENANT_HEADER + " header must be a UUID");
        }
        Tenant tenant = tenants.findById(tenantId).orElse(null);
        if (tenant == null || !tenant.status().acceptsRequests()) {
            log.info("Rejected request for unavailable tenant {}", tenantId);
            throw new InvalidCredentialsException();
        }
        request.setAttribute(ATTRIBUTE, tenantId);
        CorrelationContextHolder.update(ctx -> ctx.withTenant(tenantId.toString()));
        return tenantId;
    }
}
