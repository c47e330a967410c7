package com.warden.authservice.infrastructure.web;

import com.warden.observability.CorrelationContextHolder;
import com.warden.security.AuthenticatedPrincipal;
import com.warden.security.BearerTokenExtractor;
import com.warden.security.InvalidCredentialsException;
import com.warden.security.TenantIsolationEnforcer;
import com.warden.security.auth.AuthenticationService;
import jakarta.servlet.http.HttpServletRequest;
import java.util.UUID;
import org.springframework.core.MethodParameter;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

/**
 * Supplies {@link AuthenticatedPrincipal} parameters from the {@code Authorization: Bearer}
 * header.
 *
 * <p>The request tenant is resolved first, then the access token is verified against an active
 * session, and finally the token's tenant must equal the request tenant. A request without a
 * bearer token fails with {@link InvalidCredentialsException}.
 */
@Component
public class PrincipalArgumentResolver implements HandlerMethodArgumentResolver {

    private final TenantResolver tenantResolver;
    private final AuthenticationService authenticationService;

    public PrincipalArgumentResolver(TenantResolver tenantResolver, AuthenticationService authenticationService) {
        this.tenantResolver = tenantResolver;
        this.authenticationService = authenticationService;
    }

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return AuthenticatedPrincipal.class.equals(parameter.getParameterType());
    }

    @Override
    public Object resolveArgument(MethodParameter parameter, ModelAndViewContainer mavContainer,
                                  NativeWebRequest webRequest, WebDataBinderFactory binderFactory) {
        HttpServletRequest request = webRequest.getNativeRequest(HttpServletRequest.class);
        UUID tenantId = tenantResolver.resolve(request);
        String token = BearerTokenExtractor.extract(request.getHeader(HttpHeaders.AUTHORIZATION))
                .orElseThrow(InvalidCredentialsException::new);

        AuthenticatedPrincipal principal = authenticationService.authenticateBearer(token);
        TenantIsolationEnforcer.enforce(principal, tenantId);
        CorrelationContextHolder.update(ctx ->
                ctx.withPrincipal(principal.userId().toString(), principal.sessionId().toString()));
        return principal;
    }
}
