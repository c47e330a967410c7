package com.warden.authservice.config;

import com.warden.authservice.infrastructure.web.PrincipalArgumentResolver;
import com.warden.authservice.infrastructure.web.TenantArgumentResolver;
import java.util.List;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Web MVC configuration: CORS for local front ends and the tenant and principal argument
 * resolvers used by the controllers.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {

    private final TenantArgumentResolver tenantArgumentResolver;
    private final PrincipalArgumentResolver principalArgumentResolver;

    public WebConfig(TenantArgumentResolver tenantArgumentResolver,
                     PrincipalArgumentResolver principalArgumentResolver) {
        this.tenantArgumentResolver = tenantArgumentResolver;
        this.principalArgumentResolver = principalArgumentResolver;
    }

    @Override
    public void addArgumentResolvers(List<HandlerMethodArgumentResolver> resolvers) {
        resolvers.add(tenantArgumentResolver);
        resolvers.add(principalArgumentResolver);
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        // local development front ends; production origins go through a gateway
        registry.addMapping("/auth/**")
                .allowedOrigins("http://localhost:3000", "http://localhost:5173")
                .allowedMethods("GET", "POST", "PUT", "DELETE", "OPTIONS")
                .allowedHeaders("Authorization", "Content-Type", "X-Tenant-ID", "X-Correlation-ID")
                .exposedHeaders("X-Correlation-ID")
                .allowCredentials(true)
                .maxAge(3600);
    }
}
