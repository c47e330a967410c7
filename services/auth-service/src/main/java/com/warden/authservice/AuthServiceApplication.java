package com.warden.authservice;

import com.warden.authservice.config.AuthServiceProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

/**
 * Warden authentication service.
 *
 * <p>Exposes the authentication core over HTTP under {@code /auth}. Every request is scoped to the
 * tenant named in the {@code X-Tenant-ID} header; authenticated endpoints additionally take an
 * {@code Authorization: Bearer} access token issued for that same tenant.
 *
 * <p>Configured by default:
 *
 * <ul>
 *   <li>Graceful shutdown ({@code server.shutdown=graceful})
 *   <li>Actuator health, metrics and Prometheus endpoints
 *   <li>Correlation ID propagation into the SLF4J MDC
 *   <li>RFC 7807 ProblemDetail error responses
 * </ul>
 */
@SpringBootApplication
@EnableConfigurationProperties(AuthServiceProperties.class)
public class AuthServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(AuthServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(AuthServiceApplication.class, args);
        log.info("Warden auth service started");
    }
}
