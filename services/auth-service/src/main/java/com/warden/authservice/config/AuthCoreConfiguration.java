package com.warden.authservice.config;

import com.warden.observability.MetricFactory;
import com.warden.observability.SensitiveDataRedactor;
import com.warden.security.audit.AuditEventStore;
import com.warden.security.audit.AuditLogger;
import com.warden.security.audit.InMemoryAuditEventStore;
import com.warden.security.auth.AuthMetrics;
import com.warden.security.auth.AuthenticationService;
import com.warden.security.mfa.MfaService;
import com.warden.security.notify.LoggingNotificationSender;
import com.warden.security.notify.NotificationSender;
import com.warden.security.password.PasswordHasher;
import com.warden.security.password.PasswordPolicyEngine;
import com.warden.security.session.InMemorySessionRepository;
import com.warden.security.session.SessionManager;
import com.warden.security.session.SessionRepository;
import com.warden.security.tenant.InMemoryTenantDirectory;
import com.warden.security.tenant.TenantDirectory;
import com.warden.security.token.TokenService;
import com.warden.security.user.InMemoryUserRepository;
import com.warden.security.user.UserRepository;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the authentication core. Every collaborator is constructed here explicitly; nothing in
 * {@code warden-security} is a Spring bean by itself.
 *
 * <p>Persistence is in memory. Replacing {@link UserRepository}, {@link SessionRepository},
 * {@link AuditEventStore} or {@link TenantDirectory} with a durable implementation only touches
 * the corresponding bean method.
 */
@Configuration
public class AuthCoreConfiguration {

    private static final Logger log = LoggerFactory.getLogger(AuthCoreConfiguration.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public TenantDirectory tenantDirectory(AuthServiceProperties properties) {
        InMemoryTenantDirectory directory = new InMemoryTenantDirectory();
        properties.tenants().forEach(seed -> directory.save(seed.toTenant()));
        log.info("Registered {} tenant(s)", properties.tenants().size());
        return directory;
    }

    @Bean
    public UserRepository userRepository() {
        return new InMemoryUserRepository();
    }

    @Bean
    public SessionRepository sessionRepository() {
        return new InMemorySessionRepository();
    }

    @Bean
    public AuditEventStore auditEventStore(AuthServiceProperties properties) {
        return new InMemoryAuditEventStore(properties.audit().capacityPerTenant());
    }

    @Bean
    public SessionManager sessionManager(SessionRepository repository, AuthServiceProperties properties, Clock clock) {
        return new SessionManager(repository, properties.sessionSettings(), clock);
    }

    @Bean
    public TokenService tokenService(AuthServiceProperties properties, Clock clock) {
        return new TokenService(properties.signingKeys(), properties.tokenSettings(), clock);
    }

    @Bean(destroyMethod = "close")
    public PasswordHasher passwordHasher(AuthServiceProperties properties) {
        return new PasswordHasher(properties.password().bcryptCost());
    }

    @Bean
    public PasswordPolicyEngine passwordPolicyEngine() {
        return new PasswordPolicyEngine();
    }

    @Bean
    public NotificationSender notificationSender() {
        return new LoggingNotificationSender();
    }

    @Bean
    public MfaService mfaService(Clock clock, AuthServiceProperties properties, NotificationSender notifications) {
        return new MfaService(clock, properties.mfa().issuer(), notifications);
    }

    /**
     * Single writer with a bounded queue. When the queue is full new events are rejected and
     * dropped by {@link AuditLogger}.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService auditExecutor(AuthServiceProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        return new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(properties.audit().queueCapacity()),
                r -> {
                    Thread t = new Thread(r, "audit-writer-" + counter.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                },
                new ThreadPoolExecutor.AbortPolicy());
    }

    @Bean
    public AuditLogger auditLogger(AuditEventStore store, ExecutorService auditExecutor, Clock clock) {
        return new AuditLogger(store, auditExecutor, new SensitiveDataRedactor(), clock);
    }

    @Bean
    public AuthMetrics authMetrics(MeterRegistry meterRegistry, AuthServiceProperties properties) {
        return new AuthMetrics(new MetricFactory(meterRegistry, properties.name()));
    }

    @Bean
    public AuthenticationService authenticationService(
            UserRepository users,
            TenantDirectory tenants,
            SessionManager sessions,
            TokenService tokens,
            PasswordHasher hasher,
            PasswordPolicyEngine policies,
            MfaService mfa,
            AuditLogger audit,
            NotificationSender notifications,
            AuthMetrics metrics,
            AuthServiceProperties properties,
            Clock clock) {
        return new AuthenticationService(users, tenants, sessions, tokens, hasher, policies, mfa, audit,
                notifications, metrics, properties.authSettings(), clock);
    }
}
