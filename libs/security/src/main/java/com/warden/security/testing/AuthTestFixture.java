package com.warden.security.testing;

import com.warden.observability.MetricFactory;
import com.warden.observability.SensitiveDataRedactor;
import com.warden.security.Role;
import com.warden.security.audit.AuditLogger;
import com.warden.security.audit.InMemoryAuditEventStore;
import com.warden.security.auth.AuthMetrics;
import com.warden.security.auth.AuthSettings;
import com.warden.security.auth.AuthenticationService;
import com.warden.security.mfa.MfaService;
import com.warden.security.password.PasswordHasher;
import com.warden.security.password.PasswordPolicyEngine;
import com.warden.security.session.InMemorySessionRepository;
import com.warden.security.session.SessionManager;
import com.warden.security.session.SessionSettings;
import com.warden.security.tenant.InMemoryTenantDirectory;
import com.warden.security.tenant.Tenant;
import com.warden.security.tenant.TenantQuotas;
import com.warden.security.tenant.TenantStatus;
import com.warden.security.token.SigningKey;
import com.warden.security.token.StaticSigningKeyStore;
import com.warden.security.token.TokenService;
import com.warden.security.token.TokenSettings;
import com.warden.security.user.InMemoryUserRepository;
import com.warden.security.user.User;
import com.warden.security.user.UserCreate;
import com.warden.security.user.UserRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * A complete in-memory authentication stack for tests.
 * <p>
 * Uses a {@link MutableClock}, the minimum bcrypt cost, audit writes on the calling thread and a
 * {@link RecordingNotificationSender}. Close it to stop the hashing pool.
 * <p>
 * Lives in the main source set so other modules can use it from their tests.
 */
public final class AuthTestFixture implements AutoCloseable {

    public static final String SIGNING_SECRET = "warden-test-signing-secret-0123456789abcdef";
    public static final String KEY_ID = "test-key";
    public static final String STRONG_PASSWORD = "Str0ng!Passw0rd#2024";
    public static final String OTHER_STRONG_PASSWORD = "An0ther!Secret99";

    private final MutableClock clock = MutableClock.startingAtEpochOf2024();
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private final InMemoryTenantDirectory tenants = new InMemoryTenantDirectory();
    private final InMemoryUserRepository users = new InMemoryUserRepository();
    private final InMemorySessionRepository sessionRepository = new InMemorySessionRepository();
    private final InMemoryAuditEventStore auditStore = new InMemoryAuditEventStore();
    private final RecordingNotificationSender notifications = new RecordingNotificationSender();
    private final PasswordHasher hasher = new PasswordHasher(PasswordHasher.MIN_COST);
    private final PasswordPolicyEngine policies = new PasswordPolicyEngine();
    private final SessionManager sessions;
    private final TokenService tokens;
    private final MfaService mfa;
    private final AuditLogger audit;
    private final AuthenticationService service;

    public AuthTestFixture() {
        this(SessionSettings.defaults());
    }

    public AuthTestFixture(SessionSettings sessionSettings) {
        this(sessionSettings, UnaryOperator.identity());
    }

    /**
     * @param userStore wraps the in-memory user repository before the service gets it, so a test
     *                  can intercept individual repository calls
     */
    public AuthTestFixture(SessionSettings sessionSettings, UnaryOperator<UserRepository> userStore) {
        this.sessions = new SessionManager(sessionRepository, sessionSettings, clock);
        this.tokens = new TokenService(
                new StaticSigningKeyStore(SigningKey.of(KEY_ID, SIGNING_SECRET)),
                TokenSettings.defaults(),
                clock);
        this.mfa = new MfaService(clock, "Warden", notifications);
        this.audit = new AuditLogger(auditStore, Runnable::run, new SensitiveDataRedactor(), clock);
        this.service = new AuthenticationService(
                userStore.apply(users), tenants, sessions, tokens, hasher, policies, mfa, audit, notifications,
                new AuthMetrics(new MetricFactory(meterRegistry, "warden-test")),
                AuthSettings.defaults(),
                clock);
    }

    /**
     * Registers an ACTIVE tenant with unlimited quotas.
     */
    public UUID createTenant(String slug) {
        Tenant tenant = new Tenant(UUID.randomUUID(), slug + " Inc.", slug, "admin@" + slug + ".test",
                TenantStatus.ACTIVE, TenantQuotas.unlimited());
        tenants.save(tenant);
        return tenant.id();
    }

    public User createActiveUser(UUID tenantId, String email, String password) {
        return service.createUser(UserCreate.active(tenantId, email, password, Role.DEVELOPER), null);
    }

    public User createActiveUser(UUID tenantId, String email, String password, Role role) {
        return service.createUser(UserCreate.active(tenantId, email, password, role), null);
    }

    public AuthenticationService service() {
        return service;
    }

    public MutableClock clock() {
        return clock;
    }

    public SimpleMeterRegistry meterRegistry() {
        return meterRegistry;
    }

    public InMemoryTenantDirectory tenants() {
        return tenants;
    }

    public InMemoryUserRepository users() {
        return users;
    }

    public InMemoryAuditEventStore auditStore() {
        return auditStore;
    }

    public RecordingNotificationSender notifications() {
        return notifications;
    }

    public PasswordHasher hasher() {
        return hasher;
    }

    public PasswordPolicyEngine policies() {
        return policies;
    }

    public SessionManager sessions() {
        return sessions;
    }

    public TokenService tokens() {
        return tokens;
    }

    public MfaService mfa() {
        return mfa;
    }

    @Override
    public void close() {
        hasher.close();
    }
}
