package com.warden.security.password;

import org.mindrot.jbcrypt.BCrypt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One-way password hashing with bcrypt (jBCrypt).
 * <p>
 * Every hash gets a fresh random salt, so hashing the same password twice yields two different
 * strings that both verify. Comparison inside {@link BCrypt#checkpw} does not return early on the
 * first differing byte.
 * <p>
 * The {@code ...Within} variants run on a bounded worker pool and give up after a timeout, so a
 * slow hash cannot hold a request thread indefinitely. A timed-out worker still runs to
 * completion in the background; only the caller is released.
 */
public class PasswordHasher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PasswordHasher.class);

    public static final int MIN_COST = 4;
    public static final int MAX_COST = 31;
    public static final int DEFAULT_COST = 12;

    private static final String TIMING_PROBE = "warden-timing-probe";

    private final int cost;
    private final SecureRandom random = new SecureRandom();
    private final ExecutorService workers;
    private final boolean ownsWorkers;
    private final String dummyHash;

    public PasswordHasher(int cost) {
        this(cost, Executors.newFixedThreadPool(
                Math.max(2, Runtime.getRuntime().availableProcessors()), new HasherThreadFactory()), true);
    }

    /**
     * @param cost    bcrypt log2 work factor, {@value #MIN_COST}..{@value #MAX_COST}
     * @param workers pool used by the time-bounded variants; not shut down by {@link #close()}
     */
    public PasswordHasher(int cost, ExecutorService workers) {
        this(cost, workers, false);
    }

    private PasswordHasher(int cost, ExecutorService workers, boolean ownsWorkers) {
        if (cost < MIN_COST || cost > MAX_COST) {
            throw new IllegalArgumentException("bcrypt cost must be between %d and %d, was %d"
                    .formatted(MIN_COST, MAX_COST, cost));
        }
        if (workers == null) {
            throw new IllegalArgumentException("workers must not be null");
        }
        this.cost = cost;
        this.workers = workers;
        this.ownsWorkers = ownsWorkers;
        this.dummyHash = BCrypt.hashpw(TIMING_PROBE, BCrypt.gensalt(cost, random));
    }

    public int cost() {
        return cost;
    }

    /**
     * @return the bcrypt hash, or null when the password is null, empty or whitespace-only
     */
    public String hash(String password) {
        if (password == null || password.isBlank()) {
            return null;
        }
        return BCrypt.hashpw(password, BCrypt.gensalt(cost, random));
    }

    /**
     * @return true if the password matches; false for null input or a malformed hash
     */
    public boolean verify(String password, String hash) {
        if (password == null || hash == null || hash.isBlank()) {
            return false;
        }
        try {
            return BCrypt.checkpw(password, hash);
        } catch (IllegalArgumentException | IndexOutOfBoundsException e) {
            log.debug("Stored hash is not a valid bcrypt string: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Burns the same work as a real verification. Called when there is no user to verify
     * against, so that "unknown email" costs as much as "wrong password".
     */
    public void dummyVerify(String password) {
        verify(password == null ? "" : password, dummyHash);
    }

    /**
     * @throws PasswordHashingException on timeout, interruption or pool rejection
     */
    public String hashWithin(String password, Duration timeout) {
        return await(submit(() -> hash(password)), timeout, "hash");
    }

    /**
     * Time-bounded {@link #verify(String, String)}. A timeout counts as a failed verification.
     */
    public boolean verifyWithin(String password, String hash, Duration timeout) {
        try {
            return await(submit(() -> verify(password, hash)), timeout, "verify");
        } catch (PasswordHashingException e) {
            log.warn("Password verification abandoned: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public void close() {
        if (ownsWorkers) {
            workers.shutdownNow();
        }
    }

    private <T> Future<T> submit(java.util.concurrent.Callable<T> task) {
        try {
            return workers.submit(task);
        } catch (RejectedExecutionException e) {
            throw new PasswordHashingException("Password hashing pool rejected the task", e);
        }
    }

    private static <T> T await(Future<T> future, Duration timeout, String operation) {
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new PasswordHashingException("Password %s exceeded %d ms".formatted(operation, timeout.toMillis()), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new PasswordHashingException("Interrupted during password " + operation, e);
        } catch (ExecutionException e) {
            throw new PasswordHashingException("Password " + operation + " failed", e.getCause());
        }
    }

    private static final class HasherThreadFactory implements ThreadFactory {

        private final AtomicInteger sequence = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "password-hasher-" + sequence.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    }
}
