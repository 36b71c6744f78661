package com.voicerelay.servicebackend.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * In-memory registry of single-use nonces.
 *
 * A nonce is removed on its first consumption attempt, whether or not that attempt
 * succeeds, and abandoned nonces are dropped by a periodic sweep.
 */
public class NonceStore {
    private static final Logger log = LoggerFactory.getLogger(NonceStore.class);
    private static final int NONCE_BYTES = 16;

    private final ConcurrentHashMap<String, Instant> nonces = new ConcurrentHashMap<>();
    private final SecureRandom random = new SecureRandom();
    private final Duration ttl;
    private final Clock clock;
    private final ScheduledExecutorService sweepExecutor;

    /**
     * Creates a store without a background sweep. Expired entries are still never
     * consumable, they are only kept in memory until {@link #sweepExpired()} runs.
     */
    public NonceStore(Duration ttl, Clock clock) {
        this.ttl = ttl;
        this.clock = clock;
        this.sweepExecutor = null;
    }

    public NonceStore(Duration ttl, Clock clock, Duration sweepInterval) {
        this.ttl = ttl;
        this.clock = clock;
        this.sweepExecutor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "nonce-sweep");
            t.setDaemon(true);
            return t;
        });
        sweepExecutor.scheduleAtFixedRate(
                this::sweepExpired,
                sweepInterval.toMillis(),
                sweepInterval.toMillis(),
                TimeUnit.MILLISECONDS);
    }

    public Nonce issue() {
        byte[] bytes = new byte[NONCE_BYTES];
        random.nextBytes(bytes);
        Nonce nonce = new Nonce(HexFormat.of().formatHex(bytes), clock.instant().plus(ttl));
        nonces.put(nonce.value(), nonce.expiresAt());
        return nonce;
    }

    /**
     * Consumes a nonce. Unknown, already consumed and expired values are all rejected alike.
     *
     * @return true only for the first consumption of a live nonce
     */
    public boolean consume(String value) {
        if (value == null || value.isEmpty()) {
            return false;
        }
        // remove() is the single critical section: at most one caller gets the entry back
        Instant expiresAt = nonces.remove(value);
        if (expiresAt == null) {
            return false;
        }
        return clock.instant().isBefore(expiresAt);
    }

    /**
     * Removes every entry whose expiry has passed.
     *
     * @return number of entries removed
     */
    public int sweepExpired() {
        Instant now = clock.instant();
        int removed = 0;
        for (var entry : nonces.entrySet()) {
            if (!now.isBefore(entry.getValue()) && nonces.remove(entry.getKey(), entry.getValue())) {
                removed++;
            }
        }
        if (removed > 0) {
            log.debug("Swept {} expired nonces, {} pending", removed, nonces.size());
        }
        return removed;
    }

    public int pendingCount() {
        return nonces.size();
    }

    public void shutdown() {
        if (sweepExecutor != null) {
            sweepExecutor.shutdownNow();
        }
        nonces.clear();
        log.info("Nonce store shut down");
    }
}
