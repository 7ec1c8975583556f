package notifier.weather.sdk.cache;

import java.time.Instant;

/**
 * Cache element: a serialized value and the instant it stops being served.
 * Never mutated; a later set for the same key replaces it. The bytes are copied in and out.
 */
final class CacheEntry {
    private final byte[] value;
    private final Instant expiresAt;

    CacheEntry(byte[] value, Instant expiresAt) {
        this.value = value.clone();
        this.expiresAt = expiresAt;
    }

    byte[] value() {
        return value.clone();
    }

    Instant expiresAt() {
        return expiresAt;
    }

    boolean isExpired(Instant now) {
        return now.isAfter(expiresAt);
    }
}
