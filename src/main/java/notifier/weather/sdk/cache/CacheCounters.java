package notifier.weather.sdk.cache;

import java.time.Clock;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Hit/miss counters owned by one cache store, behind their own lock.
 */
final class CacheCounters {
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Clock clock;
    private long hits;
    private long misses;

    CacheCounters(Clock clock) {
        this.clock = clock;
    }

    void recordHit() {
        lock.writeLock().lock();
        try {
            hits++;
        } finally {
            lock.writeLock().unlock();
        }
    }

    void recordMiss() {
        lock.writeLock().lock();
        try {
            misses++;
        } finally {
            lock.writeLock().unlock();
        }
    }

    CacheStats snapshot() {
        lock.readLock().lock();
        try {
            return new CacheStats(hits, misses, clock.instant());
        } finally {
            lock.readLock().unlock();
        }
    }
}
