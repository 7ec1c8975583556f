package notifier.weather.sdk.cache;

import notifier.weather.sdk.WeatherException;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-process cache. Expiry is checked lazily on read: an expired entry is a miss
 * even while it is still in the map, and stays there until overwritten or cleared.
 */
public class MemoryCacheStore implements CacheStore {
    private final Map<String, CacheEntry> entries = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Clock clock;
    private final CacheCounters counters;

    public MemoryCacheStore() {
        this(Clock.systemUTC());
    }

    public MemoryCacheStore(Clock clock) {
        this.clock = clock;
        this.counters = new CacheCounters(clock);
    }

    @Override
    public Optional<byte[]> get(String key) throws WeatherException {
        CacheArguments.requireKey(key);

        CacheEntry entry = lookup(key);
        if (entry == null || entry.isExpired(clock.instant())) {
            counters.recordMiss();
            return Optional.empty();
        }
        counters.recordHit();
        return Optional.of(entry.value());
    }

    @Override
    public void set(String key, byte[] value, Duration ttl) throws WeatherException {
        CacheArguments.requireEntry(key, value, ttl);

        CacheEntry entry = new CacheEntry(value, clock.instant().plus(ttl));
        lock.writeLock().lock();
        try {
            entries.put(key, entry);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean exists(String key) throws WeatherException {
        CacheArguments.requireKey(key);

        CacheEntry entry = lookup(key);
        return entry != null && !entry.isExpired(clock.instant());
    }

    @Override
    public void delete(String key) throws WeatherException {
        CacheArguments.requireKey(key);

        lock.writeLock().lock();
        try {
            entries.remove(key);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public void clear() {
        lock.writeLock().lock();
        try {
            entries.clear();
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public CacheStats getStats() {
        return counters.snapshot();
    }

    @Override
    public String type() {
        return "memory";
    }

    int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    private CacheEntry lookup(String key) {
        lock.readLock().lock();
        try {
            return entries.get(key);
        } finally {
            lock.readLock().unlock();
        }
    }
}
