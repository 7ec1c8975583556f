package notifier.weather.sdk.cache;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import notifier.weather.sdk.WeatherException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * Publishes cache traffic to Micrometer: request/hit/miss counters and a hit-ratio gauge
 * tagged with the backend type, plus a latency timer per operation.
 * Results and errors of the wrapped store pass through unchanged.
 */
public class InstrumentedCacheStore implements CacheStore {
    private static final Logger log = LoggerFactory.getLogger(InstrumentedCacheStore.class);

    private final CacheStore delegate;
    private final MeterRegistry registry;
    private final Counter requests;
    private final Counter hits;
    private final Counter misses;

    public InstrumentedCacheStore(CacheStore delegate, MeterRegistry registry) {
        this.delegate = delegate;
        this.registry = registry;
        String cacheType = delegate.type();
        this.requests = Counter.builder("weather.cache.requests").tag("cache_type", cacheType).register(registry);
        this.hits = Counter.builder("weather.cache.hits").tag("cache_type", cacheType).register(registry);
        this.misses = Counter.builder("weather.cache.misses").tag("cache_type", cacheType).register(registry);
        Gauge.builder("weather.cache.hit.ratio", delegate, store -> store.getStats().getHitRatio())
                .tag("cache_type", cacheType)
                .register(registry);
    }

    @Override
    public Optional<byte[]> get(String key) throws WeatherException {
        long start = System.nanoTime();
        try {
            Optional<byte[]> value = delegate.get(key);
            requests.increment();
            if (value.isPresent()) {
                hits.increment();
                log.debug("cache hit: key={}", key);
            } else {
                misses.increment();
                log.debug("cache miss: key={}", key);
            }
            return value;
        } finally {
            record("get", start);
        }
    }

    @Override
    public void set(String key, byte[] value, Duration ttl) throws WeatherException {
        long start = System.nanoTime();
        try {
            delegate.set(key, value, ttl);
            log.debug("cache set: key={}, ttl={}", key, ttl);
        } finally {
            record("set", start);
        }
    }

    @Override
    public boolean exists(String key) throws WeatherException {
        long start = System.nanoTime();
        try {
            return delegate.exists(key);
        } finally {
            record("exists", start);
        }
    }

    @Override
    public void delete(String key) throws WeatherException {
        long start = System.nanoTime();
        try {
            delegate.delete(key);
        } finally {
            record("delete", start);
        }
    }

    @Override
    public void clear() throws WeatherException {
        long start = System.nanoTime();
        try {
            delegate.clear();
        } finally {
            record("clear", start);
        }
    }

    @Override
    public CacheStats getStats() {
        return delegate.getStats();
    }

    @Override
    public String type() {
        return delegate.type();
    }

    @Override
    public void close() {
        delegate.close();
    }

    private void record(String operation, long startNanos) {
        Timer.builder("weather.cache.duration")
                .tag("cache_type", delegate.type())
                .tag("operation", operation)
                .register(registry)
                .record(Duration.ofNanos(System.nanoTime() - startNanos));
    }
}
