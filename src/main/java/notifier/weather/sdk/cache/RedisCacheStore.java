package notifier.weather.sdk.cache;

import notifier.weather.sdk.WeatherException;
import notifier.weather.sdk.config.RedisSettings;
import org.redisson.Redisson;
import org.redisson.api.RBucket;
import org.redisson.api.RedissonClient;
import org.redisson.client.RedisException;
import org.redisson.client.codec.ByteArrayCodec;
import org.redisson.config.Config;
import org.redisson.config.SingleServerConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Redis-backed cache. Expiry is delegated to Redis key TTLs; a missing key is a miss,
 * any client or network failure is an EXTERNAL_API error.
 */
public class RedisCacheStore implements CacheStore {
    private static final Logger log = LoggerFactory.getLogger(RedisCacheStore.class);

    private final RedissonClient client;
    private final CacheCounters counters;

    public RedisCacheStore(RedissonClient client) {
        this(client, Clock.systemUTC());
    }

    RedisCacheStore(RedissonClient client, Clock clock) {
        if (client == null) {
            throw new IllegalArgumentException("Redis client is required");
        }
        this.client = client;
        this.counters = new CacheCounters(clock);
    }

    /**
     * Connects to Redis eagerly so that a bad address fails at startup, not on the first request.
     */
    public static RedisCacheStore connect(RedisSettings settings) throws WeatherException {
        if (settings == null) {
            throw WeatherException.configuration("redis settings are required");
        }
        Config config = new Config();
        config.setCodec(ByteArrayCodec.INSTANCE);
        SingleServerConfig server = config.useSingleServer()
                .setAddress(settings.getAddressUri())
                .setDatabase(settings.getDb())
                .setConnectTimeout(toMillis(settings.getDialTimeout()))
                .setTimeout(toMillis(settings.getReadTimeout().compareTo(settings.getWriteTimeout()) >= 0
                        ? settings.getReadTimeout() : settings.getWriteTimeout()))
                .setRetryAttempts(0);
        if (settings.hasPassword()) {
            server.setPassword(settings.getPassword());
        }

        try {
            RedissonClient client = Redisson.create(config);
            log.info("Connected to Redis at {} (db {})", settings.getAddr(), settings.getDb());
            return new RedisCacheStore(client);
        } catch (RedisException e) {
            throw WeatherException.externalApi("failed to connect to Redis", e);
        }
    }

    @Override
    public Optional<byte[]> get(String key) throws WeatherException {
        CacheArguments.requireKey(key);

        byte[] value;
        try {
            value = bucket(key).get();
        } catch (RedisException e) {
            throw WeatherException.externalApi("redis get operation failed", e);
        }
        if (value == null) {
            counters.recordMiss();
            return Optional.empty();
        }
        counters.recordHit();
        return Optional.of(value);
    }

    @Override
    public void set(String key, byte[] value, Duration ttl) throws WeatherException {
        CacheArguments.requireEntry(key, value, ttl);

        try {
            bucket(key).set(value, ttlMillis(ttl), TimeUnit.MILLISECONDS);
        } catch (RedisException e) {
            throw WeatherException.externalApi("redis set operation failed", e);
        }
    }

    @Override
    public boolean exists(String key) throws WeatherException {
        CacheArguments.requireKey(key);

        try {
            return bucket(key).isExists();
        } catch (RedisException e) {
            throw WeatherException.externalApi("redis exists operation failed", e);
        }
    }

    @Override
    public void delete(String key) throws WeatherException {
        CacheArguments.requireKey(key);

        try {
            bucket(key).delete();
        } catch (RedisException e) {
            throw WeatherException.externalApi("redis delete operation failed", e);
        }
    }

    /**
     * Flushes the whole configured Redis database, not only weather keys.
     */
    @Override
    public void clear() throws WeatherException {
        try {
            client.getKeys().flushdb();
        } catch (RedisException e) {
            throw WeatherException.externalApi("redis clear operation failed", e);
        }
    }

    public void ping() throws WeatherException {
        try {
            client.getKeys().count();
        } catch (RedisException e) {
            throw WeatherException.externalApi("Redis ping failed", e);
        }
    }

    @Override
    public CacheStats getStats() {
        return counters.snapshot();
    }

    @Override
    public String type() {
        return "redis";
    }

    @Override
    public void close() {
        if (!client.isShutdown()) {
            client.shutdown();
        }
    }

    private RBucket<byte[]> bucket(String key) {
        return client.getBucket(key, ByteArrayCodec.INSTANCE);
    }

    /**
     * Redis expiry has millisecond resolution; a positive sub-millisecond TTL becomes 1 ms.
     */
    private static long ttlMillis(Duration ttl) {
        return Math.max(1L, ttl.toMillis());
    }

    private static int toMillis(Duration duration) {
        return (int) Math.min(Integer.MAX_VALUE, duration.toMillis());
    }
}
