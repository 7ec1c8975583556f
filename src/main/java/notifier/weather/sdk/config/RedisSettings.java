package notifier.weather.sdk.config;

import java.time.Duration;

/**
 * Connection settings for the Redis cache backend.
 */
public class RedisSettings {
    public static final String DEFAULT_ADDR = "localhost:6379";
    public static final int MAX_DB = 15;

    private final String addr;
    private final String password;
    private final int db;
    private final Duration dialTimeout;
    private final Duration readTimeout;
    private final Duration writeTimeout;

    public RedisSettings(String addr, String password, int db,
                         Duration dialTimeout, Duration readTimeout, Duration writeTimeout) {
        this.addr = addr;
        this.password = password;
        this.db = db;
        this.dialTimeout = dialTimeout;
        this.readTimeout = readTimeout;
        this.writeTimeout = writeTimeout;
    }

    public static RedisSettings defaults() {
        return new RedisSettings(DEFAULT_ADDR, "", 0,
                Duration.ofSeconds(5), Duration.ofSeconds(3), Duration.ofSeconds(3));
    }

    public String getAddr() {
        return addr;
    }

    public String getPassword() {
        return password;
    }

    public boolean hasPassword() {
        return password != null && !password.isEmpty();
    }

    public int getDb() {
        return db;
    }

    public Duration getDialTimeout() {
        return dialTimeout;
    }

    public Duration getReadTimeout() {
        return readTimeout;
    }

    public Duration getWriteTimeout() {
        return writeTimeout;
    }

    /**
     * Redis address in the URI form the client expects, e.g. {@code redis://localhost:6379}.
     */
    public String getAddressUri() {
        if (addr.startsWith("redis://") || addr.startsWith("rediss://")) {
            return addr;
        }
        return "redis://" + addr;
    }
}
