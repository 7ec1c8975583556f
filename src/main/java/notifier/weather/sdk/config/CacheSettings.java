package notifier.weather.sdk.config;

/**
 * Which cache backend to build and how to reach it.
 */
public class CacheSettings {
    private final CacheType type;
    private final RedisSettings redis;

    public CacheSettings(CacheType type, RedisSettings redis) {
        this.type = type;
        this.redis = redis;
    }

    public static CacheSettings memory() {
        return new CacheSettings(CacheType.MEMORY, RedisSettings.defaults());
    }

    public CacheType getType() {
        return type;
    }

    public RedisSettings getRedis() {
        return redis;
    }
}
