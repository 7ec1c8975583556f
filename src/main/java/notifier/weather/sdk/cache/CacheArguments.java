package notifier.weather.sdk.cache;

import notifier.weather.sdk.WeatherException;

import java.time.Duration;

/**
 * Argument checks shared by the cache stores.
 */
final class CacheArguments {

    private CacheArguments() {
    }

    static void requireKey(String key) throws WeatherException {
        if (key == null || key.isEmpty()) {
            throw WeatherException.validation("cache key cannot be empty");
        }
    }

    static void requireEntry(String key, byte[] value, Duration ttl) throws WeatherException {
        requireKey(key);
        if (value == null) {
            throw WeatherException.validation("cache value cannot be null");
        }
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw WeatherException.validation("cache TTL must be positive");
        }
    }
}
