package notifier.weather.sdk.cache;

import notifier.weather.sdk.WeatherException;
import notifier.weather.sdk.config.CacheSettings;

/**
 * Builds the cache backend named by the configuration.
 */
public class CacheStoreFactory {

    public CacheStore create(CacheSettings settings) throws WeatherException {
        if (settings == null || settings.getType() == null) {
            throw WeatherException.configuration("cache config cannot be empty");
        }
        switch (settings.getType()) {
            case MEMORY:
                return new MemoryCacheStore();
            case REDIS:
                return RedisCacheStore.connect(settings.getRedis());
            default:
                throw WeatherException.configuration("unsupported cache type: " + settings.getType());
        }
    }
}
