package notifier.weather.sdk;

import notifier.weather.sdk.cache.CacheStats;
import notifier.weather.sdk.cache.CacheStore;
import notifier.weather.sdk.cache.WeatherCache;
import notifier.weather.sdk.config.WeatherConfig;
import notifier.weather.sdk.provider.ProviderInfo;
import notifier.weather.sdk.provider.WeatherResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * Resolves the current weather for a city: cache first, provider chain on a miss,
 * then writes the validated reading back with the configured TTL.
 *
 * <p>Calls are independent and run entirely on the calling thread. Concurrent misses for
 * the same city are not coalesced; each one queries the providers and writes the cache.
 */
public class WeatherService {
    private static final Logger log = LoggerFactory.getLogger(WeatherService.class);

    private final WeatherResolver resolver;
    private final WeatherCache cache;
    private final boolean cacheEnabled;
    private final Duration cacheTtl;

    public WeatherService(WeatherResolver resolver, CacheStore cacheStore, WeatherConfig config) {
        this(resolver, cacheStore, config.isCacheEnabled(), config.getCacheTtl());
    }

    public WeatherService(WeatherResolver resolver, CacheStore cacheStore, boolean cacheEnabled, Duration cacheTtl) {
        if (resolver == null) {
            throw new IllegalArgumentException("weather resolver is required");
        }
        if (cacheStore == null) {
            throw new IllegalArgumentException("cache is required");
        }
        if (cacheTtl == null || cacheTtl.isNegative() || cacheTtl.isZero()) {
            throw new IllegalArgumentException("cache TTL must be positive");
        }
        this.resolver = resolver;
        this.cache = new WeatherCache(cacheStore);
        this.cacheEnabled = cacheEnabled;
        this.cacheTtl = cacheTtl;
    }

    /**
     * @throws WeatherException VALIDATION for an empty city or an invalid provider reading,
     *                          NOT_FOUND when the providers do not know the city,
     *                          EXTERNAL_API for any other provider failure
     */
    public WeatherReading getWeather(String city) throws WeatherException {
        if (city == null || city.trim().isEmpty()) {
            throw WeatherException.validation("invalid weather request: city cannot be empty");
        }
        String normalized = city.trim();
        log.debug("Getting weather for city {}", normalized);

        if (!cacheEnabled) {
            return fetchFromProviders(normalized);
        }

        String key = WeatherCache.keyFor(normalized);
        Optional<WeatherReading> cached = readCache(key);
        if (cached.isPresent()) {
            log.debug("Weather for city {} found in cache", normalized);
            return cached.get();
        }

        WeatherReading reading = fetchFromProviders(normalized);
        try {
            cache.set(key, reading, cacheTtl);
        } catch (WeatherException e) {
            log.warn("Failed to cache weather data for city {}: {}", normalized, e.toString());
        }
        return reading;
    }

    public ProviderInfo getProviderInfo() {
        return resolver.getProviderInfo().withCacheEnabled(cacheEnabled);
    }

    public CacheStats getCacheMetrics() {
        return cache.getStore().getStats();
    }

    /**
     * A broken cache read degrades to a miss.
     */
    private Optional<WeatherReading> readCache(String key) {
        try {
            return cache.get(key);
        } catch (WeatherException e) {
            log.warn("Cache read failed for key {}, falling back to providers: {}", key, e.toString());
            return Optional.empty();
        }
    }

    private WeatherReading fetchFromProviders(String city) throws WeatherException {
        WeatherReading reading;
        try {
            reading = resolver.resolve(city);
        } catch (WeatherException e) {
            log.error("Failed to get weather for city {}: {}", city, e.getMessage());
            if (e.is(ErrorKind.NOT_FOUND)) {
                throw e;
            }
            throw WeatherException.externalApi("weather provider failed", e);
        }

        try {
            reading.validate();
        } catch (WeatherException e) {
            throw WeatherException.validation("invalid weather data from provider: " + e.getMessage());
        }
        log.debug("Weather retrieved for city {}: {}°C", city, reading.getTemperature());
        return reading;
    }
}
