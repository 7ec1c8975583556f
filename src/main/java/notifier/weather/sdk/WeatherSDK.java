package notifier.weather.sdk;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import notifier.weather.sdk.cache.CacheStats;
import notifier.weather.sdk.cache.CacheStore;
import notifier.weather.sdk.cache.CacheStoreFactory;
import notifier.weather.sdk.cache.InstrumentedCacheStore;
import notifier.weather.sdk.config.WeatherConfig;
import notifier.weather.sdk.provider.FallbackResolver;
import notifier.weather.sdk.provider.LoggingWeatherResolver;
import notifier.weather.sdk.provider.ProviderClient;
import notifier.weather.sdk.provider.ProviderFactory;
import notifier.weather.sdk.provider.ProviderInfo;
import notifier.weather.sdk.provider.WeatherResolver;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Entry point: wires configuration, cache, providers and the resolution service.
 * Each instance owns its HTTP client and cache and releases them on {@link #close()}.
 */
public class WeatherSDK implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(WeatherSDK.class);

    private final OkHttpClient client;
    private final CacheStore cacheStore;
    private final WeatherService service;

    private WeatherSDK(OkHttpClient client, CacheStore cacheStore, WeatherService service) {
        this.client = client;
        this.cacheStore = cacheStore;
        this.service = service;
    }

    public static WeatherSDK create(WeatherConfig config) throws WeatherException {
        return create(config, new SimpleMeterRegistry());
    }

    public static WeatherSDK create(WeatherConfig config, MeterRegistry registry) throws WeatherException {
        if (config == null) {
            throw WeatherException.configuration("weather config is required");
        }
        CacheStore cacheStore = new InstrumentedCacheStore(
                new CacheStoreFactory().create(config.getCache()), registry);

        OkHttpClient client = ProviderFactory.newHttpClient(config.getHttpTimeout());
        List<ProviderClient> providers = new ProviderFactory(config, client).createProviders();

        WeatherResolver resolver = new FallbackResolver(providers);
        if (config.isLoggingEnabled()) {
            resolver = new LoggingWeatherResolver(resolver);
        }

        WeatherService service = new WeatherService(resolver, cacheStore, config);
        log.info("Weather SDK ready: {}, cache type {}", service.getProviderInfo(), cacheStore.type());
        return new WeatherSDK(client, cacheStore, service);
    }

    public WeatherReading getWeather(String city) throws WeatherException {
        return service.getWeather(city);
    }

    public ProviderInfo getProviderInfo() {
        return service.getProviderInfo();
    }

    public CacheStats getCacheMetrics() {
        return service.getCacheMetrics();
    }

    public WeatherService getService() {
        return service;
    }

    @Override
    public void close() {
        cacheStore.close();
        client.dispatcher().executorService().shutdown();
        try {
            if (!client.dispatcher().executorService().awaitTermination(1, TimeUnit.SECONDS)) {
                client.dispatcher().executorService().shutdownNow();
            }
        } catch (InterruptedException e) {
            client.dispatcher().executorService().shutdownNow();
            Thread.currentThread().interrupt();
        }
        client.connectionPool().evictAll();
    }
}
