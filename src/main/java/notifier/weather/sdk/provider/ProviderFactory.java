package notifier.weather.sdk.provider;

import notifier.weather.sdk.config.WeatherConfig;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Creates the providers that have credentials and puts them in the configured order.
 */
public class ProviderFactory {
    private static final Logger log = LoggerFactory.getLogger(ProviderFactory.class);

    private final WeatherConfig config;
    private final OkHttpClient client;

    public ProviderFactory(WeatherConfig config, OkHttpClient client) {
        this.config = config;
        this.client = client;
    }

    /**
     * HTTP client shared by all providers. The call timeout bounds the whole request,
     * so a stalled provider cannot hold the chain indefinitely.
     */
    public static OkHttpClient newHttpClient(Duration timeout) {
        return new OkHttpClient.Builder()
                .connectTimeout(timeout)
                .readTimeout(timeout)
                .writeTimeout(timeout)
                .callTimeout(timeout)
                .build();
    }

    /**
     * Unknown names in the order are skipped. When the order matches none of the
     * available providers, all available providers are used in the default order.
     */
    public List<ProviderClient> createProviders() {
        Map<String, ProviderClient> available = createAvailable();

        List<ProviderClient> ordered = new ArrayList<>();
        for (String name : config.getProviderOrder()) {
            ProviderClient provider = available.get(name);
            if (provider == null) {
                log.warn("Provider '{}' in WEATHER_PROVIDER_ORDER is unknown or has no API key, skipping", name);
                continue;
            }
            if (!ordered.contains(provider)) {
                ordered.add(provider);
            }
        }
        if (ordered.isEmpty()) {
            ordered.addAll(available.values());
        }
        if (ordered.isEmpty()) {
            log.warn("No weather provider has an API key configured");
        }

        if (!config.isLoggingEnabled()) {
            return ordered;
        }
        List<ProviderClient> decorated = new ArrayList<>(ordered.size());
        for (ProviderClient provider : ordered) {
            decorated.add(new LoggingProviderClient(provider));
        }
        return decorated;
    }

    private Map<String, ProviderClient> createAvailable() {
        Map<String, ProviderClient> providers = new LinkedHashMap<>();
        if (!config.getWeatherApiKey().isEmpty()) {
            providers.put(WeatherApiProvider.NAME,
                    new WeatherApiProvider(client, config.getWeatherApiKey(), config.getWeatherApiBaseUrl()));
            log.debug("Created weather provider {}", WeatherApiProvider.NAME);
        }
        if (!config.getOpenWeatherMapKey().isEmpty()) {
            providers.put(OpenWeatherMapProvider.NAME,
                    new OpenWeatherMapProvider(client, config.getOpenWeatherMapKey(), config.getOpenWeatherMapBaseUrl()));
            log.debug("Created weather provider {}", OpenWeatherMapProvider.NAME);
        }
        return providers;
    }
}
