package notifier.weather.sdk.provider;

import notifier.weather.sdk.WeatherException;
import notifier.weather.sdk.WeatherReading;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Tries providers one at a time in the configured order and returns the first reading.
 * A NOT_FOUND from one provider is treated like any other failure: the next one is asked.
 */
public class FallbackResolver implements WeatherResolver {
    private static final Logger log = LoggerFactory.getLogger(FallbackResolver.class);

    private final List<ProviderClient> providers;

    public FallbackResolver(List<? extends ProviderClient> providers) {
        this.providers = Collections.unmodifiableList(new ArrayList<>(providers));
    }

    @Override
    public WeatherReading resolve(String city) throws WeatherException {
        if (providers.isEmpty()) {
            throw WeatherException.configuration("no weather providers configured");
        }

        WeatherException lastError = null;
        for (int i = 0; i < providers.size(); i++) {
            ProviderClient provider = providers.get(i);
            log.debug("Trying weather provider {} (attempt {}) for city {}", provider.name(), i + 1, city);
            try {
                WeatherReading reading = provider.fetch(city);
                log.debug("Weather provider {} succeeded for city {}: {}°C",
                        provider.name(), city, reading.getTemperature());
                return reading;
            } catch (WeatherException e) {
                lastError = e;
                log.warn("Weather provider {} failed for city {}, trying next: {}",
                        provider.name(), city, e.getMessage());
            }
        }

        log.error("All weather providers failed for city {} (tried {}), last error: {}",
                city, providers.size(), lastError.getMessage());
        throw new ProviderChainException(providers.size(), lastError);
    }

    @Override
    public ProviderInfo getProviderInfo() {
        List<String> names = new ArrayList<>(providers.size());
        for (ProviderClient provider : providers) {
            names.add(provider.name());
        }
        return new ProviderInfo(names, false, false);
    }

    List<ProviderClient> providers() {
        return providers;
    }
}
