package notifier.weather.sdk.examples;

import notifier.weather.sdk.WeatherException;
import notifier.weather.sdk.WeatherReading;
import notifier.weather.sdk.WeatherSDK;
import notifier.weather.sdk.config.WeatherConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Looks up the weather for the cities given on the command line (London by default),
 * twice each, so the second lookup is served from the cache.
 * Credentials come from {@code .env} or the environment, see {@link WeatherConfig}.
 */
public class ExampleUsage {
    private static final Logger log = LoggerFactory.getLogger(ExampleUsage.class);

    public static void main(String[] args) {
        WeatherConfig config;
        try {
            config = WeatherConfig.load();
        } catch (WeatherException e) {
            log.error("Invalid configuration: {}", e.toString());
            return;
        }
        if (config.getWeatherApiKey().isEmpty() && config.getOpenWeatherMapKey().isEmpty()) {
            log.error("Set WEATHER_API_KEY or OPENWEATHERMAP_API_KEY in .env or the environment");
            return;
        }

        String[] cities = args.length > 0 ? args : new String[]{"London"};
        try (WeatherSDK sdk = WeatherSDK.create(config)) {
            log.info("Providers: {}", sdk.getProviderInfo());
            for (String city : cities) {
                fetchAndPrintWeather(sdk, city);
                fetchAndPrintWeather(sdk, city);
            }
            log.info("Cache: {}", sdk.getCacheMetrics());
        } catch (WeatherException e) {
            log.error("Failed to start weather SDK: {}", e.toString(), e);
        }
    }

    private static void fetchAndPrintWeather(WeatherSDK sdk, String city) {
        try {
            WeatherReading weather = sdk.getWeather(city);
            log.info("{}", weather);
            log.info("Feels: {} ({} °F), comfortable: {}",
                    weather.getHumidityDescription(), weather.getTemperatureInFahrenheit(), weather.isComfortable());
        } catch (WeatherException e) {
            log.error("Failed to get weather for {}: {}", city, e.toString());
        }
    }
}
