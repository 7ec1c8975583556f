package notifier.weather.sdk.provider;

import notifier.weather.sdk.WeatherException;
import notifier.weather.sdk.WeatherReading;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs chain_start/chain_success/chain_error events with timing around a {@link WeatherResolver}.
 */
public class LoggingWeatherResolver implements WeatherResolver {
    /** Component name carried by the chain events. */
    public static final String COMPONENT = "chain";

    private static final Logger log = LoggerFactory.getLogger(LoggingProviderClient.LOGGER_NAME);

    private final WeatherResolver delegate;

    public LoggingWeatherResolver(WeatherResolver delegate) {
        if (delegate == null) {
            throw new IllegalArgumentException("resolver to decorate is required");
        }
        this.delegate = delegate;
    }

    @Override
    public WeatherReading resolve(String city) throws WeatherException {
        log.atInfo()
                .addKeyValue("provider", COMPONENT)
                .addKeyValue("city", city)
                .addKeyValue("event", "chain_start")
                .log("Weather provider chain started");

        long start = System.nanoTime();
        WeatherReading reading;
        try {
            reading = delegate.resolve(city);
        } catch (WeatherException | RuntimeException e) {
            log.atError()
                    .addKeyValue("provider", COMPONENT)
                .addKeyValue("city", city)
                    .addKeyValue("event", "chain_error")
                    .addKeyValue("duration_ms", LoggingProviderClient.elapsedMillis(start))
                    .addKeyValue("error", e.getMessage())
                    .log("Weather provider chain failed");
            throw e;
        }

        log.atInfo()
                .addKeyValue("provider", COMPONENT)
                .addKeyValue("city", city)
                .addKeyValue("event", "chain_success")
                .addKeyValue("duration_ms", LoggingProviderClient.elapsedMillis(start))
                .addKeyValue("temperature", reading.getTemperature())
                .addKeyValue("humidity", reading.getHumidity())
                .addKeyValue("description", reading.getDescription())
                .log("Weather provider chain completed");
        return reading;
    }

    @Override
    public ProviderInfo getProviderInfo() {
        return delegate.getProviderInfo().withLoggingEnabled(true);
    }
}
