package notifier.weather.sdk.provider;

import notifier.weather.sdk.WeatherException;
import notifier.weather.sdk.WeatherReading;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs request/response/error events with timing around a {@link ProviderClient}.
 * Return values and exceptions of the wrapped provider pass through untouched.
 */
public class LoggingProviderClient implements ProviderClient {
    /** Logger that {@code logback.xml} routes to the provider log file. */
    public static final String LOGGER_NAME = "notifier.weather.providers";

    private static final Logger log = LoggerFactory.getLogger(LOGGER_NAME);

    private final ProviderClient delegate;

    public LoggingProviderClient(ProviderClient delegate) {
        if (delegate == null) {
            throw new IllegalArgumentException("provider to decorate is required");
        }
        this.delegate = delegate;
    }

    @Override
    public WeatherReading fetch(String city) throws WeatherException {
        String provider = delegate.name();
        log.atInfo()
                .addKeyValue("provider", provider)
                .addKeyValue("city", city)
                .addKeyValue("event", "request")
                .log("Weather API request started");

        long start = System.nanoTime();
        WeatherReading reading;
        try {
            reading = delegate.fetch(city);
        } catch (WeatherException | RuntimeException e) {
            log.atError()
                    .addKeyValue("provider", provider)
                    .addKeyValue("city", city)
                    .addKeyValue("event", "error")
                    .addKeyValue("duration_ms", elapsedMillis(start))
                    .addKeyValue("error", e.getMessage())
                    .log("Weather API request failed");
            throw e;
        }

        log.atInfo()
                .addKeyValue("provider", provider)
                .addKeyValue("city", city)
                .addKeyValue("event", "response")
                .addKeyValue("duration_ms", elapsedMillis(start))
                .addKeyValue("temperature", reading.getTemperature())
                .addKeyValue("humidity", reading.getHumidity())
                .addKeyValue("description", reading.getDescription())
                .log("Weather API request completed");
        return reading;
    }

    @Override
    public String name() {
        return delegate.name();
    }

    static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
