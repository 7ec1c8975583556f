package notifier.weather.sdk.provider;

import notifier.weather.sdk.WeatherException;
import notifier.weather.sdk.WeatherReading;

/**
 * One third-party source of current weather.
 *
 * <p>Implementations make a single attempt per call and never retry; falling back to
 * another source is {@link FallbackResolver}'s job.
 */
public interface ProviderClient {

    /**
     * @throws WeatherException NOT_FOUND when the source reports an unknown city,
     *                          EXTERNAL_API for network, status, payload or credential problems
     */
    WeatherReading fetch(String city) throws WeatherException;

    /**
     * Stable identifier used in the configured provider order and in diagnostics.
     */
    String name();
}
