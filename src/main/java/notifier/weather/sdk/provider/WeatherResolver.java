package notifier.weather.sdk.provider;

import notifier.weather.sdk.WeatherException;
import notifier.weather.sdk.WeatherReading;

/**
 * Produces a reading for a city from whichever providers stand behind it.
 */
public interface WeatherResolver {

    WeatherReading resolve(String city) throws WeatherException;

    ProviderInfo getProviderInfo();
}
