package notifier.weather.sdk.provider;

import com.fasterxml.jackson.databind.JsonNode;
import notifier.weather.sdk.WeatherException;
import notifier.weather.sdk.WeatherReading;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;

import java.time.Clock;

/**
 * OpenWeatherMap current weather ({@code /weather}, metric units).
 */
public class OpenWeatherMapProvider extends HttpWeatherProvider {
    public static final String NAME = "openweathermap";
    static final String DEFAULT_DESCRIPTION = "Clear";

    public OpenWeatherMapProvider(OkHttpClient client, String apiKey, String baseUrl) {
        this(client, apiKey, baseUrl, Clock.systemUTC());
    }

    public OpenWeatherMapProvider(OkHttpClient client, String apiKey, String baseUrl, Clock clock) {
        super(client, apiKey, baseUrl, clock);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected String displayName() {
        return "OpenWeatherMap";
    }

    @Override
    protected String apiKeyParameter() {
        return "appid";
    }

    @Override
    protected HttpUrl buildUrl(HttpUrl baseUrl, String city) {
        return baseUrl.newBuilder()
                .addPathSegment("weather")
                .addQueryParameter("q", city)
                .addQueryParameter("appid", apiKey)
                .addQueryParameter("units", "metric")
                .build();
    }

    @Override
    protected WeatherException statusError(int code, JsonNode body) {
        if (code == 404) {
            return WeatherException.notFound("city not found");
        }
        String message = body.path("message").asText("");
        return WeatherException.externalApi("OpenWeatherMap returned status " + code
                + (message.isEmpty() ? "" : ": " + message));
    }

    @Override
    protected WeatherReading parse(JsonNode root, String city) throws WeatherException {
        JsonNode main = required(root, "main");

        String description = DEFAULT_DESCRIPTION;
        JsonNode weather = root.path("weather");
        if (weather.isArray() && weather.size() > 0) {
            description = weather.get(0).path("description").asText(DEFAULT_DESCRIPTION);
        }

        return new WeatherReading(
                requiredNumber(main, "temp"),
                requiredNumber(main, "humidity"),
                description,
                city,
                clock.instant());
    }
}
