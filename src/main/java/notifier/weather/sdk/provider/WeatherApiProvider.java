package notifier.weather.sdk.provider;

import com.fasterxml.jackson.databind.JsonNode;
import notifier.weather.sdk.WeatherException;
import notifier.weather.sdk.WeatherReading;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;

import java.time.Clock;

/**
 * WeatherAPI.com current conditions ({@code /current.json}).
 */
public class WeatherApiProvider extends HttpWeatherProvider {
    public static final String NAME = "weatherapi";

    // WeatherAPI answers an unknown location with 400 and this error code
    private static final int NO_MATCHING_LOCATION = 1006;

    public WeatherApiProvider(OkHttpClient client, String apiKey, String baseUrl) {
        this(client, apiKey, baseUrl, Clock.systemUTC());
    }

    public WeatherApiProvider(OkHttpClient client, String apiKey, String baseUrl, Clock clock) {
        super(client, apiKey, baseUrl, clock);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected String displayName() {
        return "WeatherAPI";
    }

    @Override
    protected String apiKeyParameter() {
        return "key";
    }

    @Override
    protected HttpUrl buildUrl(HttpUrl baseUrl, String city) {
        return baseUrl.newBuilder()
                .addPathSegment("current.json")
                .addQueryParameter("key", apiKey)
                .addQueryParameter("q", city)
                .addQueryParameter("aqi", "no")
                .build();
    }

    @Override
    protected WeatherException statusError(int code, JsonNode body) {
        if (code == 404 || body.path("error").path("code").asInt() == NO_MATCHING_LOCATION) {
            return WeatherException.notFound("city not found");
        }
        return WeatherException.externalApi("WeatherAPI returned status " + code);
    }

    @Override
    protected WeatherReading parse(JsonNode root, String city) throws WeatherException {
        JsonNode current = required(root, "current");
        JsonNode condition = required(current, "condition");
        String text = required(condition, "text").asText();

        return new WeatherReading(
                requiredNumber(current, "temp_c"),
                requiredNumber(current, "humidity"),
                text,
                city,
                clock.instant());
    }
}
