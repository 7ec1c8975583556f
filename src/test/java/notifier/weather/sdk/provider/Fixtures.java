package notifier.weather.sdk.provider;

/**
 * Canned payloads shaped like the real provider responses.
 */
public final class Fixtures {

    public static final String WEATHER_API_LONDON = "{"
            + "\"location\":{\"name\":\"London\",\"country\":\"United Kingdom\"},"
            + "\"current\":{\"temp_c\":15.0,\"humidity\":76,"
            + "\"condition\":{\"text\":\"Partly cloudy\",\"code\":1003}}"
            + "}";

    public static final String WEATHER_API_NO_LOCATION = "{"
            + "\"error\":{\"code\":1006,\"message\":\"No matching location found.\"}"
            + "}";

    public static final String WEATHER_API_BAD_KEY = "{"
            + "\"error\":{\"code\":2006,\"message\":\"API key is invalid.\"}"
            + "}";

    public static final String WEATHER_API_NO_CONDITION = "{"
            + "\"current\":{\"temp_c\":15.0,\"humidity\":76}"
            + "}";

    public static final String OPENWEATHERMAP_LONDON = "{"
            + "\"weather\":[{\"id\":803,\"main\":\"Clouds\",\"description\":\"broken clouds\"}],"
            + "\"main\":{\"temp\":14.2,\"feels_like\":13.6,\"humidity\":81},"
            + "\"name\":\"London\",\"cod\":200"
            + "}";

    public static final String OPENWEATHERMAP_NO_WEATHER = "{"
            + "\"weather\":[],"
            + "\"main\":{\"temp\":25.0,\"humidity\":40},"
            + "\"name\":\"Madrid\",\"cod\":200"
            + "}";

    public static final String OPENWEATHERMAP_NOT_FOUND = "{\"cod\":\"404\",\"message\":\"city not found\"}";

    public static final String OPENWEATHERMAP_UNAUTHORIZED = "{\"cod\":401,\"message\":\"Invalid API key.\"}";

    private Fixtures() {
    }
}
