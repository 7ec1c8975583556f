package notifier.weather.sdk.provider;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import notifier.weather.sdk.WeatherException;
import notifier.weather.sdk.WeatherReading;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;

/**
 * Shared request/response handling for JSON-over-HTTP weather APIs.
 * Subclasses build the request URL and map the decoded payload.
 */
public abstract class HttpWeatherProvider implements ProviderClient {
    private static final Logger log = LoggerFactory.getLogger(HttpWeatherProvider.class);

    private final OkHttpClient client;
    private final ObjectMapper mapper = new ObjectMapper();
    private final HttpUrl baseUrl;
    protected final String apiKey;
    protected final Clock clock;

    protected HttpWeatherProvider(OkHttpClient client, String apiKey, String baseUrl, Clock clock) {
        if (client == null) {
            throw new IllegalArgumentException("HTTP client is required");
        }
        HttpUrl parsed = baseUrl == null ? null : HttpUrl.parse(baseUrl);
        if (parsed == null) {
            throw new IllegalArgumentException("invalid base URL: " + baseUrl);
        }
        this.client = client;
        this.apiKey = apiKey == null ? "" : apiKey.trim();
        this.baseUrl = parsed;
        this.clock = clock;
    }

    /**
     * Human-readable API name used in error messages, e.g. "WeatherAPI".
     */
    protected abstract String displayName();

    /**
     * Query parameter carrying the API key; masked when the URL is logged.
     */
    protected abstract String apiKeyParameter();

    protected abstract HttpUrl buildUrl(HttpUrl baseUrl, String city);

    /**
     * Maps a non-2xx response to NOT_FOUND or EXTERNAL_API.
     */
    protected abstract WeatherException statusError(int code, JsonNode body);

    protected abstract WeatherReading parse(JsonNode root, String city) throws WeatherException;

    @Override
    public WeatherReading fetch(String city) throws WeatherException {
        if (city == null || city.trim().isEmpty()) {
            throw WeatherException.validation("city cannot be empty");
        }
        if (apiKey.isEmpty()) {
            throw WeatherException.externalApi(displayName() + " API key not configured");
        }

        HttpUrl url = buildUrl(baseUrl, city);
        log.debug("{} request: {}", displayName(),
                url.newBuilder().setQueryParameter(apiKeyParameter(), "***").build());
        Request request = new Request.Builder().url(url).get().build();

        try (Response response = client.newCall(request).execute()) {
            ResponseBody body = response.body();
            String payload = body == null ? "" : body.string();

            if (!response.isSuccessful()) {
                throw statusError(response.code(), readQuietly(payload));
            }
            if (payload.isEmpty()) {
                throw WeatherException.externalApi("empty response body from " + displayName());
            }

            JsonNode root;
            try {
                root = mapper.readTree(payload);
            } catch (JsonProcessingException e) {
                throw WeatherException.externalApi("failed to decode " + displayName() + " response", e);
            }
            return parse(root, city);
        } catch (IOException e) {
            throw WeatherException.externalApi("failed to call " + displayName() + ": " + e.getMessage(), e);
        }
    }

    /**
     * Error bodies are only inspected for hints, so an unparseable one reads as empty.
     */
    private JsonNode readQuietly(String payload) {
        if (payload.isEmpty()) {
            return mapper.createObjectNode();
        }
        try {
            return mapper.readTree(payload);
        } catch (JsonProcessingException e) {
            log.debug("{} error body is not JSON: {}", displayName(), e.getOriginalMessage());
            return mapper.createObjectNode();
        }
    }

    protected static JsonNode required(JsonNode parent, String field) throws WeatherException {
        JsonNode node = parent == null ? null : parent.get(field);
        if (node == null || node.isNull()) {
            throw WeatherException.externalApi("invalid weather data format: missing " + field);
        }
        return node;
    }

    protected static double requiredNumber(JsonNode parent, String field) throws WeatherException {
        JsonNode node = required(parent, field);
        if (!node.isNumber()) {
            throw WeatherException.externalApi("invalid weather data format: " + field + " is not a number");
        }
        return node.asDouble();
    }
}
