package notifier.weather.sdk;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Locale;
import java.util.Objects;

/**
 * Immutable point-in-time weather observation for one city.
 * Temperature is in degrees Celsius, humidity in percent.
 */
public final class WeatherReading {
    public static final double ABSOLUTE_ZERO_CELSIUS = -273.15;

    private final double temperature;
    private final double humidity;
    private final String description;
    private final String city;
    private final Instant timestamp;

    @JsonCreator
    public WeatherReading(@JsonProperty("temperature") double temperature,
                          @JsonProperty("humidity") double humidity,
                          @JsonProperty("description") String description,
                          @JsonProperty("city") String city,
                          @JsonProperty("timestamp") Instant timestamp) {
        this.temperature = temperature;
        this.humidity = humidity;
        this.description = description;
        this.city = city;
        this.timestamp = timestamp;
    }

    public double getTemperature() {
        return temperature;
    }

    public double getHumidity() {
        return humidity;
    }

    public String getDescription() {
        return description;
    }

    public String getCity() {
        return city;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    /**
     * Checks the reading's invariants and reports the first one violated.
     *
     * @throws WeatherException of kind {@link ErrorKind#VALIDATION}
     */
    public void validate() throws WeatherException {
        String violation = firstViolation();
        if (violation != null) {
            throw WeatherException.validation(violation);
        }
    }

    @JsonIgnore
    public boolean isValid() {
        return firstViolation() == null;
    }

    private String firstViolation() {
        if (city == null || city.trim().isEmpty()) {
            return "city cannot be empty";
        }
        if (description == null || description.trim().isEmpty()) {
            return "description cannot be empty";
        }
        // NaN fails both comparisons below, so check it explicitly
        if (Double.isNaN(temperature) || temperature < ABSOLUTE_ZERO_CELSIUS) {
            return "temperature cannot be below absolute zero";
        }
        if (Double.isNaN(humidity) || humidity < 0 || humidity > 100) {
            return "humidity must be between 0 and 100";
        }
        return null;
    }

    @JsonIgnore
    public double getTemperatureInFahrenheit() {
        return temperature * 9 / 5 + 32;
    }

    @JsonIgnore
    public double getTemperatureInKelvin() {
        return temperature - ABSOLUTE_ZERO_CELSIUS;
    }

    @JsonIgnore
    public String getHumidityDescription() {
        if (humidity < 20) {
            return "Very dry";
        }
        if (humidity < 30) {
            return "Dry";
        }
        if (humidity < 60) {
            return "Comfortable";
        }
        if (humidity < 80) {
            return "Humid";
        }
        return "Very humid";
    }

    /**
     * Comfortable means 18..28 °C and 30..70 % humidity, bounds inclusive.
     */
    @JsonIgnore
    public boolean isComfortable() {
        return temperature >= 18 && temperature <= 28
                && humidity >= 30 && humidity <= 70;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof WeatherReading)) {
            return false;
        }
        WeatherReading that = (WeatherReading) o;
        return Double.compare(temperature, that.temperature) == 0
                && Double.compare(humidity, that.humidity) == 0
                && Objects.equals(description, that.description)
                && Objects.equals(city, that.city)
                && Objects.equals(timestamp, that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(temperature, humidity, description, city, timestamp);
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "%s: %.1f°C, %.1f%% humidity, %s",
                city, temperature, humidity, description);
    }
}
