package notifier.weather.sdk;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class WeatherReadingTest {

    private static final Instant NOW = Instant.parse("2024-01-01T12:00:00Z");

    private static WeatherReading reading(double temperature, double humidity) {
        return new WeatherReading(temperature, humidity, "Sunny", "Madrid", NOW);
    }

    private static String violation(WeatherReading reading) {
        WeatherException e = assertThrows(WeatherException.class, reading::validate);
        assertEquals(ErrorKind.VALIDATION, e.getKind());
        return e.getMessage();
    }

    @Test
    void validate_acceptsBoundaryValues() throws Exception {
        reading(WeatherReading.ABSOLUTE_ZERO_CELSIUS, 0).validate();
        reading(56.7, 100).validate();
        assertTrue(reading(20, 50).isValid());
    }

    @Test
    void validate_reportsFirstViolation() {
        assertEquals("city cannot be empty",
                violation(new WeatherReading(-500, 150, "", " ", NOW)));
        assertEquals("description cannot be empty",
                violation(new WeatherReading(-500, 150, null, "Madrid", NOW)));
        assertEquals("temperature cannot be below absolute zero", violation(reading(-273.16, 150)));
        assertEquals("humidity must be between 0 and 100", violation(reading(20, -0.1)));
        assertEquals("humidity must be between 0 and 100", violation(reading(20, 100.1)));
    }

    @Test
    void validate_rejectsNaN() {
        assertEquals("temperature cannot be below absolute zero", violation(reading(Double.NaN, 50)));
        assertEquals("humidity must be between 0 and 100", violation(reading(20, Double.NaN)));
        assertFalse(reading(Double.NaN, 50).isValid());
    }

    @Test
    void conversions() {
        WeatherReading reading = reading(25.0, 50);

        assertEquals(77.0, reading.getTemperatureInFahrenheit(), 1e-9);
        assertEquals(298.15, reading.getTemperatureInKelvin(), 1e-9);
    }

    @Test
    void humidityDescription_bands() {
        assertEquals("Very dry", reading(20, 10).getHumidityDescription());
        assertEquals("Dry", reading(20, 20).getHumidityDescription());
        assertEquals("Comfortable", reading(20, 45).getHumidityDescription());
        assertEquals("Humid", reading(20, 60).getHumidityDescription());
        assertEquals("Very humid", reading(20, 80).getHumidityDescription());
    }

    @Test
    void isComfortable_inclusiveBounds() {
        assertTrue(reading(18, 30).isComfortable());
        assertTrue(reading(28, 70).isComfortable());
        assertFalse(reading(17.9, 50).isComfortable());
        assertFalse(reading(22, 70.5).isComfortable());
    }

    @Test
    void toString_usesOneDecimal() {
        assertEquals("Madrid: 25.0°C, 50.0% humidity, Sunny", reading(25, 50).toString());
    }

    @Test
    void equality_coversAllFields() {
        assertEquals(reading(20, 50), reading(20, 50));
        assertEquals(reading(20, 50).hashCode(), reading(20, 50).hashCode());
        assertNotEquals(reading(20, 50), new WeatherReading(20, 50, "Sunny", "Madrid", NOW.plusSeconds(1)));
    }
}
