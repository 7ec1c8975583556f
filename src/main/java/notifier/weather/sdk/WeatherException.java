package notifier.weather.sdk;

/**
 * Checked exception for every failure the SDK reports, tagged with an {@link ErrorKind}.
 */
public class WeatherException extends Exception {
    private final ErrorKind kind;

    public WeatherException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public WeatherException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public static WeatherException validation(String message) {
        return new WeatherException(ErrorKind.VALIDATION, message);
    }

    public static WeatherException notFound(String message) {
        return new WeatherException(ErrorKind.NOT_FOUND, message);
    }

    public static WeatherException externalApi(String message) {
        return new WeatherException(ErrorKind.EXTERNAL_API, message);
    }

    public static WeatherException externalApi(String message, Throwable cause) {
        return new WeatherException(ErrorKind.EXTERNAL_API, message, cause);
    }

    public static WeatherException configuration(String message) {
        return new WeatherException(ErrorKind.CONFIGURATION, message);
    }

    public static WeatherException configuration(String message, Throwable cause) {
        return new WeatherException(ErrorKind.CONFIGURATION, message, cause);
    }

    public ErrorKind getKind() {
        return kind;
    }

    public boolean is(ErrorKind expected) {
        return kind == expected;
    }

    @Override
    public String toString() {
        String text = kind.code() + ": " + getMessage();
        if (getCause() != null) {
            text += " (caused by: " + getCause().getMessage() + ")";
        }
        return text;
    }
}
