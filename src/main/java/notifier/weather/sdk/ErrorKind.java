package notifier.weather.sdk;

/**
 * Classification of SDK failures. Callers map these to their own responses,
 * e.g. VALIDATION to a client error and NOT_FOUND to "resource not found".
 */
public enum ErrorKind {
    VALIDATION("VALIDATION_ERROR"),
    NOT_FOUND("NOT_FOUND_ERROR"),
    EXTERNAL_API("EXTERNAL_API_ERROR"),
    CONFIGURATION("CONFIGURATION_ERROR");

    private final String code;

    ErrorKind(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
