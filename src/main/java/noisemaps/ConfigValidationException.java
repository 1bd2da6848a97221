package noisemaps;

/**
 * Thrown when a builder template holds values that cannot produce a valid
 * builder.
 */
public class ConfigValidationException extends Exception {

    public ConfigValidationException(String message) {
        super(message);
    }
}
