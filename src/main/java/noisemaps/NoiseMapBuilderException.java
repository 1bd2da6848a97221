package noisemaps;

/**
 * Base class for caller-input errors detected by a noise map builder.
 * Thrown before the noise map is touched.
 */
public abstract class NoiseMapBuilderException extends IllegalArgumentException {

    protected NoiseMapBuilderException(String message) {
        super(message);
    }
}
