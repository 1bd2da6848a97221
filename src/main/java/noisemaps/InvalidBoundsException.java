package noisemaps;

/**
 * A lower bound is not strictly below its upper bound.
 */
public class InvalidBoundsException extends NoiseMapBuilderException {

    public InvalidBoundsException(String message) {
        super(message);
    }
}
