package noisemaps;

public class MissingNoiseMapException extends NoiseMapBuilderException {

    public MissingNoiseMapException() {
        super("A noise map must be provided");
    }
}
