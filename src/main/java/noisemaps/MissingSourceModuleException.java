package noisemaps;

public class MissingSourceModuleException extends NoiseMapBuilderException {

    public MissingSourceModuleException() {
        super("A source module must be provided");
    }
}
