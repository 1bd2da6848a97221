package noisemaps;

/**
 * The requested noise map width or height is negative.
 */
public class InvalidDimensionsException extends NoiseMapBuilderException {
    private final int width;
    private final int height;

    public InvalidDimensionsException(int width, int height) {
        super("Dimension must be greater or equal 0, got: " + width + "x" + height);
        this.width = width;
        this.height = height;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }
}
