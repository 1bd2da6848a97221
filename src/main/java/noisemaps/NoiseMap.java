package noisemaps;

import java.util.Arrays;

/**
 * A resizable 2D grid of float noise values.
 * <p>
 * Values are stored row-major. Reads outside the grid return the border
 * value; writes outside the grid are ignored. Concurrent writes to distinct
 * cells are safe, which parallel builders rely on.
 */
public class NoiseMap {
    private static final float[] EMPTY = new float[0];

    private int width;
    private int height;
    private float borderValue;
    private float[] values = EMPTY;

    public NoiseMap() {
    }

    public NoiseMap(int width, int height) {
        setSize(width, height);
    }

    /**
     * Resize the map. The previous contents are discarded and every cell is
     * reset to 0.
     *
     * @throws IllegalArgumentException if either dimension is negative
     */
    public void setSize(int width, int height) {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Dimension must be greater or equal 0, got: " + width + "x" + height);
        }
        long cells = (long) width * height;
        if (cells > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Noise map too large: " + width + "x" + height);
        }
        this.width = width;
        this.height = height;
        this.values = cells == 0 ? EMPTY : new float[(int) cells];
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public float getBorderValue() {
        return borderValue;
    }

    /**
     * Value returned for reads outside the grid.
     */
    public void setBorderValue(float borderValue) {
        this.borderValue = borderValue;
    }

    public boolean contains(int x, int y) {
        return x >= 0 && x < width && y >= 0 && y < height;
    }

    public float getValue(int x, int y) {
        if (!contains(x, y)) {
            return borderValue;
        }
        return values[y * width + x];
    }

    public void setValue(int x, int y, float value) {
        if (contains(x, y)) {
            values[y * width + x] = value;
        }
    }

    /**
     * Set every cell to the given value.
     */
    public void clear(float value) {
        Arrays.fill(values, value);
    }

    /**
     * Minimum and maximum cell values as {min, max}. An empty map returns
     * {border, border}.
     */
    public float[] getMinMax() {
        if (values.length == 0) {
            return new float[] {borderValue, borderValue};
        }
        float min = Float.POSITIVE_INFINITY;
        float max = Float.NEGATIVE_INFINITY;
        for (float v : values) {
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        return new float[] {min, max};
    }

    /**
     * Copy of one row of the map.
     */
    public float[] getRow(int y) {
        if (y < 0 || y >= height) {
            throw new IndexOutOfBoundsException("Row " + y + " outside map of height " + height);
        }
        return Arrays.copyOfRange(values, y * width, (y + 1) * width);
    }

    @Override
    public String toString() {
        return String.format("NoiseMap(%dx%d, border=%.3f)", width, height, borderValue);
    }
}
