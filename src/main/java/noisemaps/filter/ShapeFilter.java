package noisemaps.filter;

import noisemaps.NoiseMap;
import noisemaps.math.MathUtils;

/**
 * Filter driven by a shape map whose cells hold levels in [0, 1].
 * <p>
 * A level of 0 (or below) forces the constant value, a level of 1 (or
 * above) keeps the sampled value, and anything in between blends linearly
 * from the constant towards the sampled value. Cells outside the shape use
 * the shape's border value.
 */
public class ShapeFilter implements NoiseMapFilter {
    private final NoiseMap shape;
    private final float constantValue;

    public ShapeFilter(NoiseMap shape, float constantValue) {
        if (shape == null) {
            throw new IllegalArgumentException("A shape map must be provided");
        }
        this.shape = shape;
        this.constantValue = constantValue;
    }

    @Override
    public FilterLevel classify(int x, int y) {
        float level = shape.getValue(x, y);
        if (level <= 0.0f) {
            return FilterLevel.CONSTANT;
        }
        if (level >= 1.0f) {
            return FilterLevel.SOURCE;
        }
        return FilterLevel.FILTER;
    }

    @Override
    public float getConstantValue() {
        return constantValue;
    }

    @Override
    public float filterValue(int x, int y, float value) {
        float level = MathUtils.clamp(shape.getValue(x, y), 0.0f, 1.0f);
        return MathUtils.lerp(constantValue, value, level);
    }

    public NoiseMap getShape() {
        return shape;
    }
}
