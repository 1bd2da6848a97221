package noisemaps;

import noisemaps.math.MathUtils;
import noisemaps.model.Cylinder;
import noisemaps.module.NoiseModule;

/**
 * Builds a noise map from values sampled on the surface of a cylinder.
 * <p>
 * The map's x axis is the angle around the cylinder's y axis, in degrees;
 * the map's y axis is the height above the x-z plane. The cylinder has
 * radius 1 and infinite height; see {@link Cylinder}.
 * <p>
 * Coordinates advance by repeated addition of a fixed delta per cell. This
 * reproduces the rounding of reference noise maps bit for bit, so it is not
 * replaced by {@code lower + index * delta}.
 */
public class CylinderNoiseMapBuilder extends NoiseMapBuilder {
    public static final float DEFAULT_LOWER_ANGLE = -180.0f;
    public static final float DEFAULT_UPPER_ANGLE = 180.0f;
    public static final float DEFAULT_LOWER_HEIGHT = -10.0f;
    public static final float DEFAULT_UPPER_HEIGHT = 10.0f;

    private float lowerAngleBound;
    private float upperAngleBound;
    private float lowerHeightBound;
    private float upperHeightBound;

    public CylinderNoiseMapBuilder() {
        setBounds(DEFAULT_LOWER_ANGLE, DEFAULT_UPPER_ANGLE, DEFAULT_LOWER_HEIGHT, DEFAULT_UPPER_HEIGHT);
    }

    /**
     * Set the region of the cylinder to sample. All four bounds are replaced
     * together; on failure the previous bounds are kept.
     *
     * @param lowerAngleBound Lower angle bound, in degrees
     * @param upperAngleBound Upper angle bound, in degrees
     * @param lowerHeightBound Lower height bound
     * @param upperHeightBound Upper height bound
     * @throws InvalidBoundsException if a lower bound is not strictly below its upper bound
     */
    public void setBounds(float lowerAngleBound, float upperAngleBound,
                          float lowerHeightBound, float upperHeightBound) {
        checkBounds(lowerAngleBound, upperAngleBound, lowerHeightBound, upperHeightBound);

        this.lowerAngleBound = lowerAngleBound;
        this.upperAngleBound = upperAngleBound;
        this.lowerHeightBound = lowerHeightBound;
        this.upperHeightBound = upperHeightBound;
    }

    private static void checkBounds(float lowerAngle, float upperAngle, float lowerHeight, float upperHeight) {
        if (!MathUtils.isOrdered(lowerAngle, upperAngle) || !MathUtils.isOrdered(lowerHeight, upperHeight)) {
            throw new InvalidBoundsException(
                "Incoherent bounds: lowerAngleBound >= upperAngleBound or lowerHeightBound >= upperHeightBound, got angle ["
                    + lowerAngle + ", " + upperAngle + "], height [" + lowerHeight + ", " + upperHeight + "]");
        }
    }

    @Override
    protected void validateBounds() {
        checkBounds(lowerAngleBound, upperAngleBound, lowerHeightBound, upperHeightBound);
    }

    @Override
    protected SurfaceWalk prepareWalk(NoiseModule source, int width, int height) {
        Cylinder model = new Cylinder(source);

        float angleExtent = upperAngleBound - lowerAngleBound;
        float heightExtent = upperHeightBound - lowerHeightBound;

        float xDelta = angleExtent / width;
        float yDelta = heightExtent / height;

        return new SurfaceWalk(lowerAngleBound, xDelta, lowerHeightBound, yDelta, model::getValue);
    }

    public float getLowerAngleBound() {
        return lowerAngleBound;
    }

    public float getUpperAngleBound() {
        return upperAngleBound;
    }

    public float getLowerHeightBound() {
        return lowerHeightBound;
    }

    public float getUpperHeightBound() {
        return upperHeightBound;
    }
}
