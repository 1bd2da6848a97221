package noisemaps.math;

/**
 * Mathematical utility functions for noise map building.
 * Works in single precision to match the float noise maps.
 */
public final class MathUtils {

    /** Degrees to radians conversion factor. */
    public static final float DEG_TO_RAD = (float) (Math.PI / 180.0);

    private MathUtils() {}

    /**
     * Linear interpolation between a and b.
     * t = 0 returns a, t = 1 returns b.
     */
    public static float lerp(float a, float b, float t) {
        return ((1.0f - t) * a) + (t * b);
    }

    /**
     * Clamp value to [min, max] range.
     */
    public static float clamp(float value, float min, float max) {
        return Math.max(min, Math.min(max, value));
    }

    /**
     * Strict ordering check used by every bounds validation.
     * NaN on either side fails.
     */
    public static boolean isOrdered(float lower, float upper) {
        return lower < upper;
    }
}
