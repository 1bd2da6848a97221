package noisemaps.model;

import noisemaps.math.MathUtils;
import noisemaps.math.Point3D;
import noisemaps.module.NoiseModule;

/**
 * Model of a unit sphere centered at the origin, sampled with
 * (latitude, longitude) coordinates in degrees.
 * <p>
 * Latitude +90 is the north pole at (0, 1, 0). Longitude 0 at the equator
 * lies on the positive x axis.
 */
public class Sphere {
    private final NoiseModule source;

    public Sphere(NoiseModule source) {
        this.source = source;
    }

    public float getValue(float lat, float lon) {
        Point3D p = toPoint(lat, lon);
        return source.getValue(p.x, p.y, p.z);
    }

    /**
     * Convert latitude/longitude to a point on the unit sphere.
     */
    public static Point3D toPoint(float lat, float lon) {
        float r = (float) Math.cos(MathUtils.DEG_TO_RAD * lat);
        return new Point3D(
            r * (float) Math.cos(MathUtils.DEG_TO_RAD * lon),
            (float) Math.sin(MathUtils.DEG_TO_RAD * lat),
            r * (float) Math.sin(MathUtils.DEG_TO_RAD * lon)
        );
    }

    public NoiseModule getSource() {
        return source;
    }
}
