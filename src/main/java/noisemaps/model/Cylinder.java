package noisemaps.model;

import noisemaps.math.MathUtils;
import noisemaps.math.Point3D;
import noisemaps.module.NoiseModule;

/**
 * Model of a cylinder surface, used to sample a module with
 * (angle, height) coordinates.
 * <p>
 * The cylinder has a radius of 1.0, infinite height, is oriented along the
 * y axis and centered at the origin. Angles are in degrees; an angle of 0
 * lies on the positive x axis and angles grow towards the positive z axis.
 */
public class Cylinder {
    private final NoiseModule source;

    public Cylinder(NoiseModule source) {
        this.source = source;
    }

    /**
     * Return the module output at the given position on the cylinder.
     *
     * @param angle Angle around the y axis, in degrees
     * @param height Height along the y axis
     */
    public float getValue(float angle, float height) {
        Point3D p = toPoint(angle, height);
        return source.getValue(p.x, p.y, p.z);
    }

    /**
     * Point on the cylinder surface for the given coordinates.
     */
    public static Point3D toPoint(float angle, float height) {
        return new Point3D(
            (float) Math.cos(angle * MathUtils.DEG_TO_RAD),
            height,
            (float) Math.sin(angle * MathUtils.DEG_TO_RAD)
        );
    }

    public NoiseModule getSource() {
        return source;
    }
}
