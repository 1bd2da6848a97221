package noisemaps.math;

/**
 * Immutable 3D point in a module's native input space.
 * Equality is exact on the float bits so the type can key caches.
 */
public final class Point3D {
    public final float x;
    public final float y;
    public final float z;

    public Point3D(float x, float y, float z) {
        this.x = x;
        this.y = y;
        this.z = z;
    }

    /**
     * Distance from the origin.
     */
    public double length() {
        return Math.sqrt((double) x * x + (double) y * y + (double) z * z);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Point3D other)) return false;
        return Float.compare(x, other.x) == 0
            && Float.compare(y, other.y) == 0
            && Float.compare(z, other.z) == 0;
    }

    @Override
    public int hashCode() {
        return Float.hashCode(x) * 961 + Float.hashCode(y) * 31 + Float.hashCode(z);
    }

    @Override
    public String toString() {
        return "Point3D(" + x + ", " + y + ", " + z + ")";
    }
}
