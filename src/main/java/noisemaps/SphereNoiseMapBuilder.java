package noisemaps;

import noisemaps.math.MathUtils;
import noisemaps.model.Sphere;
import noisemaps.module.NoiseModule;

/**
 * Builds a noise map from values sampled on the surface of a unit sphere.
 * The map's x axis is longitude and its y axis is latitude, both in degrees.
 */
public class SphereNoiseMapBuilder extends NoiseMapBuilder {
    private float southLatBound;
    private float northLatBound;
    private float westLonBound;
    private float eastLonBound;

    public SphereNoiseMapBuilder() {
        setBounds(-90.0f, 90.0f, -180.0f, 180.0f);
    }

    /**
     * @throws InvalidBoundsException if south is not below north or west is not below east
     */
    public void setBounds(float southLatBound, float northLatBound, float westLonBound, float eastLonBound) {
        checkBounds(southLatBound, northLatBound, westLonBound, eastLonBound);

        this.southLatBound = southLatBound;
        this.northLatBound = northLatBound;
        this.westLonBound = westLonBound;
        this.eastLonBound = eastLonBound;
    }

    private static void checkBounds(float south, float north, float west, float east) {
        if (!MathUtils.isOrdered(south, north) || !MathUtils.isOrdered(west, east)) {
            throw new InvalidBoundsException(
                "Incoherent bounds: southLatBound >= northLatBound or westLonBound >= eastLonBound, got lat ["
                    + south + ", " + north + "], lon [" + west + ", " + east + "]");
        }
    }

    @Override
    protected void validateBounds() {
        checkBounds(southLatBound, northLatBound, westLonBound, eastLonBound);
    }

    @Override
    protected SurfaceWalk prepareWalk(NoiseModule source, int width, int height) {
        Sphere model = new Sphere(source);

        float lonExtent = eastLonBound - westLonBound;
        float latExtent = northLatBound - southLatBound;

        float xDelta = lonExtent / width;
        float yDelta = latExtent / height;

        // Columns walk longitude, rows walk latitude
        return new SurfaceWalk(westLonBound, xDelta, southLatBound, yDelta,
            (lon, lat) -> model.getValue(lat, lon));
    }

    public float getSouthLatBound() {
        return southLatBound;
    }

    public float getNorthLatBound() {
        return northLatBound;
    }

    public float getWestLonBound() {
        return westLonBound;
    }

    public float getEastLonBound() {
        return eastLonBound;
    }
}
