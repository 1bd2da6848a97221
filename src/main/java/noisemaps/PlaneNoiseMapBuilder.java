package noisemaps;

import noisemaps.math.MathUtils;
import noisemaps.model.Plane;
import noisemaps.module.NoiseModule;

/**
 * Builds a noise map from values sampled on the x-z plane.
 * <p>
 * With seamless tiling enabled, each value blends four samples one extent
 * apart so that opposite edges of the map line up.
 */
public class PlaneNoiseMapBuilder extends NoiseMapBuilder {
    private float lowerXBound;
    private float upperXBound;
    private float lowerZBound;
    private float upperZBound;
    private boolean seamless;

    public PlaneNoiseMapBuilder() {
        setBounds(-1.0f, 1.0f, -1.0f, 1.0f);
    }

    /**
     * @throws InvalidBoundsException if a lower bound is not strictly below its upper bound
     */
    public void setBounds(float lowerXBound, float upperXBound, float lowerZBound, float upperZBound) {
        checkBounds(lowerXBound, upperXBound, lowerZBound, upperZBound);

        this.lowerXBound = lowerXBound;
        this.upperXBound = upperXBound;
        this.lowerZBound = lowerZBound;
        this.upperZBound = upperZBound;
    }

    private static void checkBounds(float lowerX, float upperX, float lowerZ, float upperZ) {
        if (!MathUtils.isOrdered(lowerX, upperX) || !MathUtils.isOrdered(lowerZ, upperZ)) {
            throw new InvalidBoundsException(
                "Incoherent bounds: lowerXBound >= upperXBound or lowerZBound >= upperZBound, got x ["
                    + lowerX + ", " + upperX + "], z [" + lowerZ + ", " + upperZ + "]");
        }
    }

    @Override
    protected void validateBounds() {
        checkBounds(lowerXBound, upperXBound, lowerZBound, upperZBound);
    }

    @Override
    protected SurfaceWalk prepareWalk(NoiseModule source, int width, int height) {
        Plane model = new Plane(source);

        float lowerX = lowerXBound;
        float lowerZ = lowerZBound;
        float xExtent = upperXBound - lowerXBound;
        float zExtent = upperZBound - lowerZBound;

        float xDelta = xExtent / width;
        float zDelta = zExtent / height;

        if (!seamless) {
            return new SurfaceWalk(lowerX, xDelta, lowerZ, zDelta, model::getValue);
        }
        return new SurfaceWalk(lowerX, xDelta, lowerZ, zDelta,
            (curX, curZ) -> sampleSeamless(model, curX, curZ, lowerX, lowerZ, xExtent, zExtent));
    }

    private static float sampleSeamless(Plane model, float curX, float curZ,
                                        float lowerX, float lowerZ, float xExtent, float zExtent) {
        float swValue = model.getValue(curX, curZ);
        float seValue = model.getValue(curX + xExtent, curZ);
        float nwValue = model.getValue(curX, curZ + zExtent);
        float neValue = model.getValue(curX + xExtent, curZ + zExtent);

        float xBlend = 1.0f - ((curX - lowerX) / xExtent);
        float zBlend = 1.0f - ((curZ - lowerZ) / zExtent);

        float z0 = MathUtils.lerp(swValue, seValue, xBlend);
        float z1 = MathUtils.lerp(nwValue, neValue, xBlend);
        return MathUtils.lerp(z0, z1, zBlend);
    }

    public boolean isSeamless() {
        return seamless;
    }

    public void setSeamless(boolean seamless) {
        this.seamless = seamless;
    }

    public float getLowerXBound() {
        return lowerXBound;
    }

    public float getUpperXBound() {
        return upperXBound;
    }

    public float getLowerZBound() {
        return lowerZBound;
    }

    public float getUpperZBound() {
        return upperZBound;
    }
}
