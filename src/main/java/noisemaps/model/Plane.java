package noisemaps.model;

import noisemaps.module.NoiseModule;

/**
 * Model of the x-z plane. Samples the module at (x, 0, z).
 */
public class Plane {
    private final NoiseModule source;

    public Plane(NoiseModule source) {
        this.source = source;
    }

    public float getValue(float x, float z) {
        return source.getValue(x, 0.0f, z);
    }

    public NoiseModule getSource() {
        return source;
    }
}
