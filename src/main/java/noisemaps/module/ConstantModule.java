package noisemaps.module;

/**
 * Module that outputs the same value at every point.
 */
public class ConstantModule implements NoiseModule {
    private final float value;

    public ConstantModule(float value) {
        this.value = value;
    }

    public float getConstantValue() {
        return value;
    }

    @Override
    public float getValue(float x, float y, float z) {
        return value;
    }
}
