package noisemaps.module;

/**
 * A source of coherent noise: any generator or combinator that maps a point
 * in 3D space to a scalar.
 * <p>
 * Implementations are expected to be pure functions of the input point.
 * Builders running in parallel mode call {@link #getValue} from several
 * threads at once.
 */
@FunctionalInterface
public interface NoiseModule {

    /**
     * Evaluate the module at the given point.
     *
     * @param x X coordinate
     * @param y Y coordinate
     * @param z Z coordinate
     * @return the noise value at that point
     */
    float getValue(float x, float y, float z);
}
