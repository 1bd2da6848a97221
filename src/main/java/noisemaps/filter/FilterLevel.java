package noisemaps.filter;

/**
 * Per-cell classification returned by a {@link NoiseMapFilter}.
 */
public enum FilterLevel {
    /**
     * Sample the source module normally.
     */
    SOURCE,

    /**
     * Skip sampling and write the filter's constant value.
     */
    CONSTANT,

    /**
     * Sample the source module, then pass the value through
     * {@link NoiseMapFilter#filterValue(int, int, float)}.
     */
    FILTER
}
