package noisemaps.filter;

/**
 * Per-cell filter attached to a noise map builder.
 * <p>
 * The builder asks {@link #classify} for every cell. Cells classified as
 * {@link FilterLevel#CONSTANT} receive {@link #getConstantValue()} without
 * the source module being queried; cells classified as
 * {@link FilterLevel#FILTER} are sampled and then post-processed by
 * {@link #filterValue}.
 */
public interface NoiseMapFilter {

    /**
     * Filter that leaves every cell to the source module.
     */
    NoiseMapFilter NONE = new NoiseMapFilter() {
        @Override
        public FilterLevel classify(int x, int y) {
            return FilterLevel.SOURCE;
        }

        @Override
        public float getConstantValue() {
            return 0.0f;
        }

        @Override
        public float filterValue(int x, int y, float value) {
            return value;
        }
    };

    FilterLevel classify(int x, int y);

    /**
     * Value written to cells classified as {@link FilterLevel#CONSTANT}.
     */
    float getConstantValue();

    /**
     * Post-process a sampled value for a cell classified as
     * {@link FilterLevel#FILTER}.
     */
    float filterValue(int x, int y, float value);
}
