package noisemaps;

/**
 * Progress notification from a noise map builder.
 */
@FunctionalInterface
public interface NoiseMapBuilderCallback {

    NoiseMapBuilderCallback NONE = row -> { };

    /**
     * Called once per row after every cell of that row has been written.
     * Row indices arrive in increasing order starting at 0. May be called
     * from a worker thread when the builder runs in parallel.
     *
     * @param row Index of the completed row
     */
    void onRowCompleted(int row);
}
