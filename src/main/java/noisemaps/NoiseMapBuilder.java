package noisemaps;

import noisemaps.filter.FilterLevel;
import noisemaps.filter.NoiseMapFilter;
import noisemaps.module.NoiseModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.stream.IntStream;

/**
 * Base class for noise map builders.
 * <p>
 * A builder fills a {@link NoiseMap} with the output of a {@link NoiseModule}
 * sampled over some surface. Subclasses define the surface, its bounds and
 * the walk from map cells to surface coordinates; this class owns the
 * shared state (size, module, target map, filter, callback), checks the
 * preconditions, walks rows and columns, resolves the filter per cell, and
 * schedules rows sequentially or in parallel.
 * <p>
 * Builders are not thread-safe: configure and build from one thread. The
 * module, map, filter and callback are borrowed, not owned.
 */
public abstract class NoiseMapBuilder {
    private static final Logger LOGGER = LoggerFactory.getLogger(NoiseMapBuilder.class);

    public static final int DEFAULT_PARALLEL_THRESHOLD = 64;

    private int width;
    private int height;
    private NoiseModule sourceModule;
    private NoiseMap noiseMap;
    private NoiseMapFilter filter;
    private NoiseMapBuilderCallback callback;

    // Performance flags
    private boolean parallel;
    private int parallelThreshold = DEFAULT_PARALLEL_THRESHOLD;
    private boolean debugTiming;

    /**
     * Samples the surface at one (column, row) coordinate pair. Called
     * concurrently from several rows in parallel mode.
     */
    @FunctionalInterface
    protected interface CellSampler {
        float sample(float column, float row);
    }

    /**
     * How a builder walks its surface: where the first column and row start,
     * how far each step advances, and how a coordinate pair is sampled.
     */
    protected static final class SurfaceWalk {
        final float columnStart;
        final float columnDelta;
        final float rowStart;
        final float rowDelta;
        final CellSampler sampler;

        public SurfaceWalk(float columnStart, float columnDelta, float rowStart, float rowDelta,
                           CellSampler sampler) {
            this.columnStart = columnStart;
            this.columnDelta = columnDelta;
            this.rowStart = rowStart;
            this.rowDelta = rowDelta;
            this.sampler = sampler;
        }
    }

    /**
     * Builds the noise map.
     * <p>
     * All preconditions are checked before the noise map is resized. On
     * success the previous contents of the noise map are gone and every
     * cell holds either a module-derived value or the filter's constant.
     * <p>
     * Coordinates advance by repeated addition of a fixed delta per cell and
     * per row. This reproduces the rounding of reference noise maps bit for
     * bit, so it is not replaced by {@code start + index * delta}.
     *
     * @throws InvalidBoundsException if the bounds are not ordered
     * @throws InvalidDimensionsException if width or height is negative
     * @throws MissingSourceModuleException if no source module is set
     * @throws MissingNoiseMapException if no noise map is set
     */
    public void build() {
        validateBounds();

        if (width < 0 || height < 0) {
            throw new InvalidDimensionsException(width, height);
        }
        if (sourceModule == null) {
            throw new MissingSourceModuleException();
        }
        if (noiseMap == null) {
            throw new MissingNoiseMapException();
        }

        long startTime = debugTiming ? System.nanoTime() : 0;

        noiseMap.setSize(width, height);

        SurfaceWalk walk = prepareWalk(sourceModule, width, height);
        NoiseMapFilter activeFilter = filter != null ? filter : NoiseMapFilter.NONE;
        NoiseMapBuilderCallback activeCallback = callback != null ? callback : NoiseMapBuilderCallback.NONE;

        if (parallel && width > 0 && height >= parallelThreshold) {
            LOGGER.debug("Building {}x{} noise map in parallel", width, height);
            buildParallel(walk, activeFilter, activeCallback, noiseMap);
        } else {
            LOGGER.debug("Building {}x{} noise map", width, height);
            float curRow = walk.rowStart;
            for (int y = 0; y < height; y++) {
                writeRow(walk, activeFilter, noiseMap, y, curRow);
                curRow += walk.rowDelta;
                activeCallback.onRowCompleted(y);
            }
        }

        if (debugTiming) {
            double elapsedMs = (System.nanoTime() - startTime) / 1_000_000.0;
            LOGGER.info("{} built {}x{} noise map in {} ms",
                getClass().getSimpleName(), width, height, String.format("%.3f", elapsedMs));
        }
    }

    private void buildParallel(SurfaceWalk walk, NoiseMapFilter filter,
                               NoiseMapBuilderCallback callback, NoiseMap target) {
        // Row starts accumulate the same way the sequential pass does
        float[] rowStarts = new float[height];
        float curRow = walk.rowStart;
        for (int y = 0; y < height; y++) {
            rowStarts[y] = curRow;
            curRow += walk.rowDelta;
        }

        RowProgressSequencer sequencer = new RowProgressSequencer(height, callback);
        IntStream.range(0, height).parallel().forEach(y -> {
            writeRow(walk, filter, target, y, rowStarts[y]);
            sequencer.rowCompleted(y);
        });
    }

    private void writeRow(SurfaceWalk walk, NoiseMapFilter filter, NoiseMap target, int y, float rowCoord) {
        float curColumn = walk.columnStart;

        for (int x = 0; x < width; x++) {
            float finalValue;
            FilterLevel level = filter.classify(x, y);

            if (level == FilterLevel.CONSTANT) {
                finalValue = filter.getConstantValue();
            } else {
                finalValue = walk.sampler.sample(curColumn, rowCoord);

                if (level == FilterLevel.FILTER) {
                    finalValue = filter.filterValue(x, y, finalValue);
                }
            }

            target.setValue(x, y, finalValue);

            curColumn += walk.columnDelta;
        }
    }

    /**
     * Re-check the bounds at build time.
     *
     * @throws InvalidBoundsException if the bounds are not ordered
     */
    protected abstract void validateBounds();

    /**
     * Compute the per-build walk over the surface: model, start coordinates
     * and per-cell deltas. Called after the noise map has been resized.
     */
    protected abstract SurfaceWalk prepareWalk(NoiseModule source, int width, int height);

    /**
     * Set the size of the noise map to build. Negative values are accepted
     * here and rejected by {@link #build()}.
     */
    public void setSize(int width, int height) {
        this.width = width;
        this.height = height;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public NoiseModule getSourceModule() {
        return sourceModule;
    }

    public void setSourceModule(NoiseModule sourceModule) {
        this.sourceModule = sourceModule;
    }

    public NoiseMap getNoiseMap() {
        return noiseMap;
    }

    public void setNoiseMap(NoiseMap noiseMap) {
        this.noiseMap = noiseMap;
    }

    public NoiseMapFilter getFilter() {
        return filter;
    }

    /**
     * Attach a per-cell filter, or {@code null} to sample every cell.
     */
    public void setFilter(NoiseMapFilter filter) {
        this.filter = filter;
    }

    public NoiseMapBuilderCallback getCallback() {
        return callback;
    }

    /**
     * Attach a progress callback, or {@code null} for none.
     */
    public void setCallback(NoiseMapBuilderCallback callback) {
        this.callback = callback;
    }

    public boolean isParallel() {
        return parallel;
    }

    /**
     * Build rows on the common fork-join pool. The source module must then
     * tolerate concurrent calls. Results are identical to a sequential
     * build.
     */
    public void setParallel(boolean parallel) {
        this.parallel = parallel;
    }

    public int getParallelThreshold() {
        return parallelThreshold;
    }

    /**
     * Minimum number of rows before a parallel build is used.
     */
    public void setParallelThreshold(int parallelThreshold) {
        if (parallelThreshold < 1) {
            throw new IllegalArgumentException("parallelThreshold must be at least 1, got: " + parallelThreshold);
        }
        this.parallelThreshold = parallelThreshold;
    }

    public boolean isDebugTiming() {
        return debugTiming;
    }

    public void setDebugTiming(boolean debugTiming) {
        this.debugTiming = debugTiming;
    }
}
