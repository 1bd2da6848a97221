package noisemaps.module;

import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import noisemaps.math.Point3D;

/**
 * Memoizes the output of an expensive source module per input point.
 * Useful when the same module feeds several builders, or when a builder is
 * rebuilt over overlapping bounds.
 * <p>
 * Backed by a bounded Caffeine cache, so it is safe to share between
 * threads of a parallel build.
 */
public class CachedModule implements NoiseModule {
    public static final int DEFAULT_MAX_SIZE = 65536;

    private final NoiseModule source;
    private final LoadingCache<Point3D, Float> cache;

    public CachedModule(NoiseModule source) {
        this(source, DEFAULT_MAX_SIZE);
    }

    public CachedModule(NoiseModule source, long maximumSize) {
        if (source == null) {
            throw new IllegalArgumentException("A source module must be provided");
        }
        if (maximumSize <= 0) {
            throw new IllegalArgumentException("maximumSize must be positive, got: " + maximumSize);
        }
        this.source = source;
        this.cache = Caffeine.newBuilder()
            .maximumSize(maximumSize)
            .recordStats()
            .build(point -> source.getValue(point.x, point.y, point.z));
    }

    @Override
    public float getValue(float x, float y, float z) {
        return cache.get(new Point3D(x, y, z));
    }

    public NoiseModule getSource() {
        return source;
    }

    /**
     * Drop every cached value, e.g. after the source module was reconfigured.
     */
    public void invalidate() {
        cache.invalidateAll();
    }

    public CacheStats getStats() {
        return cache.stats();
    }
}
