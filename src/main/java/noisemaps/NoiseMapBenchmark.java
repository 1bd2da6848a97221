package noisemaps;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Benchmark utility for measuring noise map builder performance.
 * The builder must be fully configured (size, module, noise map) beforehand.
 */
public final class NoiseMapBenchmark {
    private static final Logger LOGGER = LoggerFactory.getLogger(NoiseMapBenchmark.class);

    private NoiseMapBenchmark() {}

    /**
     * Run a benchmark on the given builder.
     *
     * @param builder The configured builder to benchmark
     * @param warmupIterations Number of untimed builds before timing
     * @param iterations Number of timed builds
     * @return Timing and value statistics of the timed builds
     */
    public static BenchmarkResult benchmark(NoiseMapBuilder builder, int warmupIterations, int iterations) {
        if (iterations < 1) {
            throw new IllegalArgumentException("iterations must be at least 1, got: " + iterations);
        }

        LOGGER.info("Warmup: {} builds...", warmupIterations);
        for (int w = 0; w < warmupIterations; w++) {
            builder.build();
        }

        long samplesPerBuild = (long) builder.getWidth() * builder.getHeight();
        LOGGER.info("Timing: {} builds of {} samples...", iterations, samplesPerBuild);

        long startTime = System.nanoTime();
        for (int i = 0; i < iterations; i++) {
            builder.build();
        }
        long totalTimeNs = System.nanoTime() - startTime;

        NoiseMap map = builder.getNoiseMap();
        float[] range = map.getMinMax();
        double sum = 0;
        for (int y = 0; y < map.getHeight(); y++) {
            for (int x = 0; x < map.getWidth(); x++) {
                sum += map.getValue(x, y);
            }
        }

        long totalSamples = samplesPerBuild * iterations;
        double totalTimeMs = totalTimeNs / 1_000_000.0;
        double avgTimePerSampleNs = totalSamples > 0 ? (double) totalTimeNs / totalSamples : 0.0;
        double samplesPerSecond = totalTimeNs > 0 ? totalSamples / (totalTimeNs / 1_000_000_000.0) : 0.0;

        BenchmarkResult result = new BenchmarkResult(
            totalSamples,
            totalTimeMs,
            avgTimePerSampleNs,
            samplesPerSecond,
            range[0],
            range[1],
            samplesPerBuild > 0 ? sum / samplesPerBuild : 0.0
        );

        LOGGER.info("Benchmark complete: {}", result);
        return result;
    }

    /**
     * Quick benchmark with default settings.
     */
    public static BenchmarkResult quickBenchmark(NoiseMapBuilder builder) {
        return benchmark(builder, 1, 3);
    }

    /**
     * Benchmark result data.
     */
    public static class BenchmarkResult {
        public final long totalSamples;
        public final double totalTimeMs;
        public final double avgTimePerSampleNs;
        public final double samplesPerSecond;
        public final float minValue;
        public final float maxValue;
        public final double avgValue;

        public BenchmarkResult(long totalSamples, double totalTimeMs, double avgTimePerSampleNs,
                               double samplesPerSecond, float minValue, float maxValue, double avgValue) {
            this.totalSamples = totalSamples;
            this.totalTimeMs = totalTimeMs;
            this.avgTimePerSampleNs = avgTimePerSampleNs;
            this.samplesPerSecond = samplesPerSecond;
            this.minValue = minValue;
            this.maxValue = maxValue;
            this.avgValue = avgValue;
        }

        @Override
        public String toString() {
            return String.format(
                "BenchmarkResult{samples=%d, totalMs=%.2f, avgNs=%.0f, samples/sec=%.0f, range=[%.4f,%.4f], avg=%.4f}",
                totalSamples, totalTimeMs, avgTimePerSampleNs, samplesPerSecond, minValue, maxValue, avgValue
            );
        }
    }
}
