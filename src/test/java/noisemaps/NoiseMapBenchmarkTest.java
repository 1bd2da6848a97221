package noisemaps;

import noisemaps.module.ConstantModule;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NoiseMapBenchmarkTest {

    @Test
    void benchmark_reportsSamplesAndValueRange() {
        CylinderNoiseMapBuilder builder = new CylinderNoiseMapBuilder();
        builder.setSize(10, 5);
        builder.setSourceModule(new ConstantModule(0.25f));
        builder.setNoiseMap(new NoiseMap());

        NoiseMapBenchmark.BenchmarkResult result = NoiseMapBenchmark.benchmark(builder, 1, 4);

        assertThat(result.totalSamples).isEqualTo(200);
        assertThat(result.minValue).isEqualTo(0.25f);
        assertThat(result.maxValue).isEqualTo(0.25f);
        assertThat(result.avgValue).isEqualTo(0.25);
        assertThat(result.totalTimeMs).isGreaterThanOrEqualTo(0.0);
        assertThat(result.toString()).contains("samples=200");
    }

    @Test
    void benchmark_rejectsZeroIterations() {
        assertThatThrownBy(() -> NoiseMapBenchmark.benchmark(new CylinderNoiseMapBuilder(), 0, 0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void quickBenchmark_propagatesBuilderErrors() {
        assertThatThrownBy(() -> NoiseMapBenchmark.quickBenchmark(new CylinderNoiseMapBuilder()))
            .isInstanceOf(MissingSourceModuleException.class);
    }
}
