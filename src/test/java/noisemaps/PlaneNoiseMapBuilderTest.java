package noisemaps;

import noisemaps.module.NoiseModule;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class PlaneNoiseMapBuilderTest {

    @Test
    void setBounds_rejectsUnorderedBounds() {
        PlaneNoiseMapBuilder builder = new PlaneNoiseMapBuilder();

        assertThatThrownBy(() -> builder.setBounds(1.0f, -1.0f, 0.0f, 1.0f))
            .isInstanceOf(InvalidBoundsException.class);
        assertThat(builder.getLowerXBound()).isEqualTo(-1.0f);
        assertThat(builder.getUpperZBound()).isEqualTo(1.0f);
    }

    @Test
    void build_samplesPlaneAtZeroHeight() {
        List<float[]> points = new ArrayList<>();
        NoiseModule recording = (x, y, z) -> {
            points.add(new float[] {x, y, z});
            return x;
        };
        NoiseMap map = new NoiseMap();
        PlaneNoiseMapBuilder builder = new PlaneNoiseMapBuilder();
        builder.setBounds(0.0f, 4.0f, 10.0f, 12.0f);
        builder.setSize(4, 2);
        builder.setSourceModule(recording);
        builder.setNoiseMap(map);

        builder.build();

        assertThat(points).hasSize(8);
        assertThat(points.get(0)).containsExactly(0.0f, 0.0f, 10.0f);
        assertThat(points.get(3)).containsExactly(3.0f, 0.0f, 10.0f);
        assertThat(points.get(4)).containsExactly(0.0f, 0.0f, 11.0f);
        assertThat(map.getRow(1)).containsExactly(0.0f, 1.0f, 2.0f, 3.0f);
    }

    @Test
    void build_seamlessLeftEdgeMatchesValueOneExtentAway() {
        NoiseModule wave = (x, y, z) -> (float) (Math.sin(x * 1.7) + Math.cos(z * 0.9));
        NoiseMap map = new NoiseMap();
        PlaneNoiseMapBuilder builder = new PlaneNoiseMapBuilder();
        builder.setSeamless(true);
        builder.setSize(8, 8);
        builder.setSourceModule(wave);
        builder.setNoiseMap(map);

        builder.build();

        assertThat(builder.isSeamless()).isTrue();
        // Corner cell blends fully to the sample one extent away on both axes
        assertThat(map.getValue(0, 0)).isCloseTo(wave.getValue(1.0f, 0.0f, 1.0f), within(1e-5f));
    }

    @Test
    void build_seamlessOfConstantModuleIsConstant() {
        NoiseMap map = new NoiseMap();
        PlaneNoiseMapBuilder builder = new PlaneNoiseMapBuilder();
        builder.setSeamless(true);
        builder.setSize(5, 5);
        builder.setSourceModule((x, y, z) -> 2.0f);
        builder.setNoiseMap(map);

        builder.build();

        float[] range = map.getMinMax();
        assertThat(range[0]).isCloseTo(2.0f, within(1e-6f));
        assertThat(range[1]).isCloseTo(2.0f, within(1e-6f));
    }

    @Test
    void build_ignoresSettingChangesMadeDuringBuild() {
        NoiseModule wave = (x, y, z) -> (float) (Math.sin(x * 1.7) + Math.cos(z * 0.9));

        NoiseMap expected = new NoiseMap();
        PlaneNoiseMapBuilder reference = new PlaneNoiseMapBuilder();
        reference.setSize(6, 4);
        reference.setSourceModule(wave);
        reference.setNoiseMap(expected);
        reference.build();

        NoiseMap actual = new NoiseMap();
        PlaneNoiseMapBuilder builder = new PlaneNoiseMapBuilder();
        builder.setSize(6, 4);
        builder.setSourceModule(wave);
        builder.setNoiseMap(actual);
        builder.setCallback(row -> {
            builder.setSeamless(true);
            builder.setBounds(5.0f, 9.0f, 5.0f, 9.0f);
        });
        builder.build();

        for (int y = 0; y < 4; y++) {
            assertThat(actual.getRow(y)).containsExactly(expected.getRow(y));
        }
        assertThat(builder.isSeamless()).isTrue();
    }
}
