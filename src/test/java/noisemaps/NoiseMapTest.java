package noisemaps;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NoiseMapTest {

    @Test
    void setSize_resetsContents() {
        NoiseMap map = new NoiseMap(2, 2);
        map.setValue(1, 1, 4.0f);

        map.setSize(3, 1);

        assertThat(map.getWidth()).isEqualTo(3);
        assertThat(map.getHeight()).isEqualTo(1);
        assertThat(map.getRow(0)).containsExactly(0.0f, 0.0f, 0.0f);
    }

    @Test
    void setSize_rejectsNegativeDimensions() {
        NoiseMap map = new NoiseMap();

        assertThatThrownBy(() -> map.setSize(-1, 2)).isInstanceOf(IllegalArgumentException.class);
        assertThat(map.getWidth()).isZero();
    }

    @Test
    void getValue_returnsBorderOutsideGrid() {
        NoiseMap map = new NoiseMap(2, 2);
        map.setBorderValue(-3.0f);
        map.setValue(0, 0, 1.5f);

        assertThat(map.getValue(0, 0)).isEqualTo(1.5f);
        assertThat(map.getValue(-1, 0)).isEqualTo(-3.0f);
        assertThat(map.getValue(2, 1)).isEqualTo(-3.0f);
        assertThat(map.getValue(1, 2)).isEqualTo(-3.0f);
    }

    @Test
    void setValue_outsideGridIsIgnored() {
        NoiseMap map = new NoiseMap(2, 1);

        map.setValue(5, 0, 9.0f);
        map.setValue(0, -1, 9.0f);

        assertThat(map.getRow(0)).containsExactly(0.0f, 0.0f);
    }

    @Test
    void getMinMax_coversAllCells() {
        NoiseMap map = new NoiseMap(3, 2);
        map.clear(1.0f);
        map.setValue(2, 1, -4.0f);
        map.setValue(0, 1, 6.0f);

        assertThat(map.getMinMax()).containsExactly(-4.0f, 6.0f);
    }

    @Test
    void getMinMax_ofEmptyMapIsBorder() {
        NoiseMap map = new NoiseMap(0, 4);
        map.setBorderValue(2.0f);

        assertThat(map.getMinMax()).containsExactly(2.0f, 2.0f);
    }

    @Test
    void getRow_rejectsRowOutsideMap() {
        NoiseMap map = new NoiseMap(2, 2);

        assertThatThrownBy(() -> map.getRow(2)).isInstanceOf(IndexOutOfBoundsException.class);
    }
}
