package noisemaps.module;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CachedModuleTest {

    @Test
    void getValue_queriesSourceOncePerPoint() {
        AtomicInteger calls = new AtomicInteger();
        CachedModule cached = new CachedModule((x, y, z) -> {
            calls.incrementAndGet();
            return x + y + z;
        });

        assertThat(cached.getValue(1.0f, 2.0f, 3.0f)).isEqualTo(6.0f);
        assertThat(cached.getValue(1.0f, 2.0f, 3.0f)).isEqualTo(6.0f);
        assertThat(cached.getValue(3.0f, 2.0f, 1.0f)).isEqualTo(6.0f);

        assertThat(calls).hasValue(2);
        assertThat(cached.getStats().hitCount()).isEqualTo(1);
    }

    @Test
    void invalidate_forcesReevaluation() {
        AtomicInteger calls = new AtomicInteger();
        CachedModule cached = new CachedModule((x, y, z) -> calls.incrementAndGet());

        cached.getValue(0.0f, 0.0f, 0.0f);
        cached.invalidate();
        cached.getValue(0.0f, 0.0f, 0.0f);

        assertThat(calls).hasValue(2);
    }

    @Test
    void getValue_propagatesSourceFailure() {
        CachedModule cached = new CachedModule((x, y, z) -> {
            throw new IllegalStateException("boom");
        });

        assertThatThrownBy(() -> cached.getValue(0.0f, 0.0f, 0.0f))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("boom");
    }

    @Test
    void constructor_validatesArguments() {
        assertThatThrownBy(() -> new CachedModule(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new CachedModule(new ConstantModule(1.0f), 0))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void constantModule_returnsSameValueEverywhere() {
        ConstantModule module = new ConstantModule(-0.5f);

        assertThat(module.getValue(10.0f, -3.0f, 7.0f)).isEqualTo(-0.5f);
        assertThat(module.getConstantValue()).isEqualTo(-0.5f);
    }
}
