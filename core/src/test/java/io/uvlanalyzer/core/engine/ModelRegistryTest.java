package io.uvlanalyzer.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.uvlanalyzer.core.encoding.PropositionalEncoder;
import io.uvlanalyzer.core.error.MalformedModelException;
import io.uvlanalyzer.core.parser.UvlParser;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/** Tests for {@link ModelRegistry} and the lazy encoding of {@link ModelSession}. */
@DisplayName("ModelRegistryTest")
class ModelRegistryTest {

    private final AtomicInteger created = new AtomicInteger();

    private final Function<String, ModelSession> factory = text -> {
        created.incrementAndGet();
        return new ModelSession(new UvlParser().parse(text), new PropositionalEncoder());
    };

    private static String model(String root) {
        return "features\n    " + root + "\n";
    }

    @Test
    @DisplayName("same text → same session, created once")
    void cachesByText() {
        ModelRegistry registry = new ModelRegistry(4);

        ModelSession first = registry.getOrCreate(model("A"), factory);
        ModelSession second = registry.getOrCreate(model("A"), factory);

        assertThat(second).isSameAs(first);
        assertThat(created).hasValue(1);
        assertThat(registry.size()).isEqualTo(1);
    }

    @Test
    @DisplayName("over capacity → oldest session is evicted")
    void evictsOldest() {
        ModelRegistry registry = new ModelRegistry(2);

        ModelSession a = registry.getOrCreate(model("A"), factory);
        registry.getOrCreate(model("B"), factory);
        registry.getOrCreate(model("C"), factory);

        assertThat(registry.size()).isEqualTo(2);
        assertThat(registry.getOrCreate(model("A"), factory)).isNotSameAs(a);
        assertThat(created).hasValue(4);
    }

    @Test
    @DisplayName("capacity 0 → nothing cached")
    void disabled() {
        ModelRegistry registry = new ModelRegistry(0);

        registry.getOrCreate(model("A"), factory);
        registry.getOrCreate(model("A"), factory);

        assertThat(registry.size()).isZero();
        assertThat(created).hasValue(2);
    }

    @Test
    @DisplayName("malformed text is never cached")
    void failuresAreNotCached() {
        ModelRegistry registry = new ModelRegistry(4);

        assertThatThrownBy(() -> registry.getOrCreate("features\n", factory))
                .isInstanceOf(MalformedModelException.class);
        assertThat(registry.size()).isZero();
    }

    @Test
    @DisplayName("session encodes lazily, once")
    void lazyEncoding() {
        ModelSession session = registry().getOrCreate(model("A"), factory);

        assertThat(session.isEncoded()).isFalse();
        assertThat(session.formula()).isSameAs(session.formula());
        assertThat(session.isEncoded()).isTrue();
    }

    @Test
    @DisplayName("negative capacity is rejected")
    void negativeCapacity() {
        assertThatThrownBy(() -> new ModelRegistry(-1)).isInstanceOf(IllegalArgumentException.class);
    }

    private static ModelRegistry registry() {
        return new ModelRegistry(1);
    }
}
