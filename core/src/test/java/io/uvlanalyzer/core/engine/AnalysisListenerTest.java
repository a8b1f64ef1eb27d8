package io.uvlanalyzer.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.uvlanalyzer.core.error.MalformedModelException;
import io.uvlanalyzer.core.error.UnknownFeatureException;
import io.uvlanalyzer.core.spi.AnalysisListener;
import io.uvlanalyzer.core.spi.AnalysisListener.*;
import io.uvlanalyzer.core.testkit.TestModels;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Tests for the {@link AnalysisListener} SPI: a registered listener receives parse and analysis
 * lifecycle events, and a failing listener never changes the outcome.
 */
@DisplayName("AnalysisListenerTest")
class AnalysisListenerTest {

    private static final String LAPTOP = TestModels.text(TestModels.LAPTOP);

    private AnalysisEngine engine;
    private CapturingListener listener;

    @BeforeEach
    void setUp() {
        listener = new CapturingListener();
        engine = new AnalysisEngine(AnalysisBudget.DEFAULT, listener);
    }

    @AfterEach
    void tearDown() {
        engine.close();
    }

    @Test
    @DisplayName("successful analysis → parsed + started + completed")
    void successfulAnalysis() {
        engine.execute("core_features", LAPTOP, null);

        assertThat(listener.parsed).hasSize(1);
        ModelParsedEvent parsed = listener.parsed.get(0);
        assertThat(parsed.rootFeature()).isEqualTo("Laptop");
        assertThat(parsed.featureCount()).isEqualTo(9);
        assertThat(parsed.constraintCount()).isEqualTo(1);

        assertThat(listener.started).extracting(AnalysisStartedEvent::operation).containsExactly("core_features");
        assertThat(listener.completed).hasSize(1);
        assertThat(listener.completed.get(0).operation()).isEqualTo("core_features");
        assertThat(listener.completed.get(0).durationMs()).isNotNegative();
        assertThat(listener.failed).isEmpty();
    }

    @Test
    @DisplayName("cached model text is parsed only once")
    void cachedModelParsedOnce() {
        engine.execute("core_features", LAPTOP, null);
        engine.execute("dead_features", LAPTOP, null);

        assertThat(listener.parsed).hasSize(1);
        assertThat(listener.completed).hasSize(2);
    }

    @Test
    @DisplayName("malformed model → rejected + failed with the malformed-model URN")
    void rejectedModel() {
        assertThatThrownBy(() -> engine.execute("core_features", "features\n    Root\n        A\n", null))
                .isInstanceOf(MalformedModelException.class);

        assertThat(listener.rejected).hasSize(1);
        assertThat(listener.rejected.get(0).location()).isEqualTo("line 3");
        assertThat(listener.failed).hasSize(1);
        assertThat(listener.failed.get(0).errorUrn()).isEqualTo(MalformedModelException.URN);
        assertThat(listener.completed).isEmpty();
    }

    @Test
    @DisplayName("unknown feature → failed event with URN and detail")
    void failedAnalysis() {
        assertThatThrownBy(() -> engine.execute("commonality", LAPTOP, "Keyboard"))
                .isInstanceOf(UnknownFeatureException.class);

        assertThat(listener.failed).hasSize(1);
        AnalysisFailedEvent failed = listener.failed.get(0);
        assertThat(failed.operation()).isEqualTo("commonality");
        assertThat(failed.errorUrn()).isEqualTo(UnknownFeatureException.URN);
        assertThat(failed.errorDetail()).contains("Keyboard");
    }

    @Test
    @DisplayName("throwing listener does not affect the result")
    void throwingListener() {
        try (AnalysisEngine guarded = new AnalysisEngine(AnalysisBudget.DEFAULT, new ThrowingListener())) {
            AnalysisResult result = guarded.execute("count_leafs", LAPTOP, null);

            assertThat(result.value().asInt()).isEqualTo(7);
        }
    }

    @Test
    @DisplayName("no listener → analyses run normally")
    void noListener() {
        try (AnalysisEngine plain = new AnalysisEngine(AnalysisBudget.DEFAULT, null)) {
            assertThat(plain.execute("max_depth", LAPTOP, null).value().asInt()).isEqualTo(2);
        }
    }

    static final class CapturingListener implements AnalysisListener {
        final List<AnalysisStartedEvent> started = new CopyOnWriteArrayList<>();
        final List<AnalysisCompletedEvent> completed = new CopyOnWriteArrayList<>();
        final List<AnalysisFailedEvent> failed = new CopyOnWriteArrayList<>();
        final List<ModelParsedEvent> parsed = new CopyOnWriteArrayList<>();
        final List<ModelRejectedEvent> rejected = new CopyOnWriteArrayList<>();

        @Override
        public void onAnalysisStarted(AnalysisStartedEvent event) {
            started.add(event);
        }

        @Override
        public void onAnalysisCompleted(AnalysisCompletedEvent event) {
            completed.add(event);
        }

        @Override
        public void onAnalysisFailed(AnalysisFailedEvent event) {
            failed.add(event);
        }

        @Override
        public void onModelParsed(ModelParsedEvent event) {
            parsed.add(event);
        }

        @Override
        public void onModelRejected(ModelRejectedEvent event) {
            rejected.add(event);
        }
    }

    static final class ThrowingListener implements AnalysisListener {
        @Override
        public void onAnalysisStarted(AnalysisStartedEvent event) {
            throw new IllegalStateException("boom");
        }

        @Override
        public void onAnalysisCompleted(AnalysisCompletedEvent event) {
            throw new IllegalStateException("boom");
        }

        @Override
        public void onAnalysisFailed(AnalysisFailedEvent event) {
            throw new IllegalStateException("boom");
        }

        @Override
        public void onModelParsed(ModelParsedEvent event) {
            throw new IllegalStateException("boom");
        }

        @Override
        public void onModelRejected(ModelRejectedEvent event) {
            throw new IllegalStateException("boom");
        }
    }
}
