package io.uvlanalyzer.core.engine;

import io.uvlanalyzer.core.encoding.EncodedFormula;
import io.uvlanalyzer.core.encoding.PropositionalEncoder;
import io.uvlanalyzer.core.model.FeatureModel;
import io.uvlanalyzer.core.model.FeatureTree;
import java.util.Objects;

/**
 * Explicit handle on one parsed model. Callers obtain it from
 * {@link AnalysisEngine#parse(String)} and pass it to every analysis on that model.
 *
 * <p>
 * Thread-safe: the model is immutable, and the encoded formula is built lazily at most once.
 * Concurrent first callers block on the build instead of duplicating it, and later callers
 * read the published value without locking.
 */
public final class ModelSession {

    private final FeatureModel model;
    private final PropositionalEncoder encoder;
    private final Object lock = new Object();
    private volatile EncodedFormula formula;

    ModelSession(FeatureModel model, PropositionalEncoder encoder) {
        this.model = Objects.requireNonNull(model, "model must not be null");
        this.encoder = Objects.requireNonNull(encoder, "encoder must not be null");
    }

    public FeatureModel model() {
        return model;
    }

    public FeatureTree tree() {
        return model.tree();
    }

    /** The model's validity formula, encoding it on first use. */
    public EncodedFormula formula() {
        EncodedFormula current = formula;
        if (current == null) {
            synchronized (lock) {
                current = formula;
                if (current == null) {
                    current = encoder.encode(model);
                    formula = current;
                }
            }
        }
        return current;
    }

    /** Returns {@code true} once the formula has been built. */
    public boolean isEncoded() {
        return formula != null;
    }

    @Override
    public String toString() {
        return "ModelSession[" + model + ", encoded=" + isEncoded() + "]";
    }
}
