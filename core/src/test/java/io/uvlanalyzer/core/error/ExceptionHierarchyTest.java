package io.uvlanalyzer.core.error;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

/** Tests for the exception hierarchy: two abstract tiers, URNs and location hints. */
class ExceptionHierarchyTest {

    // --- Hierarchy structure ---

    @Test
    void analysisExceptionIsAbstractAndRoot() {
        assertThat(AnalysisException.class).isAbstract();
        assertThat(AnalysisException.class.getSuperclass()).isEqualTo(RuntimeException.class);
    }

    @Test
    void loadAndEvalTiersAreAbstract() {
        assertThat(ModelLoadException.class).isAbstract();
        assertThat(ModelLoadException.class.getSuperclass()).isEqualTo(AnalysisException.class);
        assertThat(AnalysisEvalException.class).isAbstract();
        assertThat(AnalysisEvalException.class.getSuperclass()).isEqualTo(AnalysisException.class);
    }

    // --- Parse-time errors ---

    @Test
    void malformedModelCarriesLine() {
        var ex = new MalformedModelException("Duplicate feature name 'A'", 12);

        assertThat(ex).isInstanceOf(ModelLoadException.class);
        assertThat(ex.line()).isEqualTo(12);
        assertThat(ex.location()).isEqualTo("line 12");
        assertThat(ex.urn()).isEqualTo("urn:uvl-analyzer:error:malformed-model");
        assertThat(ex.phase()).isEqualTo(AnalysisException.Phase.PARSE);
        assertThat(ex.detail()).isEqualTo("Duplicate feature name 'A'");
    }

    @Test
    void malformedModelWithoutLinePointsAtInput() {
        var ex = new MalformedModelException("Model text is empty", 0);

        assertThat(ex.location()).isEqualTo("input");
    }

    @Test
    void constraintSyntaxSharesMalformedUrnAndAddsColumn() {
        var ex = new ConstraintSyntaxException("Unexpected '&'", 4, 9);

        assertThat(ex).isInstanceOf(ModelLoadException.class);
        assertThat(ex.urn()).isEqualTo(MalformedModelException.URN);
        assertThat(ex.location()).isEqualTo("line 4, column 9");
    }

    // --- Analysis-time errors ---

    @Test
    void unknownFeatureCarriesNameAndOperation() {
        var ex = new UnknownFeatureException("Keyboard", "commonality");

        assertThat(ex).isInstanceOf(AnalysisEvalException.class);
        assertThat(ex.featureName()).isEqualTo("Keyboard");
        assertThat(ex.operation()).isEqualTo("commonality");
        assertThat(ex.urn()).isEqualTo("urn:uvl-analyzer:error:unknown-feature");
        assertThat(ex.phase()).isEqualTo(AnalysisException.Phase.ANALYSIS);
        assertThat(ex.getMessage()).contains("Keyboard");
    }

    @Test
    void unknownFeatureOutsideDispatcherHasNoOperation() {
        assertThat(new UnknownFeatureException("Keyboard").operation()).isNull();
    }

    @Test
    void timeoutCarriesBudget() {
        var cause = new RuntimeException("solver timeout");
        var ex = new AnalysisTimeoutException("exceeded", cause, 500, "configurations");

        assertThat(ex.budgetMs()).isEqualTo(500);
        assertThat(ex.getCause()).isSameAs(cause);
        assertThat(ex.urn()).isEqualTo("urn:uvl-analyzer:error:timeout");
    }

    @Test
    void invalidArgumentHasItsOwnUrn() {
        var ex = new InvalidArgumentException("Sample size must be at least 1, got 0", "sampling");

        assertThat(ex).isInstanceOf(AnalysisEvalException.class);
        assertThat(ex.urn()).isEqualTo("urn:uvl-analyzer:error:invalid-argument");
        assertThat(ex.operation()).isEqualTo("sampling");
    }
}
