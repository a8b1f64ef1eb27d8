package io.uvlanalyzer.core.solver;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.uvlanalyzer.core.encoding.PropositionalEncoder;
import io.uvlanalyzer.core.error.AnalysisTimeoutException;
import io.uvlanalyzer.core.error.UnknownFeatureException;
import io.uvlanalyzer.core.model.Configuration;
import io.uvlanalyzer.core.model.FeatureModel;
import io.uvlanalyzer.core.model.SelectionCriteria;
import io.uvlanalyzer.core.testkit.TestModels;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/** Tests for {@link ConfigurationSpace}: satisfiability, validity, counting, enumeration, sampling. */
@DisplayName("ConfigurationSpaceTest")
class ConfigurationSpaceTest {

    private static List<Configuration> list(Iterable<Configuration> configurations) {
        List<Configuration> result = new ArrayList<>();
        configurations.forEach(result::add);
        return result;
    }

    @Nested
    @DisplayName("Satisfiability and validity")
    class Validity {

        @Test
        @DisplayName("consistent model is satisfiable, contradictory one is not")
        void satisfiability() {
            assertThat(TestModels.space(TestModels.LAPTOP).isSatisfiable()).isTrue();
            assertThat(TestModels.space(TestModels.CONTRADICTION).isSatisfiable()).isFalse();
        }

        @Test
        @DisplayName("selection honouring groups and constraints is valid")
        void validSelection() {
            ConfigurationSpace space = TestModels.space(TestModels.LAPTOP);

            assertThat(space.isConfigurationValid(Set.of("Laptop", "Screen", "Storage", "HDD", "Ethernet")))
                    .isTrue();
        }

        @Test
        @DisplayName("unmentioned features count as unselected")
        void unmentionedFeaturesAreUnselected() {
            ConfigurationSpace space = TestModels.space(TestModels.LAPTOP);

            // Storage is mandatory but missing
            assertThat(space.isConfigurationValid(Set.of("Laptop", "Screen", "HDD", "Ethernet")))
                    .isFalse();
        }

        @Test
        @DisplayName("cross-tree constraint violation is invalid")
        void constraintViolation() {
            ConfigurationSpace space = TestModels.space(TestModels.LAPTOP);

            assertThat(space.isConfigurationValid(Set.of("Laptop", "Screen", "Storage", "SSD", "Ethernet", "Camera")))
                    .isFalse();
        }

        @Test
        @DisplayName("bare spelling resolves a quoted feature")
        void quotedNames() {
            ConfigurationSpace space = TestModels.space(TestModels.CARDINALITY);

            assertThat(space.isConfigurationValid(Set.of("Vehicle", "Combustion", "Roof Rack", "Radio")))
                    .isTrue();
            assertThat(space.isConfigurationValid(Set.of("Vehicle", "Electric", "\"Roof Rack\"", "Radio")))
                    .isFalse();
        }

        @Test
        @DisplayName("unknown feature in selection → UnknownFeatureException")
        void unknownFeature() {
            ConfigurationSpace space = TestModels.space(TestModels.LAPTOP);

            assertThatThrownBy(() -> space.isConfigurationValid(Set.of("Laptop", "Keyboard")))
                    .isInstanceOf(UnknownFeatureException.class)
                    .satisfies(e -> assertThat(((UnknownFeatureException) e).featureName()).isEqualTo("Keyboard"));
        }
    }

    @Nested
    @DisplayName("Counting and enumeration")
    class Counting {

        @Test
        @DisplayName("exact counts of the fixture models")
        void exactCounts() {
            assertThat(TestModels.space(TestModels.LAPTOP).countConfigurations()).isEqualTo(BigInteger.valueOf(20));
            assertThat(TestModels.space(TestModels.CARDINALITY).countConfigurations())
                    .isEqualTo(BigInteger.valueOf(15));
            assertThat(TestModels.space(TestModels.ALTERNATIVE).countConfigurations()).isEqualTo(BigInteger.TWO);
            assertThat(TestModels.space(TestModels.CONTRADICTION).countConfigurations()).isEqualTo(BigInteger.ZERO);
        }

        @ParameterizedTest
        @ValueSource(strings = {"laptop", "alternative", "false-optional", "dead-feature", "cardinality", "contradiction"})
        @DisplayName("enumeration yields exactly count distinct valid configurations")
        void enumerationMatchesCount(String name) {
            ConfigurationSpace space = TestModels.space(name);

            List<Configuration> all = list(space.allConfigurations());

            assertThat(BigInteger.valueOf(all.size())).isEqualTo(space.countConfigurations());
            assertThat(new HashSet<>(all)).hasSameSizeAs(all);
            for (Configuration configuration : all) {
                assertThat(space.isConfigurationValid(new HashSet<>(configuration.selectedFeatures())))
                        .as("valid: %s", configuration)
                        .isTrue();
            }
        }

        @ParameterizedTest
        @ValueSource(strings = {"laptop", "alternative", "false-optional", "dead-feature", "cardinality"})
        @DisplayName("estimate is an upper bound of the exact count")
        void estimateBoundsCount(String name) {
            ConfigurationSpace space = TestModels.space(name);

            assertThat(space.estimateConfigurationCount()).isGreaterThanOrEqualTo(space.countConfigurations());
        }

        @Test
        @DisplayName("estimate follows the group structure and ignores constraints")
        void estimateValues() {
            assertThat(TestModels.space(TestModels.LAPTOP).estimateConfigurationCount())
                    .isEqualTo(BigInteger.valueOf(24));
            assertThat(TestModels.space(TestModels.ALTERNATIVE).estimateConfigurationCount())
                    .isEqualTo(BigInteger.TWO);
        }

        @Test
        @DisplayName("alternative group → selected-first order, every feature listed in declaration order")
        void enumerationOrder() {
            List<Configuration> all = list(TestModels.space(TestModels.ALTERNATIVE).allConfigurations());

            assertThat(all).hasSize(2);
            assertThat(all.get(0).assignment()).containsExactly(
                    Map.entry("Root", true), Map.entry("X", true), Map.entry("Y", false));
            assertThat(all.get(1).assignment()).containsExactly(
                    Map.entry("Root", true), Map.entry("X", false), Map.entry("Y", true));
        }

        @Test
        @DisplayName("enumeration is restartable and stable")
        void restartable() {
            Iterable<Configuration> configurations = TestModels.space(TestModels.LAPTOP).allConfigurations();

            assertThat(list(configurations)).containsExactlyElementsOf(list(configurations));
        }

        @Test
        @DisplayName("selected feature names are reported in declaration order")
        void selectedFeatureOrder() {
            List<Configuration> all = list(TestModels.space(TestModels.FALSE_OPTIONAL).allConfigurations());

            assertThat(all).hasSize(1);
            assertThat(all.get(0).selectedFeatures()).containsExactly("Root", "A", "B");
        }

        @Test
        @DisplayName("count of a model with many independent options is exact")
        void wideModel() {
            StringBuilder text = new StringBuilder("features\n    Root\n        optional\n");
            for (int i = 0; i < 70; i++) {
                text.append("            F").append(i).append('\n');
            }

            ConfigurationSpace space = TestModels.spaceOf(text.toString());

            assertThat(space.countConfigurations()).isEqualTo(BigInteger.TWO.pow(70));
            assertThat(space.estimateConfigurationCount()).isEqualTo(BigInteger.TWO.pow(70));
        }

        @Test
        @DisplayName("[1..2] group over three leaves → six configurations, counted and estimated")
        void boundedCardinalityGroup() {
            ConfigurationSpace space = TestModels.spaceOf("""
                    features
                        R
                            [1..2]
                                A
                                B
                                C
                    """);

            assertThat(space.countConfigurations()).isEqualTo(BigInteger.valueOf(6));
            assertThat(space.estimateConfigurationCount()).isEqualTo(BigInteger.valueOf(6));
            assertThat(list(space.allConfigurations())).hasSize(6);
            assertThat(space.isConfigurationValid(Set.of("R", "A", "B", "C"))).isFalse();
        }

        @Test
        @DisplayName("cardinality estimate multiplies the counts of the chosen children")
        void cardinalityEstimateWithNestedChild() {
            ConfigurationSpace space = TestModels.spaceOf("""
                    features
                        R
                            [1..2]
                                A
                                    optional
                                        A1
                                B
                                C
                    """);

            assertThat(space.countConfigurations()).isEqualTo(BigInteger.valueOf(9));
            assertThat(space.estimateConfigurationCount()).isEqualTo(BigInteger.valueOf(9));
        }

        @Test
        @DisplayName("count of a wide or-group branches once per child without exhausting the stack")
        void wideOrGroup() {
            StringBuilder text = new StringBuilder("features\n    Root\n        or\n");
            for (int i = 0; i < 3000; i++) {
                text.append("            F").append(i).append('\n');
            }

            ConfigurationSpace space = TestModels.spaceOf(text.toString());

            assertThat(space.countConfigurations()).isEqualTo(BigInteger.TWO.pow(3000).subtract(BigInteger.ONE));
        }
    }

    @Nested
    @DisplayName("Filtering")
    class Filtering {

        @Test
        @DisplayName("criteria keep only consistent configurations")
        void filter() {
            ConfigurationSpace space = TestModels.space(TestModels.LAPTOP);

            List<Configuration> filtered =
                    list(space.filterConfigurations(new SelectionCriteria(Set.of("Camera"), Set.of("Ethernet"))));

            // Camera forces Wifi; storage and Bluetooth remain free
            assertThat(filtered).hasSize(4);
            assertThat(filtered).allSatisfy(configuration -> {
                assertThat(configuration.isSelected("Camera")).isTrue();
                assertThat(configuration.isSelected("Wifi")).isTrue();
                assertThat(configuration.isSelected("Ethernet")).isFalse();
            });
        }

        @Test
        @DisplayName("empty criteria → every configuration")
        void emptyCriteria() {
            ConfigurationSpace space = TestModels.space(TestModels.LAPTOP);

            assertThat(list(space.filterConfigurations(SelectionCriteria.none()))).hasSize(20);
        }

        @Test
        @DisplayName("feature both required and excluded → nothing matches")
        void conflictingCriteria() {
            ConfigurationSpace space = TestModels.space(TestModels.LAPTOP);

            assertThat(list(space.filterConfigurations(new SelectionCriteria(Set.of("SSD"), Set.of("SSD")))))
                    .isEmpty();
        }

        @Test
        @DisplayName("unknown feature in criteria → UnknownFeatureException")
        void unknownFeature() {
            ConfigurationSpace space = TestModels.space(TestModels.LAPTOP);

            assertThatThrownBy(() -> space.filterConfigurations(new SelectionCriteria(Set.of("Keyboard"), Set.of())))
                    .isInstanceOf(UnknownFeatureException.class);
        }
    }

    @Nested
    @DisplayName("Sampling")
    class Sampling {

        @Test
        @DisplayName("samples are distinct and valid")
        void distinctAndValid() {
            ConfigurationSpace space = TestModels.space(TestModels.LAPTOP);

            List<Configuration> samples = space.sampleConfigurations(7);

            assertThat(samples).hasSize(7).doesNotHaveDuplicates();
            assertThat(samples).allSatisfy(configuration -> assertThat(
                            space.isConfigurationValid(new HashSet<>(configuration.selectedFeatures())))
                    .isTrue());
        }

        @Test
        @DisplayName("asking for more than exist → all of them")
        void exhaustsSpace() {
            ConfigurationSpace space = TestModels.space(TestModels.LAPTOP);

            List<Configuration> samples = space.sampleConfigurations(100);

            assertThat(samples).hasSize(20);
            assertThat(new HashSet<>(samples)).isEqualTo(new HashSet<>(list(space.allConfigurations())));
        }

        @Test
        @DisplayName("same seed → same samples")
        void seeded() {
            FeatureModel model = TestModels.parse(TestModels.LAPTOP);
            ConfigurationSpace first = new ConfigurationSpace(
                    model, new PropositionalEncoder().encode(model), Deadline.unbounded(), 42L);
            ConfigurationSpace second = new ConfigurationSpace(
                    model, new PropositionalEncoder().encode(model), Deadline.unbounded(), 42L);

            assertThat(first.sampleConfigurations(5)).containsExactlyElementsOf(second.sampleConfigurations(5));
        }

        @Test
        @DisplayName("unsatisfiable model → no samples")
        void unsatisfiable() {
            assertThat(TestModels.space(TestModels.CONTRADICTION).sampleConfigurations(3)).isEmpty();
        }
    }

    @Nested
    @DisplayName("Deadline")
    class Timeouts {

        @Test
        @DisplayName("cancelled deadline → AnalysisTimeoutException, never a partial result")
        void cancelled() {
            FeatureModel model = TestModels.parse(TestModels.LAPTOP);
            Deadline deadline = Deadline.unbounded();
            deadline.cancel();
            ConfigurationSpace space =
                    new ConfigurationSpace(model, new PropositionalEncoder().encode(model), deadline, 0L);

            assertThatThrownBy(space::countConfigurations).isInstanceOf(AnalysisTimeoutException.class);
            assertThatThrownBy(() -> list(space.allConfigurations())).isInstanceOf(AnalysisTimeoutException.class);
            assertThatThrownBy(space::isSatisfiable)
                    .isInstanceOf(AnalysisTimeoutException.class)
                    .hasMessageContaining("cancelled");
        }

        @Test
        @DisplayName("deadline rejects a non-positive budget")
        void invalidBudget() {
            assertThatThrownBy(() -> Deadline.of(0)).isInstanceOf(IllegalArgumentException.class);
        }
    }
}
