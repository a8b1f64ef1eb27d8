package io.uvlanalyzer.core.parser;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import io.uvlanalyzer.core.error.ConstraintSyntaxException;
import io.uvlanalyzer.core.error.MalformedModelException;
import io.uvlanalyzer.core.error.ModelLoadException;
import io.uvlanalyzer.core.model.Expression;
import io.uvlanalyzer.core.model.Feature;
import io.uvlanalyzer.core.model.FeatureModel;
import io.uvlanalyzer.core.model.FeatureTree;
import io.uvlanalyzer.core.model.Group;
import io.uvlanalyzer.core.model.GroupKind;
import io.uvlanalyzer.core.testkit.TestModels;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests for {@link UvlParser}: tree structure, constraints and rejection of malformed input. */
@DisplayName("UvlParserTest")
class UvlParserTest {

    private final UvlParser parser = new UvlParser();

    @Nested
    @DisplayName("Feature tree")
    class FeatureTreeStructure {

        @Test
        @DisplayName("laptop model → features in declaration order with parents and groups")
        void parsesLaptopModel() {
            FeatureModel model = TestModels.parse(TestModels.LAPTOP);
            FeatureTree tree = model.tree();

            assertThat(model.namespace()).isEqualTo("Laptop");
            assertThat(tree.root().name()).isEqualTo("Laptop");
            assertThat(tree.names())
                    .containsExactly(
                            "Laptop", "Screen", "Storage", "SSD", "HDD", "Bluetooth", "Camera", "Wifi", "Ethernet");
            assertThat(tree.root().groups())
                    .extracting(group -> group.kind())
                    .containsExactly(GroupKind.MANDATORY, GroupKind.OPTIONAL, GroupKind.OR);
            assertThat(tree.requireFeature("SSD").parent()).isEqualTo("Storage");
            assertThat(tree.requireFeature("SSD").declaredIn()).isEqualTo(GroupKind.ALTERNATIVE);
            assertThat(tree.depth("HDD")).isEqualTo(2);
        }

        @Test
        @DisplayName("attribute block is kept and 'abstract' marks the feature")
        void parsesAttributes() {
            FeatureTree tree = TestModels.parse(TestModels.LAPTOP).tree();

            assertThat(tree.root().isAbstract()).isTrue();
            assertThat(tree.requireFeature("Screen").isAbstract()).isFalse();
        }

        @Test
        @DisplayName("tab indentation, cardinalities and quoted names")
        void parsesCardinalitiesAndQuotedNames() {
            FeatureModel model = TestModels.parse(TestModels.CARDINALITY);
            FeatureTree tree = model.tree();

            assertThat(tree.root().groups())
                    .extracting(group -> group.kind())
                    .containsExactly(GroupKind.ALTERNATIVE, GroupKind.OPTIONAL, GroupKind.OR);
            assertThat(tree.contains("\"Roof Rack\"")).isTrue();
            assertThat(tree.requireFeature("Roof Rack").name()).isEqualTo("\"Roof Rack\"");
            Feature navigation = tree.requireFeature("Navigation");
            assertThat(navigation.attributes()).containsEntry("price", "300").containsEntry("vendor", "'Acme'");
        }

        @Test
        @DisplayName("[n..n] over n children is a mandatory group")
        void fullCardinalityIsMandatory() {
            FeatureModel model = parser.parse("""
                    features
                        Root
                            [2..2]
                                A
                                B
                    """);

            assertThat(model.tree().root().groups().get(0).kind()).isEqualTo(GroupKind.MANDATORY);
        }

        @Test
        @DisplayName("[1..2] over three children keeps its bounds")
        void boundedCardinalityGroup() {
            FeatureModel model = parser.parse("""
                    features
                        Root
                            [1..2]
                                A
                                B
                                C
                    """);

            Group group = model.tree().root().groups().get(0);
            assertThat(group.kind()).isEqualTo(GroupKind.CARDINALITY);
            assertThat(group.lower()).isEqualTo(1);
            assertThat(group.upper()).isEqualTo(2);
            assertThat(group.describe()).isEqualTo("[1..2]");
            assertThat(model.tree().requireFeature("B").declaredIn()).isEqualTo(GroupKind.CARDINALITY);
        }

        @Test
        @DisplayName("open upper bound is clamped to the child count")
        void openUpperBoundClamped() {
            FeatureModel model = parser.parse("""
                    features
                        Root
                            [2..*]
                                A
                                B
                                C
                    """);

            Group group = model.tree().root().groups().get(0);
            assertThat(group.kind()).isEqualTo(GroupKind.CARDINALITY);
            assertThat(group.lower()).isEqualTo(2);
            assertThat(group.upper()).isEqualTo(3);
        }

        @Test
        @DisplayName("keyword groups carry the bounds of their kind")
        void keywordGroupBounds() {
            FeatureModel model = TestModels.parse(TestModels.CARDINALITY);

            assertThat(model.tree().root().groups())
                    .extracting(Group::lower, Group::upper)
                    .containsExactly(tuple(1, 1), tuple(0, 2), tuple(1, 2));
        }

        @Test
        @DisplayName("typed feature declaration keeps its type")
        void parsesTypedFeature() {
            FeatureModel model = parser.parse("""
                    features
                        Root
                            optional
                                Integer Speed
                    """);

            assertThat(model.tree().requireFeature("Speed").type()).isEqualTo("Integer");
        }

        @Test
        @DisplayName("comments are ignored")
        void ignoresComments() {
            FeatureModel model = parser.parse("""
                    /* header
                       comment */
                    features
                        Root // the root
                            optional
                                A
                    """);

            assertThat(model.tree().names()).containsExactly("Root", "A");
        }
    }

    @Nested
    @DisplayName("Constraints")
    class Constraints {

        @Test
        @DisplayName("requires / excludes and multi-line constraints are parsed in source order")
        void parsesConstraintForms() {
            FeatureModel model = TestModels.parse(TestModels.CARDINALITY);

            assertThat(model.constraints()).hasSize(3);
            Expression requires = model.constraints().get(0).expression();
            assertThat(requires)
                    .isEqualTo(new Expression.Implies(
                            new Expression.Literal("\"Roof Rack\""), new Expression.Literal("Combustion")));
            Expression excludes = model.constraints().get(1).expression();
            assertThat(excludes)
                    .isEqualTo(new Expression.Implies(
                            new Expression.Literal("Towbar"),
                            new Expression.Not(new Expression.Literal("Electric"))));
            assertThat(model.constraints().get(2).line()).isEqualTo(18);
        }

        @Test
        @DisplayName("bare reference resolves to a quoted feature name")
        void resolvesBareReferenceToQuotedName() {
            FeatureModel model = parser.parse("""
                    features
                        "My Root"
                            optional
                                "Extra"

                    constraints
                        Extra => "My Root"
                    """);

            Set<String> referenced = new java.util.HashSet<>();
            model.constraints().get(0).expression().collectFeatures(referenced);
            assertThat(referenced).containsExactlyInAnyOrder("\"Extra\"", "\"My Root\"");
        }

        @Test
        @DisplayName("constraint referencing an undeclared feature → MalformedModelException")
        void rejectsUndefinedReference() {
            assertThatThrownBy(() -> parser.parse("""
                            features
                                Root
                                    optional
                                        A

                            constraints
                                A => Missing
                            """))
                    .isInstanceOf(MalformedModelException.class)
                    .hasMessageContaining("Missing");
        }

        @Test
        @DisplayName("dangling operator → ConstraintSyntaxException with line and column")
        void rejectsSyntaxError() {
            assertThatThrownBy(() -> parser.parse("""
                            features
                                Root
                                    optional
                                        A

                            constraints
                                A &
                            """))
                    .isInstanceOf(ConstraintSyntaxException.class)
                    .satisfies(e -> assertThat(((ModelLoadException) e).line()).isEqualTo(7));
        }

        @Test
        @DisplayName("arithmetic constraints are not supported")
        void rejectsArithmetic() {
            assertThatThrownBy(() -> parser.parse("""
                            features
                                Root
                                    optional
                                        A

                            constraints
                                A > 3
                            """))
                    .isInstanceOf(ConstraintSyntaxException.class);
        }
    }

    @Nested
    @DisplayName("Malformed models")
    class Malformed {

        @Test
        @DisplayName("empty text → MalformedModelException for the whole input")
        void rejectsEmptyText() {
            assertThatThrownBy(() -> parser.parse("   \n"))
                    .isInstanceOf(MalformedModelException.class)
                    .satisfies(e -> assertThat(((ModelLoadException) e).location()).isEqualTo("input"));
        }

        @Test
        @DisplayName("missing features section")
        void rejectsMissingFeaturesSection() {
            assertThatThrownBy(() -> parser.parse("namespace Lonely\n"))
                    .isInstanceOf(MalformedModelException.class)
                    .hasMessageContaining("features");
        }

        @Test
        @DisplayName("duplicate feature name")
        void rejectsDuplicateFeature() {
            assertThatThrownBy(() -> parser.parse("""
                            features
                                Root
                                    optional
                                        A
                                        A
                            """))
                    .isInstanceOf(MalformedModelException.class)
                    .hasMessageContaining("Duplicate feature name 'A'")
                    .satisfies(e -> assertThat(((ModelLoadException) e).line()).isEqualTo(5));
        }

        @Test
        @DisplayName("feature directly under a feature (no group keyword)")
        void rejectsFeatureWithoutGroup() {
            assertThatThrownBy(() -> parser.parse("""
                            features
                                Root
                                    A
                            """))
                    .isInstanceOf(MalformedModelException.class)
                    .hasMessageContaining("inside a group");
        }

        @Test
        @DisplayName("group without children")
        void rejectsEmptyGroup() {
            assertThatThrownBy(() -> parser.parse("""
                            features
                                Root
                                    optional
                            """))
                    .isInstanceOf(MalformedModelException.class)
                    .hasMessageContaining("has no children");
        }

        @Test
        @DisplayName("two root features")
        void rejectsSecondRoot() {
            assertThatThrownBy(() -> parser.parse("""
                            features
                                Root
                                    optional
                                        A
                                Other
                            """))
                    .isInstanceOf(MalformedModelException.class)
                    .hasMessageContaining("more than one root");
        }

        @Test
        @DisplayName("siblings at different indentation")
        void rejectsInconsistentIndentation() {
            assertThatThrownBy(() -> parser.parse("""
                            features
                                Root
                                    optional
                                        A
                                      B
                            """))
                    .isInstanceOf(MalformedModelException.class)
                    .hasMessageContaining("ndentation");
        }

        @Test
        @DisplayName("cardinality whose lower bound exceeds the child count")
        void rejectsUnreachableCardinality() {
            assertThatThrownBy(() -> parser.parse("""
                            features
                                Root
                                    [3..3]
                                        A
                                        B
                            """))
                    .isInstanceOf(MalformedModelException.class)
                    .hasMessageContaining("[3..3]")
                    .hasMessageContaining("2 children");
        }

        @Test
        @DisplayName("imports section is rejected")
        void rejectsImports() {
            assertThatThrownBy(() -> parser.parse("""
                            imports
                                Other as o
                            features
                                Root
                            """))
                    .isInstanceOf(MalformedModelException.class)
                    .hasMessageContaining("imports");
        }
    }
}
