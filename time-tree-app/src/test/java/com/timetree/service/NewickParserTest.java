package com.timetree.service;

import com.timetree.config.TimeTreeConfig;
import com.timetree.model.Node;
import com.timetree.model.TimeTree;
import com.timetree.model.TimeTreeException.InvalidAge;
import com.timetree.model.TimeTreeException.MalformedDescription;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class NewickParserTest {

    private static final String FOUR_LEAF = "(A:1,(B:1,C:2):1):0;";

    private NewickParser parser;

    @BeforeEach
    void setUp() {
        parser = new NewickParser(new TimeTreeConfig());
    }

    private static Node node(TimeTree tree, String label) {
        return tree.findByLabel(label).orElseThrow();
    }

    @Nested
    @DisplayName("ages")
    class Ages {

        @Test
        void subtractsBranchLengthFromParentAge() {
            TimeTree tree = parser.parse(FOUR_LEAF, 3.0);

            Node internal = tree.root().getChildren().get(1);
            assertThat(tree.root().getAge()).isEqualTo(3.0);
            assertThat(node(tree, "A").getAge()).isEqualTo(2.0);
            assertThat(internal.getAge()).isEqualTo(2.0);
            assertThat(node(tree, "B").getAge()).isEqualTo(1.0);
            assertThat(node(tree, "C").getAge()).isEqualTo(0.0);
            assertThat(tree.validate()).isTrue();
        }

        @Test
        void rejectsBranchLongerThanRemainingAge() {
            assertThatThrownBy(() -> parser.parse(FOUR_LEAF, 0.0))
                    .isInstanceOf(InvalidAge.class)
                    .hasMessageContaining("negative age");
        }

        @Test
        void defaultRootAgeIsZero() {
            assertThatThrownBy(() -> parser.parse(FOUR_LEAF)).isInstanceOf(InvalidAge.class);
            assertThat(parser.parse("(A:0,B:0);").root().getAge()).isZero();
        }

        @Test
        void subtractsEachBranchFromItsParent() {
            TimeTree tree = parser.parse("((A:0.5):0.25);", 0.75);

            assertThat(tree.root().getChildren().get(0).getAge()).isEqualTo(0.5);
            assertThat(node(tree, "A").getAge()).isZero();
        }

        @Test
        void rejectsBranchOverhangingParentByAnyAmount() {
            assertThatThrownBy(() -> parser.parse("(A:1.0000000000001,B:1);", 1.0))
                    .isInstanceOf(InvalidAge.class)
                    .hasMessageContaining("'A'");
        }

        @Test
        void leafAlignedAbsorbsRoundingInSummedLengths() {
            TimeTree tree = parser.parseLeafAligned("((A:0.2):0.1,(B:0.1):0.2);");

            assertThat(tree.validate()).isTrue();
            assertThat(node(tree, "A").getAge()).isGreaterThanOrEqualTo(0.0).isCloseTo(0.0, within(1e-12));
            assertThat(node(tree, "B").getAge()).isGreaterThanOrEqualTo(0.0).isCloseTo(0.0, within(1e-12));
        }

        @Test
        void leafAlignedPutsYoungestNodeAtZero() {
            TimeTree tree = parser.parseLeafAligned(FOUR_LEAF);

            assertThat(tree.root().getAge()).isEqualTo(3.0);
            assertThat(node(tree, "C").getAge()).isZero();
            assertThat(node(tree, "A").getAge()).isEqualTo(2.0);
        }

        @Test
        void missingLengthUsesDefaultBranchLength() {
            TimeTree tree = parser.parse("(A,B:0.5)", 2.0);

            assertThat(node(tree, "A").getAge()).isEqualTo(1.0);
            assertThat(node(tree, "B").getAge()).isEqualTo(1.5);
        }

        @Test
        void defaultBranchLengthIsConfigurable() {
            TimeTreeConfig config = new TimeTreeConfig();
            config.setDefaultBranchLength(0.25);

            TimeTree tree = new NewickParser(config).parse("(A,B);", 1.0);

            assertThat(node(tree, "A").getAge()).isEqualTo(0.75);
        }

        @Test
        void rootLengthSetsOrigin() {
            TimeTree tree = parser.parse("(A:1,B:1):0.5;", 1.0);

            assertThat(tree.origin()).hasValue(1.5);
        }

        @Test
        void noRootLengthMeansNoOrigin() {
            TimeTree tree = parser.parse("(A:1,B:1);", 1.0);

            assertThat(tree.origin()).isEmpty();
        }

        @Test
        void acceptsScientificNotation() {
            TimeTree tree = parser.parse("(A:1e-3,B:2.5E+0);", 3.0);

            assertThat(node(tree, "A").getAge()).isCloseTo(2.999, within(1e-12));
            assertThat(node(tree, "B").getAge()).isEqualTo(0.5);
        }
    }

    @Nested
    @DisplayName("structure")
    class Structure {

        @Test
        void keepsChildOrderAndTopology() {
            TimeTree tree = parser.parse(FOUR_LEAF, 3.0);

            assertThat(tree.size()).isEqualTo(5);
            assertThat(tree.leaves()).extracting(Node::getLabel).containsExactly("A", "B", "C");
            assertThat(tree.parent(node(tree, "B"))).isEqualTo(tree.parent(node(tree, "C")));
        }

        @Test
        void ignoresWhitespaceBetweenTokens() {
            TimeTree tree = parser.parse("  ( A : 1 ,\n ( B:1 , C : 2 ) : 1 ) : 0 ;  ", 3.0);

            assertThat(tree.leaves()).extracting(Node::getAge).containsExactly(2.0, 1.0, 0.0);
        }

        @Test
        void terminatorIsOptional() {
            assertThat(parser.parse("(A:1,(B:1,C:2):1):0", 3.0).size()).isEqualTo(5);
        }

        @Test
        void anonymousNodesGetDistinctIds() {
            TimeTree tree = parser.parse("((:1,:1):1,:2);", 2.0);

            assertThat(tree.size()).isEqualTo(5);
            assertThat(tree.nodes()).allSatisfy(n -> assertThat(n.hasLabel()).isFalse());
        }

        @Test
        void readsInternalLabels() {
            TimeTree tree = parser.parse("((B:1,C:1)BC:1,A:2)root;", 2.0);

            assertThat(tree.root().getLabel()).isEqualTo("root");
            assertThat(node(tree, "BC").getChildren()).extracting(Node::getLabel).containsExactly("B", "C");
        }

        @Test
        void readsQuotedLabels() {
            TimeTree tree = parser.parse("('Homo sapiens':1,\"Pan, troglodytes\":1);", 1.0);

            assertThat(tree.leaves()).extracting(Node::getLabel)
                    .containsExactly("Homo sapiens", "Pan, troglodytes");
        }

        @Test
        void readsAnnotations() {
            TimeTree tree = parser.parse("(A[&rate=\"0.5\",type=\"x\"]:1,B:1)[&posterior=\"1.0\"];", 1.0);

            assertThat(node(tree, "A").getAnnotations()).containsOnly(
                    entry("rate", "0.5"), entry("type", "x"));
            assertThat(tree.root().getAnnotations()).containsEntry("posterior", "1.0");
        }

        @Test
        void readsDoubledQuotesInsideQuotedStrings() {
            TimeTree tree = parser.parse("('it''s':1,B[&note=\"say \"\"hi\"\"\"]:1);", 1.0);

            assertThat(tree.leaves()).extracting(Node::getLabel).containsExactly("it's", "B");
            assertThat(node(tree, "B").getAnnotations()).containsEntry("note", "say \"hi\"");
        }

        @Test
        void readsVeryDeepNesting() {
            int depth = 20_000;
            String text = "(".repeat(depth) + "A:1" + ",B:1):1".repeat(depth) + ";";

            TimeTree tree = parser.parseLeafAligned(text);

            assertThat(tree.size()).isEqualTo(2 * depth + 1);
            assertThat(tree.leafCount()).isEqualTo(depth + 1);
            assertThat(tree.root().getAge()).isEqualTo(depth);
            assertThat(node(tree, "A").getAge()).isZero();
        }

        @Test
        void singleLeafTree() {
            TimeTree tree = parser.parse("A;", 4.0);

            assertThat(tree.size()).isEqualTo(1);
            assertThat(tree.root().getLabel()).isEqualTo("A");
        }
    }

    @Nested
    @DisplayName("malformed input")
    class MalformedInput {

        @Test
        void rejectsEmptyText() {
            assertThatThrownBy(() -> parser.parse("   ")).isInstanceOf(MalformedDescription.class);
            assertThatThrownBy(() -> parser.parse(null)).isInstanceOf(MalformedDescription.class);
        }

        @Test
        void rejectsMissingCloseBracket() {
            assertThatThrownBy(() -> parser.parse("(A:1,(B:1,C:2):1", 3.0))
                    .isInstanceOf(MalformedDescription.class)
                    .hasMessageContaining("Expected ')'");
        }

        @Test
        void rejectsExtraCloseBracket() {
            assertThatThrownBy(() -> parser.parse("(A:1,B:1));", 3.0))
                    .isInstanceOf(MalformedDescription.class)
                    .hasMessageContaining("after end of tree");
        }

        @Test
        void rejectsTrailingGarbage() {
            assertThatThrownBy(() -> parser.parse("(A:1,B:1); extra", 3.0))
                    .isInstanceOfSatisfying(MalformedDescription.class,
                            e -> assertThat(e.getPosition()).isEqualTo(11));
        }

        @Test
        void rejectsSecondTerminator() {
            assertThatThrownBy(() -> parser.parse("(A:1,B:1);;", 3.0))
                    .isInstanceOf(MalformedDescription.class);
        }

        @Test
        void rejectsSignedLength() {
            assertThatThrownBy(() -> parser.parse("(A:-1,B:1);", 3.0))
                    .isInstanceOf(MalformedDescription.class)
                    .hasMessageContaining("Invalid branch length '-1'");
            assertThatThrownBy(() -> parser.parse("(A:+1,B:1);", 3.0))
                    .isInstanceOf(MalformedDescription.class);
        }

        @Test
        void rejectsNonNumericLength() {
            assertThatThrownBy(() -> parser.parse("(A:abc,B:1);", 3.0))
                    .isInstanceOf(MalformedDescription.class);
        }

        @Test
        void rejectsMissingLengthAfterColon() {
            assertThatThrownBy(() -> parser.parse("(A:,B:1);", 3.0))
                    .isInstanceOf(MalformedDescription.class)
                    .hasMessageContaining("Expected branch length");
        }

        @Test
        void rejectsUnknownCharacters() {
            assertThatThrownBy(() -> parser.parse("(A:1,B#:1);", 3.0))
                    .isInstanceOf(MalformedDescription.class)
                    .hasMessageContaining("Unrecognized character '#'");
        }

        @Test
        void rejectsUnterminatedAnnotation() {
            assertThatThrownBy(() -> parser.parse("(A[&k=\"v\":1,B:1);", 3.0))
                    .isInstanceOf(MalformedDescription.class);
        }

        @Test
        void rejectsUnterminatedQuote() {
            assertThatThrownBy(() -> parser.parse("('A:1,B:1);", 3.0))
                    .isInstanceOf(MalformedDescription.class)
                    .hasMessageContaining("Unterminated");
        }
    }
}
