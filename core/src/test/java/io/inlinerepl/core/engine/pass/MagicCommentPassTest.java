package io.inlinerepl.core.engine.pass;

import static io.inlinerepl.core.engine.pass.PassHarness.squash;
import static org.assertj.core.api.Assertions.assertThat;

import io.inlinerepl.core.model.TransformOptions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("MagicCommentPass")
class MagicCommentPassTest {

    private static final TransformOptions MAGIC =
            TransformOptions.builder().magicComments(true).build();

    private final MagicCommentPass pass = new MagicCommentPass();

    private String apply(String source) {
        return squash(PassHarness.apply(pass, source, MAGIC));
    }

    @Test
    void followsMagicCommentsOption() {
        assertThat(pass.isEnabled(TransformOptions.DEFAULTS)).isFalse();
        assertThat(pass.isEnabled(MAGIC)).isTrue();
    }

    @Test
    @DisplayName("A marked declaration gets a follow-up capture and the marker disappears")
    void capturesMarkedDeclaration() {
        assertThat(apply("const x = 5; //?")).isEqualTo("const x = 5; __debug(1, x);");
    }

    @Test
    void wrapsMarkedExpression() {
        assertThat(apply("foo() //?")).isEqualTo("__debug(1, foo());");
    }

    @Test
    void acceptsBlockCommentMarkers() {
        assertThat(apply("a + b /*?*/")).isEqualTo("__debug(1, a + b);");
    }

    @Test
    void acceptsMarkersWithTrailingText() {
        assertThat(apply("total //? the sum")).isEqualTo("__debug(1, total);");
    }

    @Test
    void capturesNestedStatements() {
        String out = apply("if (c) {\n  y * 2; //?\n}");

        assertThat(out).contains("__debug(2, y * 2);");
    }

    @Test
    void capturesEveryMarkedStatement() {
        assertThat(apply("1 //?\n2\n3 //?")).isEqualTo("__debug(1, 1); 2; __debug(3, 3);");
    }

    @Test
    void ignoresOrdinaryComments() {
        assertThat(apply("x // note")).isEqualTo("x;");
    }

    @Test
    void ignoresMarkerOnItsOwnLine() {
        assertThat(apply("x\n//?")).isEqualTo("x;");
    }

    @Test
    void ignoresMultiDeclaratorDeclarations() {
        assertThat(apply("let a = 1, b = 2; //?")).isEqualTo("let a = 1, b = 2;");
    }

    @Test
    void capturesMarkedPromiseChainAtItsRoot() {
        assertThat(apply("p.then(console.log) //?")).isEqualTo("__debug(1, p).then(console.log);");
    }

    @Test
    void leavesSourceWithoutMarkersUntouched() {
        assertThat(apply("const y = 2;\ny * 2;")).isEqualTo("const y = 2; y * 2;");
    }
}
