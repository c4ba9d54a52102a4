package io.inlinerepl.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

/** Tests for {@link ColoredElement} and {@link ExecutionResult}. */
class ColoredElementTest {

    @Test
    void leafFlattensToItself() {
        ColoredElement.Leaf leaf = ColoredElement.leaf("42", Color.NUMBER);

        assertThat(leaf.flatten()).containsExactly(leaf);
        assertThat(leaf.text()).isEqualTo("42");
    }

    @Test
    void compositeFlattensDepthFirst() {
        ColoredElement element = ColoredElement.composite(
                null,
                ColoredElement.leaf("["),
                ColoredElement.composite(null, ColoredElement.leaf("1", Color.NUMBER), ColoredElement.leaf(", ")),
                ColoredElement.leaf("2", Color.NUMBER),
                ColoredElement.leaf("]"));

        assertThat(element.flatten()).extracting(ColoredElement.Leaf::content).containsExactly("[", "1", ", ", "2", "]");
        assertThat(element.text()).isEqualTo("[1, 2]");
    }

    @Test
    void errorResultHasNoLine() {
        ExecutionResult result = ExecutionResult.error("boom");

        assertThat(result.isError()).isTrue();
        assertThat(result.lineNumber()).isNull();
        assertThat(result.element().color()).isEqualTo(Color.ERROR);
        assertThat(result.toString()).isEqualTo("ExecutionResult[ERROR, boom]");
    }

    @Test
    void resultRequiresElement() {
        assertThatThrownBy(() -> ExecutionResult.execution(1, null))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("element");
    }
}
