package io.inlinerepl.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Output unit of the value serializer: either a colored string leaf or a sequence of nested
 * elements.
 *
 * <p>
 * Elements are produced fresh for every serialized value and carry no identity.
 */
public sealed interface ColoredElement {

    /** Color of this element, or {@code null} when the element is uncolored. */
    Color color();

    /** A single string with an optional color. */
    record Leaf(String content, Color color) implements ColoredElement {
        public Leaf {
            Objects.requireNonNull(content, "content must not be null");
        }
    }

    /** An ordered sequence of child elements with an optional color. */
    record Composite(List<ColoredElement> children, Color color) implements ColoredElement {
        public Composite {
            children = List.copyOf(children);
        }
    }

    static Leaf leaf(String content, Color color) {
        return new Leaf(content, color);
    }

    static Leaf leaf(String content) {
        return new Leaf(content, null);
    }

    static Composite composite(Color color, ColoredElement... children) {
        return new Composite(List.of(children), color);
    }

    /**
     * Flattens this element into its leaves, depth-first and left to right. A leaf flattens to
     * itself.
     */
    default List<Leaf> flatten() {
        List<Leaf> out = new ArrayList<>();
        collect(this, out);
        return List.copyOf(out);
    }

    /** Concatenated content of all leaves. */
    default String text() {
        StringBuilder sb = new StringBuilder();
        for (Leaf leaf : flatten()) {
            sb.append(leaf.content());
        }
        return sb.toString();
    }

    private static void collect(ColoredElement element, List<Leaf> out) {
        if (element instanceof Leaf leaf) {
            out.add(leaf);
        } else if (element instanceof Composite composite) {
            for (ColoredElement child : composite.children()) {
                collect(child, out);
            }
        }
    }
}
