package io.inlinerepl.core.engine.ast;

import java.util.HashSet;
import java.util.Set;
import org.mozilla.javascript.ast.AstRoot;
import org.mozilla.javascript.ast.Name;

/**
 * Hands out identifiers that occur nowhere in a program. Names are reserved on allocation, so
 * two allocations never collide, whatever scopes the generated names end up in.
 */
public final class NameAllocator {

    private final AstRoot root;
    private Set<String> used;
    private int counter;

    public NameAllocator(AstRoot root) {
        this.root = root;
    }

    /** Returns {@code prefix + N} for the lowest N not yet used, counting from 0. */
    public String next(String prefix) {
        if (used == null) {
            used = collect(root);
        }
        String candidate;
        do {
            candidate = prefix + counter++;
        } while (used.contains(candidate));
        used.add(candidate);
        return candidate;
    }

    private static Set<String> collect(AstRoot root) {
        Set<String> names = new HashSet<>();
        root.visit(node -> {
            if (node instanceof Name name) {
                names.add(name.getIdentifier());
            }
            return true;
        });
        return names;
    }
}
