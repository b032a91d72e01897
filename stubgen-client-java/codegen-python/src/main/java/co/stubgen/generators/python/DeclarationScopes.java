package co.stubgen.generators.python;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

/**
 * Names already declared in the module and in each enclosing class body.
 * The module scope sits at the bottom and is never popped.
 */
final class DeclarationScopes {

    private final Deque<Set<String>> scopes = new ArrayDeque<>();

    DeclarationScopes() {
        scopes.push(new HashSet<>());
    }

    void enter() {
        scopes.push(new HashSet<>());
    }

    void exit() {
        if (scopes.size() == 1) {
            throw new IllegalStateException("Cannot leave the module scope");
        }
        scopes.pop();
    }

    /** Records {@code name} in the innermost scope; false when it was already there. */
    boolean declare(String name) {
        return scopes.peek().add(name);
    }

    int depth() {
        return scopes.size();
    }
}
