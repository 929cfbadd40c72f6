package com.vidnyan.causeway.domain.syntax;

import java.util.ArrayList;
import java.util.List;

/**
 * Immutable scope path threaded through tree traversals.
 * {@link #enter(String)} returns a new context; the receiver is never changed.
 */
public record ScopeContext(List<String> segments) {

    public static final String MODULE = "__module__";

    public ScopeContext {
        segments = List.copyOf(segments);
    }

    public static ScopeContext module() {
        return new ScopeContext(List.of());
    }

    public ScopeContext enter(String name) {
        List<String> next = new ArrayList<>(segments);
        next.add(name);
        return new ScopeContext(next);
    }

    public boolean isModule() {
        return segments.isEmpty();
    }

    /**
     * Dot-joined scope name, {@value #MODULE} at top level.
     */
    public String qualifiedName() {
        return isModule() ? MODULE : String.join(".", segments);
    }

    /**
     * Qualify a name declared in this scope.
     */
    public String qualify(String name) {
        return isModule() ? name : qualifiedName() + "." + name;
    }

    /**
     * Scope names from innermost outward, ending with the module scope.
     */
    public static List<String> lookupChain(String qualifiedScope) {
        List<String> chain = new ArrayList<>();
        if (!MODULE.equals(qualifiedScope)) {
            String current = qualifiedScope;
            chain.add(current);
            int dot;
            while ((dot = current.lastIndexOf('.')) > 0) {
                current = current.substring(0, dot);
                chain.add(current);
            }
        }
        chain.add(MODULE);
        return chain;
    }
}
