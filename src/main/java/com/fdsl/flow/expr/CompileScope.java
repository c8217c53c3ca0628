package com.fdsl.flow.expr;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Names an expression may refer to, besides builtins and its own lambda
 * parameters.
 *
 * @param self     entity whose attribute is being compiled, or null
 * @param siblings attributes of {@code self} declared before the one being
 *                 compiled; readable as bare names
 * @param entities other entities readable by name (the parents)
 * @param params   endpoint parameters readable by name
 */
public record CompileScope(String self, Set<String> siblings, Set<String> entities, Set<String> params) {

    public static final CompileScope EMPTY = new CompileScope(null, Set.of(), Set.of(), Set.of());

    public CompileScope {
        siblings = Collections.unmodifiableSet(new LinkedHashSet<>(siblings));
        entities = Collections.unmodifiableSet(new LinkedHashSet<>(entities));
        params = Collections.unmodifiableSet(new LinkedHashSet<>(params));
    }

    public static CompileScope forAttribute(String self, List<String> earlierSiblings,
            Collection<String> parents, Collection<String> params) {
        return new CompileScope(self, new LinkedHashSet<>(earlierSiblings), new LinkedHashSet<>(parents),
                new LinkedHashSet<>(params));
    }

    public static CompileScope of(Collection<String> entities, Collection<String> params) {
        return new CompileScope(null, Set.of(), new LinkedHashSet<>(entities), new LinkedHashSet<>(params));
    }
}
