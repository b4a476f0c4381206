package com.jcomp.host;

import org.eclipse.collections.api.list.ImmutableList;

public sealed interface Pattern {
    record Bind(String name) implements Pattern {}
    record Wildcard() implements Pattern {}
    /** Matches tuples and lists of the same arity, element by element. */
    record TuplePattern(ImmutableList<Pattern> elements) implements Pattern {}
}
