package com.jcomp.token;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.ListIterable;
import org.eclipse.collections.impl.factory.Lists;

/**
 * An opaque run of tokens handed through to the host language unchanged: a body expression,
 * a pattern, an iterable or a condition.
 */
public record Fragment(ImmutableList<Token> tokens) {

    public static Fragment of(ListIterable<Token> tokens) {
        return new Fragment(Lists.immutable.withAll(tokens));
    }

    public static Fragment empty() {
        return new Fragment(Lists.immutable.empty());
    }

    public boolean isEmpty() {
        return tokens.isEmpty();
    }

    public int size() {
        return tokens.size();
    }

    public Token get(int index) {
        return tokens.get(index);
    }

    /**
     * Offset of the first token, or -1 for an empty fragment.
     */
    public int position() {
        return tokens.isEmpty() ? -1 : tokens.getFirst().position();
    }

    public String text() {
        return tokens.collect(Token::source).makeString(" ");
    }

    @Override
    public String toString() {
        return text();
    }
}
