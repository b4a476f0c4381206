package com.jcomp.token;

import org.eclipse.collections.api.list.ImmutableList;

/**
 * The comprehension exactly as written, before any interpretation. Can be consumed once.
 */
public final class RawClauseStream {
    private final String source;
    private final ImmutableList<Token> tokens;
    private boolean consumed;

    public RawClauseStream(String source, ImmutableList<Token> tokens) {
        this.source = source;
        this.tokens = tokens;
    }

    public String source() {
        return source;
    }

    public int size() {
        return tokens.size();
    }

    public ImmutableList<Token> consume() {
        if (consumed) {
            throw new IllegalStateException("Clause stream already consumed: " + source);
        }
        consumed = true;
        return tokens;
    }
}
