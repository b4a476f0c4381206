package com.jcomp.comprehension;

import com.jcomp.token.Token;
import com.jcomp.token.TokenKind;
import org.eclipse.collections.api.list.ImmutableList;

/**
 * Token stream with explicit clause separators before every clause keyword and, for mapping
 * bodies, a map separator in place of the key/value colon.
 */
public record NormalizedStream(ImmutableList<Token> tokens) {

    /**
     * Tokens before the first clause separator.
     */
    public ImmutableList<Token> body() {
        return tokens.subList(0, firstSeparator());
    }

    /**
     * Tokens from the first clause separator onwards.
     */
    public ImmutableList<Token> clauses() {
        return tokens.subList(firstSeparator(), tokens.size());
    }

    private int firstSeparator() {
        int index = tokens.detectIndex(token -> token.kind() == TokenKind.CLAUSE_SEPARATOR);
        return index < 0 ? tokens.size() : index;
    }
}
