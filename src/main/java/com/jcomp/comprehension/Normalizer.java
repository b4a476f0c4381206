package com.jcomp.comprehension;

import com.jcomp.ComprehensionSyntaxException;
import com.jcomp.ErrorKind;
import com.jcomp.token.RawClauseStream;
import com.jcomp.token.Token;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Splits the body from the clauses in a single left-to-right pass. Only tokens outside any
 * bracket group count as clause keywords or as the key/value colon.
 */
public class Normalizer {

    public NormalizedStream normalize(RawClauseStream raw) {
        ImmutableList<Token> tokens = raw.consume();
        MutableList<Token> normalized = Lists.mutable.withInitialCapacity(tokens.size() + 4);

        int depth = 0;
        int i = 0;
        boolean mapSeparator = false;
        for (; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (depth == 0 && token.isKeyword("for")) {
                break;
            }
            if (depth == 0 && !mapSeparator && token.isPunct(":")) {
                // The first top-level colon splits key from value; later ones belong to the value
                normalized.add(Token.mapSeparator(token.position()));
                mapSeparator = true;
                continue;
            }
            depth += nesting(token);
            normalized.add(token);
        }

        if (i == tokens.size()) {
            throw new ComprehensionSyntaxException(ErrorKind.MISSING_LOOP_CLAUSE,
                "Comprehension must contain at least one 'for ... in ...' clause", raw.source().length());
        }

        for (; i < tokens.size(); i++) {
            Token token = tokens.get(i);
            if (depth == 0 && (token.isKeyword("for") || token.isKeyword("if"))) {
                if (normalized.isEmpty()) {
                    throw new ComprehensionSyntaxException(ErrorKind.EMPTY_BODY,
                        "Missing comprehension body before '" + token.text() + "'", token.position());
                }
                normalized.add(Token.clauseSeparator(token.position()));
            }
            depth += nesting(token);
            normalized.add(token);
        }

        return new NormalizedStream(normalized.toImmutable());
    }

    private static int nesting(Token token) {
        if (token.opensGroup()) {
            return 1;
        }
        return token.closesGroup() ? -1 : 0;
    }
}
