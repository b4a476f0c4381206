package com.jcomp.comprehension;

import com.jcomp.ComprehensionSyntaxException;
import com.jcomp.ErrorKind;
import com.jcomp.token.Fragment;
import com.jcomp.token.Token;
import com.jcomp.token.TokenKind;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

public class ClauseParser {

    public ClauseList parse(NormalizedStream stream) {
        ImmutableList<Token> tokens = stream.clauses();
        MutableList<Clause> clauses = Lists.mutable.empty();

        int start = 0;
        while (start < tokens.size()) {
            // clauses() always starts on a separator; each segment runs to the next one
            int end = start + 1;
            while (end < tokens.size() && tokens.get(end).kind() != TokenKind.CLAUSE_SEPARATOR) {
                end++;
            }
            clauses.add(parseSegment(tokens.subList(start + 1, end), tokens.get(start).position()));
            start = end;
        }

        return new ClauseList(clauses);
    }

    private Clause parseSegment(ImmutableList<Token> segment, int position) {
        if (segment.isEmpty()) {
            throw new ComprehensionSyntaxException(ErrorKind.UNKNOWN_CLAUSE, "Empty clause", position);
        }

        Token head = segment.getFirst();
        if (head.isKeyword("for")) {
            return parseFor(segment);
        }
        if (head.isKeyword("if")) {
            Fragment condition = Fragment.of(segment.subList(1, segment.size()));
            if (condition.isEmpty()) {
                throw new ComprehensionSyntaxException(ErrorKind.MALFORMED_IF_CLAUSE,
                    "Expected a condition after 'if'", head.position());
            }
            return new Clause.If(condition);
        }
        throw new ComprehensionSyntaxException(ErrorKind.UNKNOWN_CLAUSE,
            "Expected 'for' or 'if' but found '" + head.source() + "'", head.position());
    }

    private Clause parseFor(ImmutableList<Token> segment) {
        Token head = segment.getFirst();
        int in = findTopLevelIn(segment);
        if (in < 0) {
            throw new ComprehensionSyntaxException(ErrorKind.MALFORMED_FOR_CLAUSE,
                "Expected 'in' in 'for' clause", head.position());
        }

        Fragment pattern = Fragment.of(segment.subList(1, in));
        if (pattern.isEmpty()) {
            throw new ComprehensionSyntaxException(ErrorKind.MALFORMED_FOR_CLAUSE,
                "Expected a pattern between 'for' and 'in'", head.position());
        }
        Fragment iterable = Fragment.of(segment.subList(in + 1, segment.size()));
        if (iterable.isEmpty()) {
            throw new ComprehensionSyntaxException(ErrorKind.MALFORMED_FOR_CLAUSE,
                "Expected an iterable after 'in'", segment.get(in).position());
        }
        return new Clause.For(pattern, iterable);
    }

    /**
     * Find the index of the first 'in' keyword that's not inside a bracket group
     */
    private int findTopLevelIn(ImmutableList<Token> segment) {
        int depth = 0;
        for (int i = 1; i < segment.size(); i++) {
            Token token = segment.get(i);
            if (token.opensGroup()) {
                depth++;
            } else if (token.closesGroup()) {
                depth--;
            } else if (depth == 0 && token.isKeyword("in")) {
                return i;
            }
        }
        return -1;
    }
}
