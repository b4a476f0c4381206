package com.jcomp.comprehension;

import com.jcomp.ComprehensionSyntaxException;
import com.jcomp.ErrorKind;
import com.jcomp.token.Lexer;
import com.jcomp.token.Token;
import com.jcomp.token.TokenKind;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class NormalizerTest {

    private NormalizedStream normalize(String source) {
        return new Normalizer().normalize(new Lexer().tokenize(source));
    }

    private String render(NormalizedStream stream) {
        return stream.tokens().collect(Token::source).makeString(" ");
    }

    @Test
    public void testSeparatorBeforeEveryClause() {
        NormalizedStream stream = normalize("x for x in xs if x > 1 for y in ys");

        assertEquals("x , for x in xs , if x > 1 , for y in ys", render(stream));
        assertEquals(1, stream.body().size());
        assertEquals(TokenKind.CLAUSE_SEPARATOR, stream.clauses().getFirst().kind());
    }

    @Test
    public void testFirstTopLevelColonBecomesMapSeparator() {
        NormalizedStream stream = normalize("k : v for k in ks");

        assertEquals("k => v , for k in ks", render(stream));
        assertEquals(TokenKind.MAP_SEPARATOR, stream.body().get(1).kind());
    }

    @Test
    public void testOnlyFirstUnparenthesizedColonIsReplaced() {
        NormalizedStream stream = normalize("k : (c ? a : b) for k in ks");

        long separators = stream.body().count(token -> token.kind() == TokenKind.MAP_SEPARATOR);
        assertEquals(1, separators);
        assertTrue(stream.body().anySatisfy(token -> token.isPunct(":")));
    }

    @Test
    public void testColonInsideBracesIsNotASeparator() {
        NormalizedStream stream = normalize("{\"a\" : x} for x in xs");

        assertTrue(stream.body().noneSatisfy(token -> token.kind() == TokenKind.MAP_SEPARATOR));
    }

    @Test
    public void testLaterTopLevelColonStaysInValue() {
        NormalizedStream stream = normalize("k : a ? b : c for k in ks");

        assertEquals("k => a ? b : c , for k in ks", render(stream));
    }

    @Test
    public void testKeywordsInsideGroupsAreNotClauseBoundaries() {
        NormalizedStream stream = normalize("[for] for x in (if)");

        assertEquals(3, stream.body().size());
        assertEquals(1, stream.tokens().count(token -> token.kind() == TokenKind.CLAUSE_SEPARATOR));
    }

    @Test
    public void testIfBeforeFirstForStaysInBody() {
        NormalizedStream stream = normalize("x if c for x in xs");

        assertEquals("x if c , for x in xs", render(stream));
    }

    @Test
    public void testMissingFor() {
        ComprehensionSyntaxException e = assertThrows(ComprehensionSyntaxException.class,
            () -> normalize("x if x > 1"));
        assertEquals(ErrorKind.MISSING_LOOP_CLAUSE, e.getKind());
    }

    @Test
    public void testEmptyInput() {
        ComprehensionSyntaxException e = assertThrows(ComprehensionSyntaxException.class, () -> normalize(""));
        assertEquals(ErrorKind.MISSING_LOOP_CLAUSE, e.getKind());
    }

    @Test
    public void testNothingBeforeFirstFor() {
        ComprehensionSyntaxException e = assertThrows(ComprehensionSyntaxException.class,
            () -> normalize("for x in xs"));
        assertEquals(ErrorKind.EMPTY_BODY, e.getKind());
        assertEquals(0, e.getPosition());
    }
}
