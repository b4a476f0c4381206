package com.jcomp.token;

import org.eclipse.collections.api.list.ImmutableList;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

public class LexerTest {

    private ImmutableList<Token> tokenize(String source) {
        return new Lexer().tokenize(source).consume();
    }

    @Test
    public void testInclusiveRangeIsNotAFloat() {
        ImmutableList<Token> tokens = tokenize("1..=10");

        assertEquals(3, tokens.size());
        assertEquals(new Token(TokenKind.INTEGER, "1", 0), tokens.get(0));
        assertEquals(new Token(TokenKind.PUNCT, "..=", 1), tokens.get(1));
        assertEquals(new Token(TokenKind.INTEGER, "10", 4), tokens.get(2));
    }

    @Test
    public void testFloatLiteral() {
        ImmutableList<Token> tokens = tokenize("1.5 + 2");

        assertEquals(TokenKind.FLOAT, tokens.get(0).kind());
        assertEquals("1.5", tokens.get(0).text());
    }

    @Test
    public void testKeywordsAndIdentifiers() {
        ImmutableList<Token> tokens = tokenize("x for x in xs if true");

        assertEquals(TokenKind.IDENTIFIER, tokens.get(0).kind());
        assertTrue(tokens.get(1).isKeyword("for"));
        assertEquals(TokenKind.IDENTIFIER, tokens.get(2).kind());
        assertTrue(tokens.get(3).isKeyword("in"));
        assertEquals(TokenKind.IDENTIFIER, tokens.get(4).kind());
        assertTrue(tokens.get(5).isKeyword("if"));
        assertTrue(tokens.get(6).isKeyword("true"));
    }

    @Test
    public void testIdentifierContainingKeyword() {
        ImmutableList<Token> tokens = tokenize("format input");

        assertEquals(TokenKind.IDENTIFIER, tokens.get(0).kind());
        assertEquals(TokenKind.IDENTIFIER, tokens.get(1).kind());
    }

    @Test
    public void testStringAndCharLiterals() {
        ImmutableList<Token> tokens = tokenize("\"a\\\"b\\n\" ':' '\\''");

        assertEquals(new Token(TokenKind.STRING, "a\"b\n", 0), tokens.get(0));
        assertEquals(TokenKind.CHAR, tokens.get(1).kind());
        assertEquals(":", tokens.get(1).text());
        assertEquals("'", tokens.get(2).text());
        assertEquals("\"a\\\"b\\n\"", tokens.get(0).source());
    }

    @Test
    public void testCompoundOperatorsWinOverSingleOnes() {
        ImmutableList<Token> tokens = tokenize("n += x == y;");

        assertEquals("+=", tokens.get(1).text());
        assertEquals("==", tokens.get(3).text());
        assertTrue(tokens.getLast().isPunct(";"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"\"open", "'a", "'ab'", "x @ y", "(x]", "[x", "x)", "\"bad \\q escape\""})
    public void testLexicalErrors(String source) {
        assertThrows(LexerException.class, () -> tokenize(source));
    }

    @Test
    public void testUnclosedGroupReportsOpeningPosition() {
        LexerException e = assertThrows(LexerException.class, () -> tokenize("x for x in (1, 2"));
        assertEquals(11, e.getPosition());
    }

    @Test
    public void testStreamCanBeConsumedOnce() {
        RawClauseStream stream = new Lexer().tokenize("x for x in xs");
        stream.consume();

        assertThrows(IllegalStateException.class, stream::consume);
    }
}
