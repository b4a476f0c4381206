package com.jcomp.token;

import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.set.ImmutableSet;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Sets;

import java.util.ArrayDeque;
import java.util.Deque;

public class Lexer {
    private static final ImmutableSet<String> KEYWORDS = Sets.immutable.of("for", "in", "if", "true", "false");

    // Longest first, so "..=" wins over ".." and "==" over "="
    private static final String[] OPERATORS = {
        "..=", "..", "==", "!=", "<=", ">=", "&&", "||", "+=", "-=", "*=", "/=", "%=",
        "+", "-", "*", "/", "%", "<", ">", "=", "!", "?", ":", ";", ",",
        "(", ")", "[", "]", "{", "}"
    };

    public RawClauseStream tokenize(String source) {
        if (source == null) {
            throw new IllegalArgumentException("Comprehension source must not be null");
        }

        MutableList<Token> tokens = Lists.mutable.empty();
        Deque<Token> open = new ArrayDeque<>();
        int i = 0;
        while (i < source.length()) {
            char c = source.charAt(i);
            if (Character.isWhitespace(c)) {
                i++;
            } else if (Character.isDigit(c)) {
                i = readNumber(source, i, tokens);
            } else if (Character.isLetter(c) || c == '_') {
                int start = i;
                while (i < source.length() && (Character.isLetterOrDigit(source.charAt(i)) || source.charAt(i) == '_')) {
                    i++;
                }
                String word = source.substring(start, i);
                tokens.add(new Token(KEYWORDS.contains(word) ? TokenKind.KEYWORD : TokenKind.IDENTIFIER, word, start));
            } else if (c == '"') {
                i = readQuoted(source, i, '"', TokenKind.STRING, tokens);
            } else if (c == '\'') {
                i = readQuoted(source, i, '\'', TokenKind.CHAR, tokens);
            } else {
                Token token = readOperator(source, i);
                checkNesting(token, open);
                tokens.add(token);
                i += token.text().length();
            }
        }

        if (!open.isEmpty()) {
            Token unclosed = open.peek();
            throw new LexerException("Unclosed '" + unclosed.text() + "'", unclosed.position());
        }
        return new RawClauseStream(source, tokens.toImmutable());
    }

    private int readNumber(String source, int start, MutableList<Token> tokens) {
        int i = start;
        while (i < source.length() && Character.isDigit(source.charAt(i))) {
            i++;
        }
        // "1..3" is a range, "1.5" a float
        boolean fraction = i + 1 < source.length()
            && source.charAt(i) == '.'
            && Character.isDigit(source.charAt(i + 1));
        if (fraction) {
            i++;
            while (i < source.length() && Character.isDigit(source.charAt(i))) {
                i++;
            }
            tokens.add(new Token(TokenKind.FLOAT, source.substring(start, i), start));
        } else {
            tokens.add(new Token(TokenKind.INTEGER, source.substring(start, i), start));
        }
        return i;
    }

    private int readQuoted(String source, int start, char quote, TokenKind kind, MutableList<Token> tokens) {
        StringBuilder sb = new StringBuilder();
        int i = start + 1;
        while (true) {
            if (i >= source.length()) {
                throw new LexerException("Unterminated " + (kind == TokenKind.CHAR ? "char" : "string") + " literal", start);
            }
            char c = source.charAt(i);
            if (c == quote) {
                i++;
                break;
            }
            if (c == '\\') {
                if (i + 1 >= source.length()) {
                    throw new LexerException("Dangling escape", i);
                }
                char escaped = source.charAt(i + 1);
                switch (escaped) {
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    case 'r' -> sb.append('\r');
                    case '\\', '"', '\'' -> sb.append(escaped);
                    default -> throw new LexerException("Unknown escape '\\" + escaped + "'", i);
                }
                i += 2;
            } else {
                sb.append(c);
                i++;
            }
        }

        if (kind == TokenKind.CHAR && sb.length() != 1) {
            throw new LexerException("Char literal must hold exactly one character", start);
        }
        tokens.add(new Token(kind, sb.toString(), start));
        return i;
    }

    private Token readOperator(String source, int position) {
        for (String op : OPERATORS) {
            if (source.startsWith(op, position)) {
                return new Token(TokenKind.PUNCT, op, position);
            }
        }
        throw new LexerException("Unexpected character '" + source.charAt(position) + "'", position);
    }

    private void checkNesting(Token token, Deque<Token> open) {
        if (token.opensGroup()) {
            open.push(token);
        } else if (token.closesGroup()) {
            Token opener = open.poll();
            if (opener == null || !matches(opener.text(), token.text())) {
                throw new LexerException("Unbalanced '" + token.text() + "'", token.position());
            }
        }
    }

    private static boolean matches(String opener, String closer) {
        return switch (opener) {
            case "(" -> closer.equals(")");
            case "[" -> closer.equals("]");
            case "{" -> closer.equals("}");
            default -> false;
        };
    }
}
