package com.jcomp.token;

public enum TokenKind {
    IDENTIFIER,
    KEYWORD,
    INTEGER,
    FLOAT,
    STRING,
    CHAR,
    PUNCT,
    // Synthetic, only ever produced by the Normalizer
    CLAUSE_SEPARATOR,
    MAP_SEPARATOR
}
