package com.jcomp.token;

/**
 * A single lexical token. {@code text} holds the decoded literal for strings and chars,
 * the source spelling for everything else.
 */
public record Token(TokenKind kind, String text, int position) {

    public static Token clauseSeparator(int position) {
        return new Token(TokenKind.CLAUSE_SEPARATOR, ",", position);
    }

    public static Token mapSeparator(int position) {
        return new Token(TokenKind.MAP_SEPARATOR, "=>", position);
    }

    public boolean isKeyword(String keyword) {
        return kind == TokenKind.KEYWORD && text.equals(keyword);
    }

    public boolean isPunct(String punct) {
        return kind == TokenKind.PUNCT && text.equals(punct);
    }

    public boolean opensGroup() {
        return isPunct("(") || isPunct("[") || isPunct("{");
    }

    public boolean closesGroup() {
        return isPunct(")") || isPunct("]") || isPunct("}");
    }

    /**
     * Spelling as it would appear in source, quotes and escapes included.
     */
    public String source() {
        return switch (kind) {
            case STRING -> "\"" + escape(text, '"') + "\"";
            case CHAR -> "'" + escape(text, '\'') + "'";
            default -> text;
        };
    }

    private static String escape(String s, char quote) {
        StringBuilder sb = new StringBuilder(s.length() + 2);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c == quote) {
                        sb.append('\\');
                    }
                    sb.append(c);
                }
            }
        }
        return sb.toString();
    }
}
